package com.photonlab.backend.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public record ValidationError(
        String field,
        String message,
        Severity severity
) {
    public static ValidationError error(String field, String message) {
        return new ValidationError(field, message, Severity.ERROR);
    }

    public static ValidationError warning(String field, String message) {
        return new ValidationError(field, message, Severity.WARNING);
    }

    public ValidationError prefixed(String prefix) {
        return new ValidationError(prefix + field, message, severity);
    }

    public enum Severity {
        ERROR,
        WARNING;

        @JsonValue
        public String wire() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
