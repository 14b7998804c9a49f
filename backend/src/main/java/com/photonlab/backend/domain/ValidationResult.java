package com.photonlab.backend.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * All violations found, in rule order. Warnings do not make a configuration invalid.
 */
public record ValidationResult(
        @JsonProperty("is_valid") boolean valid,
        List<ValidationError> errors
) {
    public static ValidationResult of(List<ValidationError> errors) {
        boolean valid = errors.stream().noneMatch(e -> e.severity() == ValidationError.Severity.ERROR);
        return new ValidationResult(valid, List.copyOf(errors));
    }

    @JsonIgnore
    public Optional<String> errorFor(String field) {
        return errors.stream()
                .filter(e -> e.field().equals(field))
                .map(ValidationError::message)
                .findFirst();
    }
}
