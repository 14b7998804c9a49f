package com.photonlab.backend.service;

import com.photonlab.backend.domain.ValidationError;
import com.photonlab.backend.domain.ValidationResult;

/**
 * A request carried a configuration with at least one error-level finding.
 */
public class ConfigValidationException extends RuntimeException {

    private final ValidationResult result;

    public ConfigValidationException(ValidationResult result) {
        super(summary(result));
        this.result = result;
    }

    public ValidationResult result() {
        return result;
    }

    private static String summary(ValidationResult result) {
        long count = result.errors().stream()
                .filter(e -> e.severity() == ValidationError.Severity.ERROR)
                .count();
        return "Configuration has " + count + " error(s)";
    }
}
