package com.platform.netconfig.validation;

import com.platform.netconfig.error.ValidationException;

import java.util.List;

/**
 * Outcome of validating a desired state: success, or every violation of the
 * first check class that failed.
 */
public record ValidationResult(ViolationClass failedClass, List<Violation> violations) {
    
    public ValidationResult {
        violations = List.copyOf(violations);
    }
    
    public static ValidationResult success() {
        return new ValidationResult(null, List.of());
    }
    
    public static ValidationResult failure(ViolationClass failedClass, List<Violation> violations) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("A failed validation needs at least one violation");
        }
        return new ValidationResult(failedClass, violations);
    }
    
    public boolean isValid() {
        return violations.isEmpty();
    }
    
    /**
     * Throws a {@link ValidationException} carrying every violation unless valid.
     */
    public void orThrow() {
        if (!isValid()) {
            throw new ValidationException(violations);
        }
    }
}
