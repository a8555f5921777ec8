package com.platform.netconfig.error;

import com.platform.netconfig.validation.Violation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception for desired-state validation failures. Carries every violation
 * of the failing check class, not just the first.
 */
public class ValidationException extends NetConfigException {
    
    private final List<Violation> violations;
    
    public ValidationException(List<Violation> violations) {
        this(ErrorCode.VALIDATION_ERROR, violations);
    }
    
    public ValidationException(ErrorCode errorCode, List<Violation> violations) {
        super(errorCode, describe(errorCode, violations));
        this.violations = List.copyOf(violations);
    }
    
    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.violations = List.of();
    }
    
    public ValidationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.violations = List.of();
    }
    
    public List<Violation> getViolations() {
        return violations;
    }
    
    private static String describe(ErrorCode errorCode, List<Violation> violations) {
        if (violations.isEmpty()) {
            return errorCode.getDefaultMessage();
        }
        return violations.stream()
            .map(Violation::toString)
            .collect(Collectors.joining("; ", errorCode.getDefaultMessage() + ": ", ""));
    }
}
