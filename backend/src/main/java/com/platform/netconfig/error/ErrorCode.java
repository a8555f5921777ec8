package com.platform.netconfig.error;

/**
 * Standardized error codes for the network configuration reconciler.
 * Each error has a unique code that operators and scripts can act on.
 * 
 * Format: NC-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors (desired state must be fixed)
 * - 2xx: Planning errors (unsatisfiable dependencies)
 * - 3xx: Controller API errors
 * - 4xx: Backup/snapshot errors
 * - 5xx: Run lifecycle errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("NC-100", "Desired state failed validation", ErrorCategory.RECOVERABLE),
    DESIRED_STATE_NOT_FOUND("NC-101", "Desired state document not found", ErrorCategory.RECOVERABLE),
    DESIRED_STATE_UNREADABLE("NC-102", "Desired state document could not be parsed", ErrorCategory.RECOVERABLE),
    UNKNOWN_HARDWARE_PROFILE("NC-103", "Unknown hardware profile", ErrorCategory.RECOVERABLE),
    
    // ==================== Planning Errors (2xx) ====================
    
    CYCLE_DETECTED("NC-200", "Dependency cycle between operations", ErrorCategory.RECOVERABLE),
    UNRESOLVED_DEPENDENCY("NC-201", "Operation depends on an object that does not exist", ErrorCategory.RECOVERABLE),
    
    // ==================== Controller API Errors (3xx) ====================
    
    CONTROLLER_AUTH_FAILED("NC-300", "Controller authentication failed", ErrorCategory.FATAL),
    CONTROLLER_RATE_LIMITED("NC-301", "Controller rate limit exceeded", ErrorCategory.RECOVERABLE),
    CONTROLLER_UNREACHABLE("NC-302", "Controller unreachable", ErrorCategory.RECOVERABLE),
    CONTROLLER_OBJECT_NOT_FOUND("NC-303", "Controller object not found", ErrorCategory.RECOVERABLE),
    CONTROLLER_CONFLICT("NC-304", "Controller rejected change as conflicting", ErrorCategory.RECOVERABLE),
    CONTROLLER_RETRIES_EXHAUSTED("NC-305", "Controller call failed after all retry attempts", ErrorCategory.RECOVERABLE),
    CONTROLLER_UNEXPECTED("NC-310", "Unexpected controller error", ErrorCategory.FATAL),
    
    // ==================== Backup Errors (4xx) ====================
    
    SNAPSHOT_FAILED("NC-400", "Pre-apply snapshot failed", ErrorCategory.FATAL),
    
    // ==================== Run Lifecycle Errors (5xx) ====================
    
    RUN_IN_PROGRESS("NC-500", "Another reconciliation run is in progress", ErrorCategory.RECOVERABLE),
    NO_RUN_IN_PROGRESS("NC-501", "No reconciliation run is in progress", ErrorCategory.RECOVERABLE),
    RUN_NOT_FOUND("NC-502", "Reconciliation run not found", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("NC-900", "Internal error", ErrorCategory.FATAL),
    INVALID_REQUEST("NC-901", "Invalid request", ErrorCategory.RECOVERABLE);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - fix the input or retry the run.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - the run halts, operator intervention required.
         */
        FATAL
    }
}
