package com.platform.netconfig.error;

/**
 * Exception for run lifecycle conflicts (a run already in progress, nothing to cancel).
 */
public class RunStateException extends NetConfigException {
    
    public RunStateException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
    
    public static RunStateException alreadyRunning(String runId) {
        return new RunStateException(
            ErrorCode.RUN_IN_PROGRESS,
            String.format("Reconciliation run %s is still in progress", runId)
        );
    }
    
    public static RunStateException notFound(String runId) {
        return new RunStateException(ErrorCode.RUN_NOT_FOUND, "No finished run with id " + runId);
    }
    
    public static RunStateException nothingToCancel() {
        return new RunStateException(ErrorCode.NO_RUN_IN_PROGRESS, ErrorCode.NO_RUN_IN_PROGRESS.getDefaultMessage());
    }
}
