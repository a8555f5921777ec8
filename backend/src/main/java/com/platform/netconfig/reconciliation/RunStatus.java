package com.platform.netconfig.reconciliation;

/**
 * Overall outcome of a run, with the process exit code used by the command line.
 */
public enum RunStatus {
    SUCCESS(0),
    VALIDATION_FAILED(2),
    PLANNING_FAILED(3),
    PARTIAL_FAILURE(4),
    FAILED(5);
    
    private final int exitCode;
    
    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }
    
    public int getExitCode() {
        return exitCode;
    }
}
