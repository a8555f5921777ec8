package com.platform.netconfig.error;

/**
 * A transient failure that persisted through every retry attempt.
 * Fails the operation it belongs to; independent operations continue.
 */
public class RetriesExhaustedException extends ControllerApiException {
    
    private final int attempts;
    
    public RetriesExhaustedException(String call, int attempts, TransientApiException lastFailure) {
        super(
            ErrorCode.CONTROLLER_RETRIES_EXHAUSTED,
            lastFailure.getKind(),
            String.format("%s failed after %d attempts: %s", call, attempts, lastFailure.getMessage()),
            lastFailure
        );
        this.attempts = attempts;
    }
    
    public int getAttempts() {
        return attempts;
    }
}
