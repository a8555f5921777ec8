package com.platform.netconfig.error;

/**
 * Base exception for all reconciler exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class NetConfigException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected NetConfigException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected NetConfigException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected NetConfigException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
