package com.platform.netconfig.error;

/**
 * Exception for a single failed call to the controller API.
 * The {@link ApiErrorKind} decides whether the call is retried, fails only
 * its operation, or halts the run.
 */
public class ControllerApiException extends NetConfigException {
    
    private final ApiErrorKind kind;
    private final int httpStatus;
    
    public ControllerApiException(ApiErrorKind kind, int httpStatus, String message) {
        super(kind.errorCode(), message);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }
    
    public ControllerApiException(ApiErrorKind kind, int httpStatus, String message, Throwable cause) {
        super(kind.errorCode(), message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }
    
    protected ControllerApiException(ErrorCode errorCode, ApiErrorKind kind, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.kind = kind;
        this.httpStatus = -1;
    }
    
    public static ControllerApiException notFound(String message) {
        return new ControllerApiException(ApiErrorKind.NOT_FOUND, 404, message);
    }
    
    public static ControllerApiException conflict(String message) {
        return new ControllerApiException(ApiErrorKind.CONFLICT, 409, message);
    }
    
    public ApiErrorKind getKind() {
        return kind;
    }
    
    /**
     * HTTP status returned by the controller, or -1 when no response was received.
     */
    public int getHttpStatus() {
        return httpStatus;
    }
    
    public enum ApiErrorKind {
        AUTH_FAILURE(ErrorCode.CONTROLLER_AUTH_FAILED),
        RATE_LIMITED(ErrorCode.CONTROLLER_RATE_LIMITED),
        NOT_FOUND(ErrorCode.CONTROLLER_OBJECT_NOT_FOUND),
        CONFLICT(ErrorCode.CONTROLLER_CONFLICT),
        TRANSIENT_NETWORK(ErrorCode.CONTROLLER_UNREACHABLE),
        UNEXPECTED(ErrorCode.CONTROLLER_UNEXPECTED);
        
        private final ErrorCode errorCode;
        
        ApiErrorKind(ErrorCode errorCode) {
            this.errorCode = errorCode;
        }
        
        public ErrorCode errorCode() {
            return errorCode;
        }
    }
}
