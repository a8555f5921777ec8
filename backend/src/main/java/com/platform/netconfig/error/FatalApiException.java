package com.platform.netconfig.error;

/**
 * Authentication failure or unexpected remote error. Halts the run: no
 * further operations are attempted.
 */
public class FatalApiException extends ControllerApiException {
    
    public FatalApiException(ApiErrorKind kind, int httpStatus, String message) {
        super(kind, httpStatus, message);
    }
    
    public FatalApiException(ApiErrorKind kind, int httpStatus, String message, Throwable cause) {
        super(kind, httpStatus, message, cause);
    }
    
    public static FatalApiException authFailure(String message) {
        return new FatalApiException(ApiErrorKind.AUTH_FAILURE, 401, message);
    }
    
    public static FatalApiException unexpected(int httpStatus, String message) {
        return new FatalApiException(ApiErrorKind.UNEXPECTED, httpStatus, message);
    }
}
