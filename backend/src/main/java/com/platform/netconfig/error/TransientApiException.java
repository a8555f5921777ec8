package com.platform.netconfig.error;

/**
 * Rate-limit or network blip. Retried with backoff by the retrying client.
 */
public class TransientApiException extends ControllerApiException {
    
    public TransientApiException(ApiErrorKind kind, int httpStatus, String message) {
        super(kind, httpStatus, message);
    }
    
    public TransientApiException(ApiErrorKind kind, int httpStatus, String message, Throwable cause) {
        super(kind, httpStatus, message, cause);
    }
    
    public static TransientApiException rateLimited(String message) {
        return new TransientApiException(ApiErrorKind.RATE_LIMITED, 429, message);
    }
    
    public static TransientApiException network(String message, Throwable cause) {
        return new TransientApiException(ApiErrorKind.TRANSIENT_NETWORK, -1, message, cause);
    }
}
