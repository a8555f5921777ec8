package com.platform.netconfig.error;

import com.platform.netconfig.observability.ReconciliationMetrics;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Global exception handler for all REST controllers.
 * 
 * Converts exceptions to standardized ErrorResponse.
 * Logs all errors with appropriate severity.
 * Tracks error metrics.
 * 
 * RULES:
 * - Never swallow exceptions (always log)
 * - Never return HTTP 200 on failure
 * - Always include error code for client action
 * - Distinguish fatal vs recoverable
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final ReconciliationMetrics metrics;
    
    public GlobalExceptionHandler(ReconciliationMetrics metrics) {
        this.metrics = metrics;
    }
    
    // ==================== Reconciler Exceptions ====================
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        HttpStatus status = mapErrorCodeToStatus(ex.getErrorCode());
        
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        List<ErrorResponse.RejectedField> violations = ex.getViolations().stream()
            .map(v -> ErrorResponse.RejectedField.builder()
                .violationClass(v.violationClass().name())
                .field(v.field())
                .value(v.value())
                .rule(v.rule())
                .message(v.message())
                .build())
            .toList();
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ex.getErrorCode().getCode())
            .message(ex.getErrorCode().getDefaultMessage())
            .detail(ex.getMessage())
            .fatal(false)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .violations(violations.isEmpty() ? null : violations)
            .build();
        
        return ResponseEntity.status(status).body(response);
    }
    
    @ExceptionHandler(PlanningException.class)
    public ResponseEntity<ErrorResponse> handlePlanning(
            PlanningException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Planning error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ex.getErrorCode().getCode())
            .message(ex.getMessage())
            .fatal(false)
            .status(HttpStatus.UNPROCESSABLE_ENTITY.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .offendingOperations(ex.getOffendingOperations())
            .build();
        
        return ResponseEntity.unprocessableEntity().body(response);
    }
    
    @ExceptionHandler(ControllerApiException.class)
    public ResponseEntity<ErrorResponse> handleControllerApi(
            ControllerApiException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = ex instanceof TransientApiException || ex instanceof RetriesExhaustedException
            ? HttpStatus.SERVICE_UNAVAILABLE
            : HttpStatus.BAD_GATEWAY;
        
        logError(ex, errorCode, traceId);
        recordMetric(errorCode);
        
        ErrorResponse response = ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(ex.getMessage())
            .fatal(ex.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .controllerErrorKind(ex.getKind().name())
            .controllerStatus(ex.getHttpStatus() > 0 ? ex.getHttpStatus() : null)
            .build();
        
        return ResponseEntity.status(status).body(response);
    }
    
    @ExceptionHandler(NetConfigException.class)
    public ResponseEntity<ErrorResponse> handleNetConfigException(
            NetConfigException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        logError(ex, errorCode, traceId);
        recordMetric(errorCode);
        
        ErrorResponse response = ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(ex.getMessage())
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build();
        
        return ResponseEntity.status(status).body(response);
    }
    
    // ==================== Request Errors ====================
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ErrorCode.INVALID_REQUEST.getCode())
            .message("Invalid request body")
            .detail(ex.getMostSpecificCause().getMessage())
            .fatal(false)
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Type mismatch: {} = {}", traceId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ErrorCode.INVALID_REQUEST.getCode())
            .message(String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()))
            .fatal(false)
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Method not supported: {} on {}", traceId, ex.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ErrorCode.INVALID_REQUEST.getCode())
            .message(String.format("Method %s not supported for this endpoint", ex.getMethod()))
            .fatal(false)
            .status(HttpStatus.METHOD_NOT_ALLOWED.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build();
        
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(response);
    }
    
    // ==================== Catch-All ====================
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.INTERNAL_ERROR);
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ErrorCode.INTERNAL_ERROR.getCode())
            .message("An unexpected error occurred")
            .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage())
            .fatal(true)
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build();
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    // ==================== Helpers ====================
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get("correlationId");
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
        }
        return traceId;
    }
    
    private void logError(NetConfigException ex, ErrorCode errorCode, String traceId) {
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metrics.recordError(errorCode.getCode());
    }
    
    HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case VALIDATION_ERROR, DESIRED_STATE_UNREADABLE, UNKNOWN_HARDWARE_PROFILE, INVALID_REQUEST ->
                HttpStatus.BAD_REQUEST;
            case DESIRED_STATE_NOT_FOUND, RUN_NOT_FOUND ->
                HttpStatus.NOT_FOUND;
            case RUN_IN_PROGRESS, NO_RUN_IN_PROGRESS ->
                HttpStatus.CONFLICT;
            case CYCLE_DETECTED, UNRESOLVED_DEPENDENCY ->
                HttpStatus.UNPROCESSABLE_ENTITY;
            case CONTROLLER_RATE_LIMITED, CONTROLLER_UNREACHABLE, CONTROLLER_RETRIES_EXHAUSTED ->
                HttpStatus.SERVICE_UNAVAILABLE;
            case CONTROLLER_AUTH_FAILED, CONTROLLER_OBJECT_NOT_FOUND, CONTROLLER_CONFLICT,
                 CONTROLLER_UNEXPECTED, SNAPSHOT_FAILED ->
                HttpStatus.BAD_GATEWAY;
            default ->
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
