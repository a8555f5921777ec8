package com.platform.netconfig.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * JSON body of every failed API call. Parts a handler has nothing for are
 * omitted.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    private String code; // NC-xxx
    private String message;
    private String detail;
    private boolean fatal;
    private int status;
    private Instant timestamp;
    private String path;
    
    /**
     * Correlation id of the request, as logged under the {@code correlationId} MDC key.
     */
    private String traceId;
    
    private List<RejectedField> violations;
    
    /**
     * Ids of the operations a plan could not order.
     */
    private List<String> offendingOperations;
    
    private String controllerErrorKind;
    private Integer controllerStatus;
    
    /**
     * One offending value of a desired-state document.
     */
    @Data
    @Builder
    public static class RejectedField {
        private String violationClass;
        private String field;
        private Object value;
        private String rule;
        private String message;
    }
}
