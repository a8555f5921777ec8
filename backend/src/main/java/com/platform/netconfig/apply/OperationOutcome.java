package com.platform.netconfig.apply;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of one planned operation in a live apply.
 *
 * @param reason    why the operation failed, was skipped or was not attempted
 * @param errorCode error code of the failure, for FAILED outcomes
 * @param blockedBy id of the failed or skipped dependency, for SKIPPED outcomes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationOutcome(
    String operationId,
    String action,
    OutcomeStatus status,
    String reason,
    String errorCode,
    String blockedBy
) {
    
    public static OperationOutcome succeeded(String operationId, String action) {
        return new OperationOutcome(operationId, action, OutcomeStatus.SUCCEEDED, null, null, null);
    }
    
    public static OperationOutcome succeeded(String operationId, String action, String note) {
        return new OperationOutcome(operationId, action, OutcomeStatus.SUCCEEDED, note, null, null);
    }
    
    public static OperationOutcome failed(String operationId, String action, String reason, String errorCode) {
        return new OperationOutcome(operationId, action, OutcomeStatus.FAILED, reason, errorCode, null);
    }
    
    public static OperationOutcome skipped(String operationId, String action, String blockedBy) {
        return new OperationOutcome(operationId, action, OutcomeStatus.SKIPPED,
            "dependency " + blockedBy + " did not succeed", null, blockedBy);
    }
    
    public static OperationOutcome notAttempted(String operationId, String action, String reason) {
        return new OperationOutcome(operationId, action, OutcomeStatus.NOT_ATTEMPTED, reason, null, null);
    }
    
    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCEEDED;
    }
}
