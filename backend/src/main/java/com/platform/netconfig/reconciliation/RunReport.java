package com.platform.netconfig.reconciliation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.netconfig.apply.ApplyReport;
import com.platform.netconfig.backup.SnapshotHandle;
import com.platform.netconfig.error.ErrorCode;
import com.platform.netconfig.plan.ReconciliationPlan;
import com.platform.netconfig.validation.Violation;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Everything a finished run produced: status, validation violations, the
 * plan, per-operation outcomes and the error that stopped it, if any.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunReport {
    
    String runId;
    RunMode mode;
    RunStatus status;
    String hardwareProfile;
    Instant startedAt;
    Instant finishedAt;
    long durationMs;
    
    @Builder.Default
    List<Violation> violations = List.of();
    
    ReconciliationPlan plan;
    ApplyReport apply;
    SnapshotHandle snapshot;
    
    String errorCode;
    String error;
    List<String> offendingOperations;
    
    /**
     * Process exit code: the status code, except 1 when the document itself is missing.
     */
    public int exitCode() {
        if (ErrorCode.DESIRED_STATE_NOT_FOUND.getCode().equals(errorCode)) {
            return 1;
        }
        return status.getExitCode();
    }
}
