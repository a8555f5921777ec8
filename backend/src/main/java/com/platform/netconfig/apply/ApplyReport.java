package com.platform.netconfig.apply;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What an apply did, or for a dry run would do.
 *
 * @param actions    rendered action line per operation, in plan order
 * @param outcomes   per-operation results in plan order; empty for a dry run
 * @param haltReason message of the fatal error that stopped the run, if any
 * @param cancelled  whether the run was cancelled before finishing
 */
public record ApplyReport(
    boolean dryRun,
    List<String> actions,
    List<OperationOutcome> outcomes,
    String haltReason,
    boolean cancelled
) {
    
    public ApplyReport {
        actions = List.copyOf(actions);
        outcomes = List.copyOf(outcomes);
    }
    
    public static ApplyReport dryRun(List<String> actions) {
        return new ApplyReport(true, actions, List.of(), null, false);
    }
    
    @JsonProperty
    public List<OperationOutcome> succeeded() {
        return withStatus(OutcomeStatus.SUCCEEDED);
    }
    
    @JsonProperty
    public List<OperationOutcome> failed() {
        return withStatus(OutcomeStatus.FAILED);
    }
    
    @JsonProperty
    public List<OperationOutcome> skipped() {
        return withStatus(OutcomeStatus.SKIPPED);
    }
    
    @JsonProperty
    public List<OperationOutcome> notAttempted() {
        return withStatus(OutcomeStatus.NOT_ATTEMPTED);
    }
    
    public boolean isHalted() {
        return haltReason != null;
    }
    
    /**
     * True when every planned operation succeeded.
     */
    public boolean isComplete() {
        return outcomes.stream().allMatch(OperationOutcome::isSuccess);
    }
    
    private List<OperationOutcome> withStatus(OutcomeStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).toList();
    }
}
