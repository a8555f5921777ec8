package com.platform.netconfig.reconciliation;

/**
 * How far a reconciliation run goes.
 */
public enum RunMode {
    /** Validate the desired state only; no controller access. */
    VALIDATE_ONLY,
    /** Fetch, diff and plan, then render the actions without applying them. */
    DRY_RUN,
    /** Full run: snapshot, then apply the plan. */
    APPLY
}
