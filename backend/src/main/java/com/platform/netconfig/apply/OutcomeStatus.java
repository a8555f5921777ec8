package com.platform.netconfig.apply;

public enum OutcomeStatus {
    SUCCEEDED,
    FAILED,
    /** A dependency failed or was skipped. */
    SKIPPED,
    /** The run halted or was cancelled before this operation started. */
    NOT_ATTEMPTED
}
