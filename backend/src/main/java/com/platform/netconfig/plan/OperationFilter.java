package com.platform.netconfig.plan;

import com.platform.netconfig.diff.Operation;

import java.util.Optional;

/**
 * A stage applied to every operation set before planning. Operations a
 * filter rejects are dropped from the plan entirely.
 */
public interface OperationFilter {
    
    /**
     * @return the reason the operation must not be executed, or empty to keep it
     */
    Optional<String> reject(Operation operation);
}
