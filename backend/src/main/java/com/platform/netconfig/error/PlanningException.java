package com.platform.netconfig.error;

import java.util.List;

/**
 * Exception for plans that cannot be executed safely: dependency cycles or
 * operations depending on objects that neither exist nor will be created.
 */
public class PlanningException extends NetConfigException {
    
    private final List<String> offendingOperations;
    
    public PlanningException(ErrorCode errorCode, List<String> offendingOperations, String message) {
        super(errorCode, message);
        this.offendingOperations = List.copyOf(offendingOperations);
    }
    
    public static PlanningException cycle(List<String> operationIds) {
        return new PlanningException(
            ErrorCode.CYCLE_DETECTED,
            operationIds,
            String.format("Dependency cycle between operations %s", operationIds)
        );
    }
    
    public static PlanningException unresolved(List<String> problems) {
        return new PlanningException(
            ErrorCode.UNRESOLVED_DEPENDENCY,
            problems,
            String.format("Unresolved dependencies: %s", String.join("; ", problems))
        );
    }
    
    public List<String> getOffendingOperations() {
        return offendingOperations;
    }
}
