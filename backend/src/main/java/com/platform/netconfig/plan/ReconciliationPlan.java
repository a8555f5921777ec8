package com.platform.netconfig.plan;

import com.platform.netconfig.diff.Operation;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Dependency-ordered operations for one run. Never persisted.
 *
 * @param operations topological order; every operation follows all of its dependencies
 * @param waves      operation ids grouped into sets with no dependency path between
 *                   members, in execution order
 * @param filtered   ids of operations removed by a filter stage, with the reason
 */
public record ReconciliationPlan(
    List<Operation> operations,
    List<List<String>> waves,
    Map<String, String> filtered
) {
    
    public ReconciliationPlan {
        operations = List.copyOf(operations);
        waves = waves.stream().map(List::copyOf).toList();
        filtered = Map.copyOf(filtered);
    }
    
    public static ReconciliationPlan empty() {
        return new ReconciliationPlan(List.of(), List.of(), Map.of());
    }
    
    public boolean isEmpty() {
        return operations.isEmpty();
    }
    
    public int size() {
        return operations.size();
    }
    
    public Map<String, Operation> operationsById() {
        return operations.stream().collect(Collectors.toMap(Operation::id, Function.identity()));
    }
}
