package com.platform.netconfig.plan;

import com.platform.netconfig.diff.Operation;
import com.platform.netconfig.diff.OperationKind;
import com.platform.netconfig.error.PlanningException;
import com.platform.netconfig.model.ObjectType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns classified operations into an executable plan.
 *
 * <p>Filter stages run first and remove operations that must never execute
 * (protected segments); dependency edges into removed operations are
 * dropped with them. The remaining graph is sorted with Kahn's algorithm
 * into waves. Planning fails closed: any dangling dependency or cycle
 * aborts with every offender named, and nothing is executed.
 */
@Slf4j
@Component
public class Planner {
    
    private static final Comparator<Operation> EXECUTION_ORDER = Comparator
        .comparingInt(Planner::rank)
        .thenComparing(Operation::identity);
    
    private final List<OperationFilter> filters;
    
    public Planner(List<OperationFilter> filters) {
        this.filters = List.copyOf(filters);
    }
    
    public ReconciliationPlan plan(List<Operation> operations) {
        Map<String, String> filtered = new TreeMap<>();
        Map<String, Operation> kept = new LinkedHashMap<>();
        for (Operation operation : operations) {
            Optional<String> reason = rejection(operation);
            if (reason.isPresent()) {
                log.warn("Excluding {} from plan: {}", operation.id(), reason.get());
                filtered.put(operation.id(), reason.get());
            } else {
                kept.put(operation.id(), operation);
            }
        }
        
        // edges into filtered operations would otherwise read as unresolved
        Map<String, Operation> graph = new LinkedHashMap<>();
        for (Operation operation : kept.values()) {
            Set<String> deps = new TreeSet<>(operation.dependsOn());
            deps.removeAll(filtered.keySet());
            graph.put(operation.id(), deps.size() == operation.dependsOn().size()
                ? operation : operation.withDependsOn(deps));
        }
        
        checkResolved(graph);
        
        ReconciliationPlan plan = sort(graph, filtered);
        log.info("Planned {} operation(s) in {} wave(s), {} excluded",
            plan.size(), plan.waves().size(), filtered.size());
        return plan;
    }
    
    private Optional<String> rejection(Operation operation) {
        for (OperationFilter filter : filters) {
            Optional<String> reason = filter.reject(operation);
            if (reason.isPresent()) {
                return reason;
            }
        }
        return Optional.empty();
    }
    
    private void checkResolved(Map<String, Operation> graph) {
        List<String> problems = new ArrayList<>();
        for (Operation operation : graph.values()) {
            for (String dependency : operation.dependsOn()) {
                if (!graph.containsKey(dependency)) {
                    problems.add(operation.id() + " requires " + dependency + " which is not part of the plan");
                }
            }
        }
        if (!problems.isEmpty()) {
            log.error("Planning failed, unresolved dependencies: {}", problems);
            throw PlanningException.unresolved(problems);
        }
    }
    
    private ReconciliationPlan sort(Map<String, Operation> graph, Map<String, String> filtered) {
        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<String>> dependants = new HashMap<>();
        for (Operation operation : graph.values()) {
            pending.put(operation.id(), operation.dependsOn().size());
            for (String dependency : operation.dependsOn()) {
                dependants.computeIfAbsent(dependency, k -> new ArrayList<>()).add(operation.id());
            }
        }
        
        List<Operation> ready = new ArrayList<>();
        graph.values().stream().filter(op -> op.dependsOn().isEmpty()).forEach(ready::add);
        
        List<Operation> ordered = new ArrayList<>();
        List<List<String>> waves = new ArrayList<>();
        while (!ready.isEmpty()) {
            ready.sort(EXECUTION_ORDER);
            List<String> wave = new ArrayList<>();
            List<Operation> next = new ArrayList<>();
            for (Operation operation : ready) {
                ordered.add(operation);
                wave.add(operation.id());
                for (String dependant : dependants.getOrDefault(operation.id(), List.of())) {
                    if (pending.merge(dependant, -1, Integer::sum) == 0) {
                        next.add(graph.get(dependant));
                    }
                }
            }
            waves.add(wave);
            ready = next;
        }
        
        if (ordered.size() < graph.size()) {
            List<String> cycle = cycleMembers(graph, pending);
            log.error("Planning failed, dependency cycle between {}", cycle);
            throw PlanningException.cycle(cycle);
        }
        return new ReconciliationPlan(ordered, waves, filtered);
    }
    
    /**
     * Of the operations left unsorted, repeatedly discards those no other
     * leftover operation depends on. What remains lies on a cycle.
     */
    private static List<String> cycleMembers(Map<String, Operation> graph, Map<String, Integer> pending) {
        Set<String> remaining = new TreeSet<>();
        pending.forEach((id, count) -> {
            if (count > 0) {
                remaining.add(id);
            }
        });
        
        boolean trimmed = true;
        while (trimmed) {
            Set<String> required = new HashSet<>();
            for (String id : remaining) {
                graph.get(id).dependsOn().stream().filter(remaining::contains).forEach(required::add);
            }
            trimmed = remaining.retainAll(required);
        }
        return new ArrayList<>(remaining);
    }
    
    private static int rank(Operation operation) {
        boolean segment = operation.targetType() == ObjectType.SEGMENT;
        if (operation.kind() == OperationKind.DELETE) {
            return segment ? 4 : 3;
        }
        if (segment) {
            return operation.kind() == OperationKind.CREATE ? 0 : 1;
        }
        return 2;
    }
}
