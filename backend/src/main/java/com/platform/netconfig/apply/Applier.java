package com.platform.netconfig.apply;

import com.platform.netconfig.config.NetConfigProperties;
import com.platform.netconfig.controller.ControllerClient;
import com.platform.netconfig.diff.Operation;
import com.platform.netconfig.diff.OperationKind;
import com.platform.netconfig.error.ControllerApiException;
import com.platform.netconfig.error.ControllerApiException.ApiErrorKind;
import com.platform.netconfig.error.ErrorCode;
import com.platform.netconfig.error.FatalApiException;
import com.platform.netconfig.model.FirewallRule;
import com.platform.netconfig.model.NetworkSegment;
import com.platform.netconfig.observability.LoggingConfig;
import com.platform.netconfig.observability.ReconciliationMetrics;
import com.platform.netconfig.plan.ReconciliationPlan;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes a reconciliation plan against the controller.
 *
 * <p>Waves run one after another; operations inside a wave have no dependency
 * path between them and are dispatched concurrently up to the configured
 * limit. An operation whose dependency did not succeed is skipped. A fatal
 * controller error or a cancellation stops new operations from starting;
 * operations already in flight finish and nothing is rolled back.
 */
@Slf4j
@Component
public class Applier {
    
    private final ControllerClient controllerClient;
    private final OperationRenderer renderer;
    private final ReconciliationMetrics metrics;
    private final int maxConcurrency;
    
    @Autowired
    public Applier(ControllerClient controllerClient, OperationRenderer renderer,
                   ReconciliationMetrics metrics, NetConfigProperties properties) {
        this(controllerClient, renderer, metrics, properties.getApply().getMaxConcurrency());
    }
    
    public Applier(ControllerClient controllerClient, OperationRenderer renderer,
                   ReconciliationMetrics metrics, int maxConcurrency) {
        this.controllerClient = controllerClient;
        this.renderer = renderer;
        this.metrics = metrics;
        this.maxConcurrency = Math.max(maxConcurrency, 1);
    }
    
    public ApplyReport apply(ReconciliationPlan plan, boolean dryRun, CancellationToken cancellation) {
        List<String> actions = plan.operations().stream().map(renderer::render).toList();
        
        if (dryRun) {
            actions.forEach(action -> log.info("[dry-run] {}", action));
            log.info("Dry run complete: {} operations planned, nothing applied", actions.size());
            return ApplyReport.dryRun(actions);
        }
        
        Map<String, Operation> byId = plan.operationsById();
        Map<String, String> actionById = new ConcurrentHashMap<>();
        for (int i = 0; i < actions.size(); i++) {
            actionById.put(plan.operations().get(i).id(), actions.get(i));
        }
        
        Map<String, OperationOutcome> outcomes = new ConcurrentHashMap<>();
        AtomicReference<String> haltReason = new AtomicReference<>();
        Map<String, String> logContext = MDC.getCopyOfContextMap();
        
        ExecutorService executor = maxConcurrency > 1
            ? Executors.newFixedThreadPool(maxConcurrency, new CustomizableThreadFactory("netconfig-apply-"))
            : null;
        
        try {
            for (List<String> wave : plan.waves()) {
                List<Future<?>> inFlight = new ArrayList<>();
                
                for (String id : wave) {
                    Operation op = byId.get(id);
                    String action = actionById.get(id);
                    
                    Optional<String> blocker = firstUnsuccessfulDependency(op, outcomes);
                    if (blocker.isPresent() && stopReason(haltReason, cancellation) == null) {
                        log.warn("Skipping {}: dependency {} did not succeed", action, blocker.get());
                        record(op, outcomes, OperationOutcome.skipped(id, action, blocker.get()));
                        continue;
                    }
                    
                    if (executor == null) {
                        runOperation(op, action, outcomes, haltReason, cancellation);
                    } else {
                        inFlight.add(executor.submit(() -> {
                            if (logContext != null) {
                                MDC.setContextMap(logContext);
                            }
                            try {
                                runOperation(op, action, outcomes, haltReason, cancellation);
                            } finally {
                                MDC.clear();
                            }
                        }));
                    }
                }
                
                awaitWave(inFlight, haltReason);
            }
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
        
        List<OperationOutcome> ordered = plan.operations().stream()
            .map(op -> outcomes.getOrDefault(op.id(),
                OperationOutcome.notAttempted(op.id(), actionById.get(op.id()), "operation was never dispatched")))
            .toList();
        
        ApplyReport report = new ApplyReport(false, actions, ordered, haltReason.get(), cancellation.isCancelled());
        log.info("Apply finished: {} succeeded, {} failed, {} skipped, {} not attempted",
            report.succeeded().size(), report.failed().size(),
            report.skipped().size(), report.notAttempted().size());
        return report;
    }
    
    private void runOperation(Operation op, String action, Map<String, OperationOutcome> outcomes,
                              AtomicReference<String> haltReason, CancellationToken cancellation) {
        LoggingConfig.setOperationContext(op.kind().verb(), op.identity().toString());
        try {
            String stop = stopReason(haltReason, cancellation);
            if (stop != null) {
                record(op, outcomes, OperationOutcome.notAttempted(op.id(), action, stop));
                return;
            }
            record(op, outcomes, execute(op, action, haltReason));
        } finally {
            LoggingConfig.clearOperationContext();
        }
    }
    
    private OperationOutcome execute(Operation op, String action, AtomicReference<String> haltReason) {
        try {
            dispatch(op);
            log.info("Applied: {}", action);
            return OperationOutcome.succeeded(op.id(), action);
            
        } catch (ControllerApiException e) {
            if (e.getKind() == ApiErrorKind.NOT_FOUND && op.kind() == OperationKind.DELETE) {
                log.info("Already absent: {}", action);
                return OperationOutcome.succeeded(op.id(), action, "already absent on the controller");
            }
            if (e instanceof FatalApiException || e.isFatal()) {
                haltReason.compareAndSet(null, e.getMessage());
                log.error("Fatal controller error on {}, halting run: {}", action, e.getMessage());
            } else {
                log.warn("Failed: {}: {}", action, e.getMessage());
            }
            return OperationOutcome.failed(op.id(), action, e.getMessage(), e.getErrorCode().getCode());
            
        } catch (RuntimeException e) {
            haltReason.compareAndSet(null, "internal error: " + e.getMessage());
            log.error("Unexpected error on {}, halting run", action, e);
            return OperationOutcome.failed(op.id(), action, e.getMessage(), ErrorCode.INTERNAL_ERROR.getCode());
        }
    }
    
    private void dispatch(Operation op) {
        switch (op.targetType()) {
            case SEGMENT -> {
                switch (op.kind()) {
                    case CREATE -> controllerClient.createSegment((NetworkSegment) op.desired());
                    case UPDATE -> controllerClient.updateSegment((NetworkSegment) op.current(), (NetworkSegment) op.desired());
                    case DELETE -> controllerClient.deleteSegment((NetworkSegment) op.current());
                }
            }
            case FIREWALL_RULE -> {
                switch (op.kind()) {
                    case CREATE -> controllerClient.createFirewallRule((FirewallRule) op.desired());
                    case UPDATE -> controllerClient.updateFirewallRule((FirewallRule) op.current(), (FirewallRule) op.desired());
                    case DELETE -> controllerClient.deleteFirewallRule((FirewallRule) op.current());
                }
            }
        }
    }
    
    private Optional<String> firstUnsuccessfulDependency(Operation op, Map<String, OperationOutcome> outcomes) {
        return op.dependsOn().stream()
            .filter(dep -> {
                OperationOutcome outcome = outcomes.get(dep);
                return outcome == null || !outcome.isSuccess();
            })
            .findFirst();
    }
    
    private String stopReason(AtomicReference<String> haltReason, CancellationToken cancellation) {
        if (haltReason.get() != null) {
            return "run halted: " + haltReason.get();
        }
        if (cancellation.isCancelled()) {
            return "run cancelled";
        }
        return null;
    }
    
    private void awaitWave(List<Future<?>> inFlight, AtomicReference<String> haltReason) {
        for (Future<?> future : inFlight) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                haltReason.compareAndSet(null, "apply interrupted");
                return;
            } catch (ExecutionException e) {
                haltReason.compareAndSet(null, "internal error: " + e.getCause().getMessage());
                log.error("Operation task failed unexpectedly", e.getCause());
            }
        }
    }
    
    private void record(Operation op, Map<String, OperationOutcome> outcomes, OperationOutcome outcome) {
        outcomes.put(op.id(), outcome);
        metrics.recordOperation(op.kind().verb(), op.targetType().label(), outcome.status().name().toLowerCase());
    }
}
