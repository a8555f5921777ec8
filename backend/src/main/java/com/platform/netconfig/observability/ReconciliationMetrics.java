package com.platform.netconfig.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for reconciliation metrics.
 * Wraps Micrometer so the rest of the code records events by name instead of building meters.
 */
@Slf4j
@Component
public class ReconciliationMetrics {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final AtomicInteger lastPlanSize;
    private final AtomicInteger runInProgress;
    
    public ReconciliationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.lastPlanSize = new AtomicInteger(0);
        this.runInProgress = new AtomicInteger(0);
        
        Gauge.builder("netconfig.plan.size", lastPlanSize, AtomicInteger::get)
            .description("Operations in the most recent plan")
            .register(meterRegistry);
        Gauge.builder("netconfig.run.active", runInProgress, AtomicInteger::get)
            .register(meterRegistry);
        
        log.info("Reconciliation metrics initialized");
    }
    
    /**
     * Record a finished run.
     */
    public void recordRun(String mode, String status, long durationMs) {
        incrementCounter("netconfig.runs.total", "mode", mode, "status", status);
        timer("netconfig.run.duration", "mode", mode).record(Duration.ofMillis(durationMs));
        log.debug("Recorded run: mode={} status={} ({}ms)", mode, status, durationMs);
    }
    
    public void setRunActive(boolean active) {
        runInProgress.set(active ? 1 : 0);
    }
    
    public void recordPlanSize(int operations) {
        lastPlanSize.set(operations);
    }
    
    /**
     * Record the outcome of a single applied operation.
     */
    public void recordOperation(String kind, String objectType, String outcome) {
        incrementCounter("netconfig.operations.total",
            "kind", kind, "type", objectType, "outcome", outcome);
    }
    
    /**
     * Record a retry of a controller call.
     */
    public void recordRetryAttempt(String call, int attemptNumber) {
        incrementCounter("netconfig.controller.retry.attempt", "call", call);
        log.debug("Recorded retry attempt {} for {}", attemptNumber, call);
    }
    
    public void recordRetriesExhausted(String call) {
        incrementCounter("netconfig.controller.retry.exhausted", "call", call);
    }
    
    /**
     * Record latency of a controller call.
     */
    public void recordControllerCall(String call, boolean success, long latencyMs) {
        timer("netconfig.controller.call.latency", "call", call).record(Duration.ofMillis(latencyMs));
        incrementCounter("netconfig.controller.calls.total", "call", call, "success", String.valueOf(success));
    }
    
    public void recordValidationViolations(String violationClass, int count) {
        counter("netconfig.validation.violations", "class", violationClass).increment(count);
    }
    
    public void recordPlanningFailure(String errorCode) {
        incrementCounter("netconfig.planning.failures", "code", errorCode);
    }
    
    /**
     * Record an error surfaced through the REST layer or a run.
     */
    public void recordError(String errorCode) {
        incrementCounter("netconfig.errors.total", "code", errorCode);
    }
    
    public void recordSnapshot(boolean success) {
        incrementCounter("netconfig.backup.snapshots", "success", String.valueOf(success));
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        counter(name, tags).increment();
    }
    
    private Counter counter(String name, String... tags) {
        String key = name + String.join(".", tags);
        return counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry));
    }
    
    private Timer timer(String name, String... tags) {
        String key = name + String.join(".", tags);
        return timers.computeIfAbsent(key, k ->
            Timer.builder(name)
                .tags(tags)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
    }
}
