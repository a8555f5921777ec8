package com.platform.netconfig.controller;

import com.platform.netconfig.error.RetriesExhaustedException;
import com.platform.netconfig.error.TransientApiException;
import com.platform.netconfig.model.FirewallRule;
import com.platform.netconfig.model.NetworkSegment;
import com.platform.netconfig.observability.ReconciliationMetrics;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Retries transient controller failures with exponential backoff.
 *
 * <p>Only {@link TransientApiException} is retried, as configured on the
 * {@link Retry}. When attempts run out the last failure is wrapped in a
 * {@link RetriesExhaustedException}, which fails the single operation.
 * Every other exception passes through on the first attempt.
 */
@Slf4j
public class RetryingControllerClient implements ControllerClient {
    
    private final ControllerClient delegate;
    private final Retry retry;
    private final ReconciliationMetrics metrics;
    private final int maxAttempts;
    
    public RetryingControllerClient(ControllerClient delegate, Retry retry, ReconciliationMetrics metrics) {
        this.delegate = delegate;
        this.retry = retry;
        this.metrics = metrics;
        this.maxAttempts = retry.getRetryConfig().getMaxAttempts();
        registerEventListeners();
    }
    
    private void registerEventListeners() {
        retry.getEventPublisher()
            .onRetry(event -> {
                log.warn("Controller call failed (attempt {}/{}), retrying in {}ms: {}",
                    event.getNumberOfRetryAttempts(), maxAttempts,
                    event.getWaitInterval().toMillis(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown");
            })
            .onSuccess(event -> {
                log.info("Controller call succeeded after {} attempts", event.getNumberOfRetryAttempts() + 1);
            });
    }
    
    @Override
    public List<NetworkSegment> fetchSegments() {
        return call("fetchSegments", delegate::fetchSegments);
    }
    
    @Override
    public List<FirewallRule> fetchFirewallRules() {
        return call("fetchFirewallRules", delegate::fetchFirewallRules);
    }
    
    @Override
    public void createSegment(NetworkSegment segment) {
        run("createSegment", () -> delegate.createSegment(segment));
    }
    
    @Override
    public void updateSegment(NetworkSegment current, NetworkSegment desired) {
        run("updateSegment", () -> delegate.updateSegment(current, desired));
    }
    
    @Override
    public void deleteSegment(NetworkSegment current) {
        run("deleteSegment", () -> delegate.deleteSegment(current));
    }
    
    @Override
    public void createFirewallRule(FirewallRule rule) {
        run("createFirewallRule", () -> delegate.createFirewallRule(rule));
    }
    
    @Override
    public void updateFirewallRule(FirewallRule current, FirewallRule desired) {
        run("updateFirewallRule", () -> delegate.updateFirewallRule(current, desired));
    }
    
    @Override
    public void deleteFirewallRule(FirewallRule current) {
        run("deleteFirewallRule", () -> delegate.deleteFirewallRule(current));
    }
    
    @Override
    public ControllerStatus status() {
        return call("status", delegate::status);
    }
    
    @Override
    public byte[] exportBackup() {
        return call("exportBackup", delegate::exportBackup);
    }
    
    private void run(String name, Runnable operation) {
        call(name, () -> {
            operation.run();
            return null;
        });
    }
    
    private <T> T call(String name, Supplier<T> operation) {
        AtomicInteger attempt = new AtomicInteger();
        Supplier<T> counted = () -> {
            try {
                return operation.get();
            } catch (TransientApiException e) {
                metrics.recordRetryAttempt(name, attempt.incrementAndGet());
                throw e;
            }
        };
        try {
            return Retry.decorateSupplier(retry, counted).get();
        } catch (TransientApiException e) {
            metrics.recordRetriesExhausted(name);
            log.error("{} failed after {} attempts", name, maxAttempts);
            throw new RetriesExhaustedException(name, maxAttempts, e);
        }
    }
}
