package com.platform.netconfig.controller;

import com.platform.netconfig.error.ControllerApiException.ApiErrorKind;
import com.platform.netconfig.error.FatalApiException;
import com.platform.netconfig.model.FirewallRule;
import com.platform.netconfig.model.NetworkSegment;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Throttles outbound controller calls with a token bucket.
 * Callers block until a token is available.
 */
@Slf4j
public class RateLimitedControllerClient implements ControllerClient {
    
    private final ControllerClient delegate;
    private final Bucket bucket;
    
    public RateLimitedControllerClient(ControllerClient delegate, Bucket bucket) {
        this.delegate = delegate;
        this.bucket = bucket;
    }
    
    /**
     * Bucket refilling {@code requestsPerSecond} tokens a second, holding at most {@code burst}.
     */
    public static Bucket bucket(int requestsPerSecond, int burst) {
        Bandwidth limit = Bandwidth.classic(
            Math.max(burst, 1),
            Refill.greedy(requestsPerSecond, Duration.ofSeconds(1))
        );
        return Bucket.builder().addLimit(limit).build();
    }
    
    @Override
    public List<NetworkSegment> fetchSegments() {
        acquire("fetchSegments");
        return delegate.fetchSegments();
    }
    
    @Override
    public List<FirewallRule> fetchFirewallRules() {
        acquire("fetchFirewallRules");
        return delegate.fetchFirewallRules();
    }
    
    @Override
    public void createSegment(NetworkSegment segment) {
        acquire("createSegment");
        delegate.createSegment(segment);
    }
    
    @Override
    public void updateSegment(NetworkSegment current, NetworkSegment desired) {
        acquire("updateSegment");
        delegate.updateSegment(current, desired);
    }
    
    @Override
    public void deleteSegment(NetworkSegment current) {
        acquire("deleteSegment");
        delegate.deleteSegment(current);
    }
    
    @Override
    public void createFirewallRule(FirewallRule rule) {
        acquire("createFirewallRule");
        delegate.createFirewallRule(rule);
    }
    
    @Override
    public void updateFirewallRule(FirewallRule current, FirewallRule desired) {
        acquire("updateFirewallRule");
        delegate.updateFirewallRule(current, desired);
    }
    
    @Override
    public void deleteFirewallRule(FirewallRule current) {
        acquire("deleteFirewallRule");
        delegate.deleteFirewallRule(current);
    }
    
    @Override
    public ControllerStatus status() {
        acquire("status");
        return delegate.status();
    }
    
    @Override
    public byte[] exportBackup() {
        acquire("exportBackup");
        return delegate.exportBackup();
    }
    
    private void acquire(String call) {
        if (bucket.tryConsume(1)) {
            return;
        }
        log.debug("[RATE_LIMIT] Waiting for a token before {}", call);
        try {
            bucket.asBlocking().consume(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalApiException(ApiErrorKind.UNEXPECTED, -1, call + " interrupted while rate limited", e);
        }
    }
}
