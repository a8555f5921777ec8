package com.platform.netconfig.controller;

import com.platform.netconfig.model.FirewallRule;
import com.platform.netconfig.model.NetworkSegment;
import com.platform.netconfig.model.NetworkState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Reads the live configuration from the controller into a {@link NetworkState}.
 * Segments come back ordered by VLAN tag and rules by chain and priority.
 */
@Slf4j
@Component
public class LiveStateFetcher {
    
    private final ControllerClient controllerClient;
    
    public LiveStateFetcher(ControllerClient controllerClient) {
        this.controllerClient = controllerClient;
    }
    
    public NetworkState fetch() {
        long start = System.currentTimeMillis();
        
        List<NetworkSegment> segments = controllerClient.fetchSegments().stream()
            .sorted(Comparator.comparing(NetworkSegment::vlanId))
            .toList();
        List<FirewallRule> rules = controllerClient.fetchFirewallRules().stream()
            .sorted(Comparator.comparing(FirewallRule::identity))
            .toList();
        
        log.info("Fetched live state: {} segments, {} firewall rules in {}ms",
            segments.size(), rules.size(), System.currentTimeMillis() - start);
        return new NetworkState(segments, rules);
    }
}
