package com.platform.netconfig.controller;

import com.platform.netconfig.model.FirewallRule;
import com.platform.netconfig.model.NetworkSegment;

import java.util.List;

/**
 * Remote network controller holding the live configuration.
 *
 * <p>Objects are addressed by their authoritative identity (VLAN tag, chain and
 * priority). Implementations resolve controller-generated ids themselves.
 * Every method fails with a {@link com.platform.netconfig.error.ControllerApiException}
 * whose kind tells the caller whether to retry, fail the operation or halt.
 */
public interface ControllerClient {
    
    /**
     * Every VLAN-backed segment, including the management network as VLAN 1.
     */
    List<NetworkSegment> fetchSegments();
    
    List<FirewallRule> fetchFirewallRules();
    
    void createSegment(NetworkSegment segment);
    
    /**
     * Replace {@code current} with {@code desired}. Both share the same VLAN tag.
     */
    void updateSegment(NetworkSegment current, NetworkSegment desired);
    
    void deleteSegment(NetworkSegment current);
    
    void createFirewallRule(FirewallRule rule);
    
    /**
     * Replace {@code current} with {@code desired}. The priority may differ
     * when the rule moves within its chain.
     */
    void updateFirewallRule(FirewallRule current, FirewallRule desired);
    
    void deleteFirewallRule(FirewallRule current);
    
    ControllerStatus status();
    
    /**
     * Full controller backup in the controller's native format.
     */
    byte[] exportBackup();
}
