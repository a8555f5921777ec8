package com.platform.netconfig.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A complete set of managed objects. Used for both the desired state read
 * from the document and the live state fetched from the controller.
 */
public record NetworkState(
    List<NetworkSegment> segments,
    @JsonProperty("firewall_rules") List<FirewallRule> firewallRules
) {
    
    public NetworkState {
        segments = segments == null ? List.of() : List.copyOf(segments);
        firewallRules = firewallRules == null ? List.of() : List.copyOf(firewallRules);
    }
    
    public static NetworkState empty() {
        return new NetworkState(List.of(), List.of());
    }
}
