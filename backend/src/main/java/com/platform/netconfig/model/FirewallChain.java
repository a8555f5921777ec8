package com.platform.netconfig.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Rule sets of the gateway firewall.
 */
public enum FirewallChain {
    LAN_IN,
    LAN_OUT,
    LAN_LOCAL,
    WAN_IN,
    WAN_OUT,
    WAN_LOCAL,
    GUEST_IN,
    GUEST_OUT,
    GUEST_LOCAL;
    
    /**
     * Accepts both {@code LAN_IN} and the {@code LAN-IN} spelling.
     */
    public static Optional<FirewallChain> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', '_');
        return Arrays.stream(values())
            .filter(c -> c.name().equalsIgnoreCase(normalized))
            .findFirst();
    }
}
