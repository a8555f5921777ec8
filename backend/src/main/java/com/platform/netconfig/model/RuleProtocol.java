package com.platform.netconfig.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Protocols a rule can match on.
 */
public enum RuleProtocol {
    ALL(false),
    TCP(true),
    UDP(true),
    TCP_UDP(true),
    ICMP(false);
    
    private final boolean portAware;
    
    RuleProtocol(boolean portAware) {
        this.portAware = portAware;
    }
    
    public boolean isPortAware() {
        return portAware;
    }
    
    public static Optional<RuleProtocol> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(p -> p.name().equalsIgnoreCase(value.trim()))
            .findFirst();
    }
}
