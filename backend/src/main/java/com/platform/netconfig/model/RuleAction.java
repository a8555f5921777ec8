package com.platform.netconfig.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Firewall rule verdicts accepted by the controller.
 */
public enum RuleAction {
    ALLOW,
    DENY,
    REJECT;
    
    public static Optional<RuleAction> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(a -> a.name().equalsIgnoreCase(value.trim()))
            .findFirst();
    }
}
