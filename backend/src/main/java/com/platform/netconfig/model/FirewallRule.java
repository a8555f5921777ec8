package com.platform.netconfig.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * A rule at a given priority within a firewall chain.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FirewallRule(
    String chain,
    Integer priority,
    String name,
    String action,
    String protocol,
    RuleSelector source,
    RuleSelector destination,
    Boolean enabled
) implements ManagedObject {
    
    public static final String DEFAULT_PROTOCOL = "all";
    
    public FirewallRule {
        chain = chain == null ? null : FirewallChain.parse(chain).map(Enum::name).orElse(chain);
        action = action == null ? null : action.trim().toLowerCase(Locale.ROOT);
        protocol = protocol == null ? DEFAULT_PROTOCOL : protocol.trim().toLowerCase(Locale.ROOT);
        source = source == null ? RuleSelector.any() : source;
        destination = destination == null ? RuleSelector.any() : destination;
        enabled = enabled == null ? Boolean.TRUE : enabled;
    }
    
    @Override
    public ObjectIdentity identity() {
        return ObjectIdentity.rule(chain, priority);
    }
    
    /**
     * VLAN tags of every segment this rule's selectors point at.
     */
    public Set<Integer> referencedSegments() {
        Set<Integer> refs = new LinkedHashSet<>();
        if (source.referencesSegment()) {
            refs.add(source.segment());
        }
        if (destination.referencesSegment()) {
            refs.add(destination.segment());
        }
        return refs;
    }
    
    public FirewallRule withPriority(int newPriority) {
        return new FirewallRule(chain, newPriority, name, action, protocol, source, destination, enabled);
    }
}
