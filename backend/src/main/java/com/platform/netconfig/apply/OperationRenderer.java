package com.platform.netconfig.apply;

import com.platform.netconfig.diff.Operation;
import com.platform.netconfig.model.DhcpScope;
import com.platform.netconfig.model.FirewallRule;
import com.platform.netconfig.model.NetworkSegment;
import com.platform.netconfig.model.RuleSelector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders an operation as a single human-readable action line.
 * The same line is used for dry runs and live runs.
 */
@Component
public class OperationRenderer {
    
    public String render(Operation op) {
        return switch (op.targetType()) {
            case SEGMENT -> renderSegment(op);
            case FIREWALL_RULE -> renderRule(op);
        };
    }
    
    private String renderSegment(Operation op) {
        return switch (op.kind()) {
            case CREATE -> {
                NetworkSegment s = (NetworkSegment) op.desired();
                yield String.format("create segment %d '%s' (%s)", s.vlanId(), s.name(), describe(s));
            }
            case UPDATE -> {
                NetworkSegment s = (NetworkSegment) op.desired();
                yield String.format("update segment %d '%s': %s", s.vlanId(), s.name(), String.join(", ", op.changedFields()));
            }
            case DELETE -> {
                NetworkSegment s = (NetworkSegment) op.current();
                yield String.format("delete segment %d '%s'", s.vlanId(), s.name());
            }
        };
    }
    
    private String describe(NetworkSegment s) {
        List<String> parts = new ArrayList<>();
        parts.add(s.subnet());
        parts.add("gateway " + s.gateway());
        DhcpScope dhcp = s.dhcp();
        parts.add(dhcp.isEnabled() ? "dhcp " + dhcp.start() + "-" + dhcp.stop() : "no dhcp");
        if (dhcp.isEnabled() && !dhcp.options().isEmpty()) {
            parts.add(dhcp.options().size() + " dhcp option(s)");
        }
        if (s.igmpSnooping()) {
            parts.add("igmp snooping");
        }
        if (s.multicastDns()) {
            parts.add("mdns");
        }
        return String.join(", ", parts);
    }
    
    private String renderRule(Operation op) {
        return switch (op.kind()) {
            case CREATE -> {
                FirewallRule r = (FirewallRule) op.desired();
                yield String.format("create rule %s '%s': %s", op.identity().key(), r.name(), describe(r));
            }
            case UPDATE -> {
                FirewallRule r = (FirewallRule) op.desired();
                FirewallRule was = (FirewallRule) op.current();
                String moved = was.priority().equals(r.priority()) ? "" : " (moved from priority " + was.priority() + ")";
                yield String.format("update rule %s '%s'%s: %s", op.identity().key(), r.name(), moved,
                    String.join(", ", op.changedFields()));
            }
            case DELETE -> {
                FirewallRule r = (FirewallRule) op.current();
                yield String.format("delete rule %s '%s'", op.identity().key(), r.name());
            }
        };
    }
    
    private String describe(FirewallRule r) {
        return String.format("%s %s from %s to %s", r.action(), r.protocol(),
            describe(r.source()), describe(r.destination()));
    }
    
    private String describe(RuleSelector selector) {
        String target;
        if (selector.referencesSegment()) {
            target = "segment " + selector.segment();
        } else if (selector.cidr() != null) {
            target = selector.cidr();
        } else {
            target = "any";
        }
        return selector.port() != null ? target + " port " + selector.port() : target;
    }
}
