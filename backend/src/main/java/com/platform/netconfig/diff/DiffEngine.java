package com.platform.netconfig.diff;

import com.platform.netconfig.config.NetConfigProperties;
import com.platform.netconfig.model.DhcpScope;
import com.platform.netconfig.model.FirewallRule;
import com.platform.netconfig.model.Ipv4Cidr;
import com.platform.netconfig.model.NetworkSegment;
import com.platform.netconfig.model.NetworkState;
import com.platform.netconfig.model.ObjectIdentity;
import com.platform.netconfig.plan.ProtectedSegmentFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Compares desired and live state and classifies the differences into
 * create, update and delete operations.
 *
 * <p>Both sides are keyed by identity: VLAN tag for segments, chain and
 * priority for rules. Equality is structural. A rule that only moved to a
 * different priority in the same chain (matched by name) becomes a single
 * update so the rule is never absent on the controller.
 *
 * <p>The engine attaches dependency edges but does not order anything;
 * ordering belongs to the planner.
 */
@Slf4j
@Component
public class DiffEngine {
    
    private static final Map<String, Function<NetworkSegment, Object>> SEGMENT_FIELDS = new LinkedHashMap<>();
    private static final Map<String, Function<FirewallRule, Object>> RULE_FIELDS = new LinkedHashMap<>();
    
    static {
        SEGMENT_FIELDS.put("name", NetworkSegment::name);
        SEGMENT_FIELDS.put("purpose", NetworkSegment::purpose);
        SEGMENT_FIELDS.put("subnet", NetworkSegment::subnet);
        SEGMENT_FIELDS.put("gateway", NetworkSegment::gateway);
        // a disabled scope compares equal whatever range the controller remembers
        SEGMENT_FIELDS.put("dhcp", s -> s.dhcp().isEnabled() ? s.dhcp().withSortedOptions() : DhcpScope.disabled());
        SEGMENT_FIELDS.put("domain_name", NetworkSegment::domainName);
        SEGMENT_FIELDS.put("igmp_snooping", NetworkSegment::igmpSnooping);
        SEGMENT_FIELDS.put("multicast_dns", NetworkSegment::multicastDns);
        SEGMENT_FIELDS.put("enabled", NetworkSegment::enabled);
        
        RULE_FIELDS.put("priority", FirewallRule::priority);
        RULE_FIELDS.put("name", FirewallRule::name);
        RULE_FIELDS.put("action", FirewallRule::action);
        RULE_FIELDS.put("protocol", FirewallRule::protocol);
        RULE_FIELDS.put("source", FirewallRule::source);
        RULE_FIELDS.put("destination", FirewallRule::destination);
        RULE_FIELDS.put("enabled", FirewallRule::enabled);
    }
    
    private final Set<Integer> protectedSegmentIds;
    
    @Autowired
    public DiffEngine(NetConfigProperties properties) {
        this(Set.copyOf(properties.getProtectedSegmentIds()));
    }
    
    public DiffEngine(Set<Integer> protectedSegmentIds) {
        Set<Integer> ids = new HashSet<>(protectedSegmentIds);
        ids.add(ProtectedSegmentFilter.MANAGEMENT_VLAN);
        this.protectedSegmentIds = Set.copyOf(ids);
    }
    
    public List<Operation> diff(NetworkState desired, NetworkState live) {
        Map<Integer, NetworkSegment> desiredSegments = bySegmentTag(desired.segments());
        Map<Integer, NetworkSegment> liveSegments = bySegmentTag(live.segments());
        
        List<NetworkSegment> createdOrUpdated = new ArrayList<>();
        Map<Integer, List<String>> changedByTag = new HashMap<>();
        Set<Integer> createdSegments = new HashSet<>();
        List<NetworkSegment> deletedSegments = new ArrayList<>();
        
        Set<Integer> tags = new TreeSet<>(desiredSegments.keySet());
        tags.addAll(liveSegments.keySet());
        for (Integer tag : tags) {
            NetworkSegment want = desiredSegments.get(tag);
            NetworkSegment have = liveSegments.get(tag);
            if (have == null) {
                createdOrUpdated.add(want);
                createdSegments.add(tag);
            } else if (want == null) {
                deletedSegments.add(have);
            } else {
                List<String> changed = changedFields(SEGMENT_FIELDS, have, want);
                if (!changed.isEmpty()) {
                    createdOrUpdated.add(want);
                    changedByTag.put(tag, changed);
                }
            }
        }
        
        List<Operation> segmentOps = new ArrayList<>();
        for (NetworkSegment want : createdOrUpdated) {
            Set<String> dependsOn = subnetReleases(want, liveSegments, deletedSegments, changedByTag);
            NetworkSegment have = liveSegments.get(want.vlanId());
            segmentOps.add(have == null
                ? Operation.create(want, dependsOn)
                : Operation.update(have, want, changedByTag.get(want.vlanId()), dependsOn));
        }
        
        Set<Integer> knownSegments = new HashSet<>(desiredSegments.keySet());
        knownSegments.addAll(liveSegments.keySet());
        knownSegments.addAll(protectedSegmentIds);
        
        List<Operation> ruleOps = splitBlockedRuleUpdates(
            diffRules(desired.firewallRules(), live.firewallRules(), createdSegments, knownSegments),
            segmentOps, deletedSegments);
        
        // rule deletes and rule updates that drop a reference run before the segment goes away
        for (NetworkSegment segment : deletedSegments) {
            Set<String> dependsOn = new TreeSet<>();
            for (Operation ruleOp : ruleOps) {
                if (ruleOp.kind() != OperationKind.CREATE
                        && ((FirewallRule) ruleOp.current()).referencedSegments().contains(segment.vlanId())) {
                    dependsOn.add(ruleOp.id());
                }
            }
            segmentOps.add(Operation.delete(segment, dependsOn));
        }
        
        List<Operation> operations = new ArrayList<>(segmentOps);
        operations.addAll(ruleOps);
        log.debug("Diff produced {} operation(s): {} segment, {} rule",
            operations.size(), segmentOps.size(), ruleOps.size());
        return operations;
    }
    
    private List<Operation> diffRules(List<FirewallRule> desiredRules, List<FirewallRule> liveRules,
                                      Set<Integer> createdSegments, Set<Integer> knownSegments) {
        Map<ObjectIdentity, FirewallRule> desired = byIdentity(desiredRules);
        Map<ObjectIdentity, FirewallRule> live = byIdentity(liveRules);
        
        List<Operation> ops = new ArrayList<>();
        List<FirewallRule> unmatchedDesired = new ArrayList<>();
        List<FirewallRule> unmatchedLive = new ArrayList<>();
        
        for (Map.Entry<ObjectIdentity, FirewallRule> entry : desired.entrySet()) {
            FirewallRule want = entry.getValue();
            FirewallRule have = live.get(entry.getKey());
            if (have == null) {
                unmatchedDesired.add(want);
            } else {
                List<String> changed = changedFields(RULE_FIELDS, have, want);
                if (!changed.isEmpty()) {
                    ops.add(Operation.update(have, want, changed,
                        segmentDependencies(want, createdSegments, knownSegments)));
                }
            }
        }
        for (Map.Entry<ObjectIdentity, FirewallRule> entry : live.entrySet()) {
            if (!desired.containsKey(entry.getKey())) {
                unmatchedLive.add(entry.getValue());
            }
        }
        
        // same chain and name at a different priority: a move, not delete + create
        for (Iterator<FirewallRule> it = unmatchedDesired.iterator(); it.hasNext(); ) {
            FirewallRule want = it.next();
            FirewallRule moved = findByChainAndName(unmatchedLive, want);
            if (moved != null) {
                unmatchedLive.remove(moved);
                it.remove();
                ops.add(Operation.update(moved, want, changedFields(RULE_FIELDS, moved, want),
                    segmentDependencies(want, createdSegments, knownSegments)));
            }
        }
        
        for (FirewallRule want : unmatchedDesired) {
            ops.add(Operation.create(want, segmentDependencies(want, createdSegments, knownSegments)));
        }
        for (FirewallRule have : unmatchedLive) {
            ops.add(Operation.delete(have, Set.of()));
        }
        
        ops.sort((a, b) -> a.identity().compareTo(b.identity()));
        return ops;
    }
    
    /**
     * A rule update that moves a reference from a deleted segment to a new
     * segment whose create waits for that delete can never be ordered. Such
     * an update becomes a delete of the live rule followed by a create.
     */
    private List<Operation> splitBlockedRuleUpdates(List<Operation> ruleOps, List<Operation> segmentOps,
                                                    List<NetworkSegment> deletedSegments) {
        Map<String, Set<String>> segmentDeps = new HashMap<>();
        segmentOps.forEach(op -> segmentDeps.put(op.id(), op.dependsOn()));
        Set<Integer> deletedTags = new HashSet<>();
        deletedSegments.forEach(s -> deletedTags.add(s.vlanId()));
        
        List<Operation> result = new ArrayList<>();
        for (Operation op : ruleOps) {
            if (op.kind() == OperationKind.UPDATE && waitsOnOwnReference(op, segmentDeps, deletedTags)) {
                log.debug("Splitting {} into delete and create: its new segment waits for an old one", op.id());
                result.add(Operation.delete(op.current(), Set.of()));
                result.add(Operation.create(op.desired(), op.dependsOn()));
            } else {
                result.add(op);
            }
        }
        return result;
    }
    
    private static boolean waitsOnOwnReference(Operation ruleUpdate, Map<String, Set<String>> segmentDeps,
                                               Set<Integer> deletedTags) {
        for (Integer tag : ((FirewallRule) ruleUpdate.current()).referencedSegments()) {
            if (!deletedTags.contains(tag)) {
                continue;
            }
            String segmentDelete = Operation.idOf(OperationKind.DELETE, ObjectIdentity.segment(tag));
            for (String dependency : ruleUpdate.dependsOn()) {
                if (segmentDeps.getOrDefault(dependency, Set.of()).contains(segmentDelete)) {
                    return true;
                }
            }
        }
        return false;
    }
    
    /**
     * Edges from a segment that claims a subnet to the operations that free
     * it: the delete of a live segment whose subnet overlaps, or the update
     * that moves another live segment off it. Two segments swapping subnets
     * therefore form a cycle, which the planner reports.
     */
    private Set<String> subnetReleases(NetworkSegment want, Map<Integer, NetworkSegment> liveSegments,
                                       List<NetworkSegment> deletedSegments, Map<Integer, List<String>> changedByTag) {
        Set<String> dependsOn = new TreeSet<>();
        for (NetworkSegment gone : deletedSegments) {
            if (overlaps(want.subnet(), gone.subnet())) {
                dependsOn.add(Operation.idOf(OperationKind.DELETE, gone.identity()));
            }
        }
        changedByTag.forEach((tag, changed) -> {
            NetworkSegment other = liveSegments.get(tag);
            if (!tag.equals(want.vlanId()) && changed.contains("subnet") && overlaps(want.subnet(), other.subnet())) {
                dependsOn.add(Operation.idOf(OperationKind.UPDATE, other.identity()));
            }
        });
        return dependsOn;
    }
    
    private static boolean overlaps(String subnet, String other) {
        if (subnet == null || other == null) {
            return false;
        }
        try {
            return Ipv4Cidr.parse(subnet).overlaps(Ipv4Cidr.enclosing(other));
        } catch (IllegalArgumentException e) {
            log.debug("Skipping overlap check of {} and {}: {}", subnet, other, e.getMessage());
            return false;
        }
    }
    
    /**
     * Edges from a rule to the creates of segments it references. A reference
     * to a segment that exists nowhere yields an edge to a create that will
     * never be planned, which the planner reports as unresolved.
     */
    private Set<String> segmentDependencies(FirewallRule rule, Set<Integer> createdSegments, Set<Integer> knownSegments) {
        Set<String> dependsOn = new LinkedHashSet<>();
        for (Integer tag : rule.referencedSegments()) {
            if (createdSegments.contains(tag) || !knownSegments.contains(tag)) {
                dependsOn.add(Operation.idOf(OperationKind.CREATE, ObjectIdentity.segment(tag)));
            }
        }
        return dependsOn;
    }
    
    private static FirewallRule findByChainAndName(List<FirewallRule> candidates, FirewallRule rule) {
        for (FirewallRule candidate : candidates) {
            if (Objects.equals(candidate.chain(), rule.chain()) && Objects.equals(candidate.name(), rule.name())) {
                return candidate;
            }
        }
        return null;
    }
    
    private static <T> List<String> changedFields(Map<String, Function<T, Object>> fields, T before, T after) {
        List<String> changed = new ArrayList<>();
        fields.forEach((name, accessor) -> {
            if (!Objects.equals(accessor.apply(before), accessor.apply(after))) {
                changed.add(name);
            }
        });
        return changed;
    }
    
    private static Map<Integer, NetworkSegment> bySegmentTag(List<NetworkSegment> segments) {
        Map<Integer, NetworkSegment> map = new TreeMap<>();
        segments.forEach(s -> map.put(s.vlanId(), s));
        return map;
    }
    
    private static Map<ObjectIdentity, FirewallRule> byIdentity(List<FirewallRule> rules) {
        Map<ObjectIdentity, FirewallRule> map = new TreeMap<>();
        rules.forEach(r -> map.put(r.identity(), r));
        return map;
    }
}
