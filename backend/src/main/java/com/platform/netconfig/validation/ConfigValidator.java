package com.platform.netconfig.validation;

import com.platform.netconfig.config.NetConfigProperties;
import com.platform.netconfig.model.DhcpOption;
import com.platform.netconfig.model.DhcpScope;
import com.platform.netconfig.model.FirewallChain;
import com.platform.netconfig.model.FirewallRule;
import com.platform.netconfig.model.HardwareProfile;
import com.platform.netconfig.model.Ipv4Cidr;
import com.platform.netconfig.model.NetworkSegment;
import com.platform.netconfig.model.NetworkState;
import com.platform.netconfig.model.RuleAction;
import com.platform.netconfig.model.RuleProtocol;
import com.platform.netconfig.model.RuleSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks a desired state before anything talks to the controller.
 *
 * <p>Check classes run in order: structural, uniqueness, referential
 * integrity, hardware ceiling. The first class with violations ends
 * validation, and all of its violations are returned together. The
 * validator is a pure function of the desired state, the hardware profile
 * and the configured protected segment ids.
 */
@Slf4j
@Component
public class ConfigValidator {

    static final int MANAGEMENT_VLAN = 1;
    static final int MIN_VLAN = 2;
    static final int MAX_VLAN = 4094;

    static final int MIN_DHCP_OPTION = 1;
    static final int MAX_DHCP_OPTION = 254;

    // subnet mask, router, DNS, domain name, lease time, server id: set through dedicated fields
    private static final Set<Integer> MANAGED_DHCP_OPTIONS = Set.of(1, 3, 6, 15, 51, 54);

    private static final Pattern PORT_PATTERN = Pattern.compile("^(\\d{1,5})(?:-(\\d{1,5}))?$");

    private final Set<Integer> protectedSegmentIds;

    @Autowired
    public ConfigValidator(NetConfigProperties properties) {
        this(Set.copyOf(properties.getProtectedSegmentIds()));
    }

    public ConfigValidator(Set<Integer> protectedSegmentIds) {
        this.protectedSegmentIds = Set.copyOf(protectedSegmentIds);
    }

    public ValidationResult validate(NetworkState desired, HardwareProfile profile) {
        List<Function<NetworkState, List<Violation>>> checks = List.of(
            this::checkStructure,
            this::checkUniqueness,
            this::checkReferences,
            state -> checkHardware(state, profile)
        );

        for (Function<NetworkState, List<Violation>> check : checks) {
            List<Violation> violations = check.apply(desired);
            if (!violations.isEmpty()) {
                ViolationClass failedClass = violations.get(0).violationClass();
                log.debug("Validation failed in {} checks with {} violation(s)", failedClass, violations.size());
                return ValidationResult.failure(failedClass, violations);
            }
        }

        log.debug("Validation passed: {} segment(s), {} rule(s) against profile {}",
            desired.segments().size(), desired.firewallRules().size(), profile.id());
        return ValidationResult.success();
    }

    // ==================== Structural ====================

    private List<Violation> checkStructure(NetworkState state) {
        List<Violation> violations = new ArrayList<>();

        for (int i = 0; i < state.segments().size(); i++) {
            checkSegment("segments[" + i + "]", state.segments().get(i), violations);
        }
        for (int i = 0; i < state.firewallRules().size(); i++) {
            checkRule("firewall_rules[" + i + "]", state.firewallRules().get(i), violations);
        }
        return violations;
    }

    private void checkSegment(String path, NetworkSegment segment, List<Violation> violations) {
        if (segment.vlanId() == null) {
            violations.add(structural(path + ".vlan_id", null, "required", "VLAN id is required"));
        } else if (segment.vlanId() == MANAGEMENT_VLAN || protectedSegmentIds.contains(segment.vlanId())) {
            violations.add(structural(path + ".vlan_id", segment.vlanId(), "protected-segment",
                "VLAN " + segment.vlanId() + " is externally managed and cannot be declared"));
        } else if (segment.vlanId() < MIN_VLAN || segment.vlanId() > MAX_VLAN) {
            violations.add(structural(path + ".vlan_id", segment.vlanId(), "vlan-range",
                "VLAN id must be between " + MIN_VLAN + " and " + MAX_VLAN));
        }

        if (segment.name() == null || segment.name().isBlank()) {
            violations.add(structural(path + ".name", segment.name(), "required", "Segment name is required"));
        }

        Ipv4Cidr subnet = null;
        if (segment.subnet() == null) {
            violations.add(structural(path + ".subnet", null, "required", "Subnet is required"));
        } else {
            try {
                subnet = Ipv4Cidr.parse(segment.subnet());
                checkCanonical(path + ".subnet", segment.subnet(), subnet.toString(), violations);
            } catch (IllegalArgumentException e) {
                violations.add(structural(path + ".subnet", segment.subnet(), "cidr-format", e.getMessage()));
            }
        }

        Integer gateway = null;
        if (segment.gateway() == null) {
            violations.add(structural(path + ".gateway", null, "required", "Gateway is required"));
        } else if (!Ipv4Cidr.isValidAddress(segment.gateway())) {
            violations.add(structural(path + ".gateway", segment.gateway(), "ip-format", "Not an IPv4 address"));
        } else {
            gateway = Ipv4Cidr.parseAddress(segment.gateway());
            checkCanonicalAddress(path + ".gateway", segment.gateway(), violations);
            if (subnet != null && !subnet.contains(gateway)) {
                violations.add(structural(path + ".gateway", segment.gateway(), "gateway-in-subnet",
                    "Gateway must lie inside " + subnet));
            } else if (subnet != null && subnet.prefixLength() < 31
                    && (gateway == subnet.networkAddress() || gateway == subnet.broadcastAddress())) {
                violations.add(structural(path + ".gateway", segment.gateway(), "gateway-host-address",
                    "Gateway cannot be the network or broadcast address of " + subnet));
            }
        }

        checkDhcp(path + ".dhcp", segment.dhcp(), subnet, gateway, violations);
    }

    private void checkDhcp(String path, DhcpScope dhcp, Ipv4Cidr subnet, Integer gateway, List<Violation> violations) {
        for (int i = 0; i < dhcp.dnsServers().size(); i++) {
            String server = dhcp.dnsServers().get(i);
            if (!Ipv4Cidr.isValidAddress(server)) {
                violations.add(structural(path + ".dns_servers[" + i + "]", server, "ip-format", "Not an IPv4 address"));
            } else {
                checkCanonicalAddress(path + ".dns_servers[" + i + "]", server, violations);
            }
        }
        if (dhcp.leaseSeconds() <= 0) {
            violations.add(structural(path + ".lease_seconds", dhcp.leaseSeconds(), "positive",
                "Lease time must be positive"));
        }
        checkDhcpOptions(path + ".options", dhcp, violations);
        if (!dhcp.isEnabled()) {
            return;
        }

        Integer start = dhcpBound(path + ".start", dhcp.start(), subnet, violations);
        Integer stop = dhcpBound(path + ".stop", dhcp.stop(), subnet, violations);
        if (start == null || stop == null) {
            return;
        }
        if (Integer.compareUnsigned(start, stop) > 0) {
            violations.add(structural(path + ".start", dhcp.start(), "dhcp-range-order",
                "DHCP range start must not be after stop " + dhcp.stop()));
        } else if (gateway != null
                && Integer.compareUnsigned(start, gateway) <= 0
                && Integer.compareUnsigned(gateway, stop) <= 0) {
            violations.add(structural(path, dhcp.start() + "-" + dhcp.stop(), "dhcp-excludes-gateway",
                "DHCP range must not include the gateway address"));
        }
    }

    private void checkDhcpOptions(String path, DhcpScope dhcp, List<Violation> violations) {
        Map<Integer, Integer> seen = new HashMap<>();
        for (int i = 0; i < dhcp.options().size(); i++) {
            DhcpOption option = dhcp.options().get(i);
            String field = path + "[" + i + "]";
            if (option.option() == null) {
                violations.add(structural(field + ".option", null, "required", "Option number is required"));
            } else if (option.option() < MIN_DHCP_OPTION || option.option() > MAX_DHCP_OPTION) {
                violations.add(structural(field + ".option", option.option(), "dhcp-option-range",
                    "Option number must be between " + MIN_DHCP_OPTION + " and " + MAX_DHCP_OPTION));
            } else if (MANAGED_DHCP_OPTIONS.contains(option.option())) {
                violations.add(structural(field + ".option", option.option(), "dhcp-option-managed",
                    "Option " + option.option() + " is derived from the segment's own settings"));
            } else {
                Integer first = seen.putIfAbsent(option.option(), i);
                if (first != null) {
                    violations.add(structural(field + ".option", option.option(), "dhcp-option-unique",
                        "Option already set by " + path + "[" + first + "]"));
                }
            }
            if (option.value() == null || option.value().isBlank()) {
                violations.add(structural(field + ".value", option.value(), "required", "Option value is required"));
            }
        }
    }

    private Integer dhcpBound(String field, String value, Ipv4Cidr subnet, List<Violation> violations) {
        if (value == null) {
            violations.add(structural(field, null, "required", "Required when DHCP is enabled"));
            return null;
        }
        if (!Ipv4Cidr.isValidAddress(value)) {
            violations.add(structural(field, value, "ip-format", "Not an IPv4 address"));
            return null;
        }
        int address = Ipv4Cidr.parseAddress(value);
        checkCanonicalAddress(field, value, violations);
        if (subnet != null && !subnet.contains(address)) {
            violations.add(structural(field, value, "dhcp-in-subnet", "DHCP range must lie inside " + subnet));
            return null;
        }
        return address;
    }

    private void checkRule(String path, FirewallRule rule, List<Violation> violations) {
        if (rule.chain() == null) {
            violations.add(structural(path + ".chain", null, "required", "Chain is required"));
        } else if (FirewallChain.parse(rule.chain()).isEmpty()) {
            violations.add(structural(path + ".chain", rule.chain(), "known-chain", "Unknown firewall chain"));
        }

        if (rule.priority() == null) {
            violations.add(structural(path + ".priority", null, "required", "Priority is required"));
        } else if (rule.priority() < 1) {
            violations.add(structural(path + ".priority", rule.priority(), "positive", "Priority must be at least 1"));
        }

        if (rule.name() == null || rule.name().isBlank()) {
            violations.add(structural(path + ".name", rule.name(), "required", "Rule name is required"));
        }

        if (rule.action() == null) {
            violations.add(structural(path + ".action", null, "required", "Action is required"));
        } else if (RuleAction.parse(rule.action()).isEmpty()) {
            violations.add(structural(path + ".action", rule.action(), "known-action", "Action must be allow, deny or reject"));
        }

        RuleProtocol protocol = RuleProtocol.parse(rule.protocol()).orElse(null);
        if (protocol == null) {
            violations.add(structural(path + ".protocol", rule.protocol(), "known-protocol",
                "Protocol must be one of all, tcp, udp, tcp_udp, icmp"));
        }

        checkSelector(path + ".source", rule.source(), protocol, violations);
        checkSelector(path + ".destination", rule.destination(), protocol, violations);
    }

    private void checkSelector(String path, RuleSelector selector, RuleProtocol protocol, List<Violation> violations) {
        if (selector.segment() != null && selector.cidr() != null) {
            violations.add(structural(path, selector.segment() + "," + selector.cidr(), "selector-exclusive",
                "A selector matches either a segment or a CIDR, not both"));
        }
        if (selector.segment() != null && (selector.segment() < MANAGEMENT_VLAN || selector.segment() > MAX_VLAN)) {
            violations.add(structural(path + ".segment", selector.segment(), "vlan-range",
                "Segment reference must be a VLAN id between 1 and " + MAX_VLAN));
        }
        if (selector.cidr() != null) {
            try {
                Ipv4Cidr cidr = Ipv4Cidr.parse(selector.cidr());
                checkCanonical(path + ".cidr", selector.cidr(), cidr.toString(), violations);
            } catch (IllegalArgumentException e) {
                violations.add(structural(path + ".cidr", selector.cidr(), "cidr-format", e.getMessage()));
            }
        }
        if (selector.port() != null) {
            Matcher m = PORT_PATTERN.matcher(selector.port().trim());
            if (!m.matches() || !validPortRange(m)) {
                violations.add(structural(path + ".port", selector.port(), "port-format",
                    "Port must be N or N-M with 1 <= N <= M <= 65535"));
            } else if (!canonicalPort(m).equals(selector.port())) {
                checkCanonical(path + ".port", selector.port(), canonicalPort(m), violations);
            } else if (protocol != null && !protocol.isPortAware()) {
                violations.add(structural(path + ".port", selector.port(), "port-protocol",
                    "Ports require protocol tcp, udp or tcp_udp, not " + protocol.name().toLowerCase(Locale.ROOT)));
            }
        }
    }

    private static boolean validPortRange(Matcher m) {
        int low = Integer.parseInt(m.group(1));
        int high = m.group(2) == null ? low : Integer.parseInt(m.group(2));
        return low >= 1 && high <= 65535 && low <= high;
    }

    private static void checkCanonicalAddress(String field, String address, List<Violation> violations) {
        if (!Ipv4Cidr.isCanonicalAddress(address)) {
            checkCanonical(field, address, Ipv4Cidr.formatAddress(Ipv4Cidr.parseAddress(address)), violations);
        }
    }

    private static String canonicalPort(Matcher m) {
        int low = Integer.parseInt(m.group(1));
        return m.group(2) == null ? String.valueOf(low) : low + "-" + Integer.parseInt(m.group(2));
    }

    /**
     * Values must be spelled the way the controller echoes them back.
     */
    private static void checkCanonical(String field, String value, String canonical, List<Violation> violations) {
        if (!canonical.equals(value)) {
            violations.add(structural(field, value, "canonical-form", "Write as " + canonical));
        }
    }

    // ==================== Uniqueness ====================

    private List<Violation> checkUniqueness(NetworkState state) {
        List<Violation> violations = new ArrayList<>();

        Map<Integer, Integer> seenTags = new HashMap<>();
        Map<String, Integer> seenNames = new HashMap<>();
        List<Ipv4Cidr> subnets = new ArrayList<>();

        for (int i = 0; i < state.segments().size(); i++) {
            NetworkSegment segment = state.segments().get(i);
            String path = "segments[" + i + "]";

            Integer firstTag = seenTags.putIfAbsent(segment.vlanId(), i);
            if (firstTag != null) {
                violations.add(uniqueness(path + ".vlan_id", segment.vlanId(), "unique-vlan-id",
                    "VLAN id already used by segments[" + firstTag + "]"));
            }

            Integer firstName = seenNames.putIfAbsent(segment.name().trim().toLowerCase(Locale.ROOT), i);
            if (firstName != null) {
                violations.add(uniqueness(path + ".name", segment.name(), "unique-segment-name",
                    "Segment name already used by segments[" + firstName + "]"));
            }

            Ipv4Cidr subnet = Ipv4Cidr.parse(segment.subnet());
            for (int j = 0; j < subnets.size(); j++) {
                if (subnets.get(j).overlaps(subnet)) {
                    violations.add(uniqueness(path + ".subnet", segment.subnet(), "subnet-overlap",
                        "Subnet overlaps " + subnets.get(j) + " of segments[" + j + "]"));
                }
            }
            subnets.add(subnet);
        }

        Map<String, Integer> seenRuleKeys = new HashMap<>();
        Map<String, Integer> seenRuleNames = new HashMap<>();
        for (int i = 0; i < state.firewallRules().size(); i++) {
            FirewallRule rule = state.firewallRules().get(i);
            String path = "firewall_rules[" + i + "]";

            Integer firstKey = seenRuleKeys.putIfAbsent(rule.chain() + "#" + rule.priority(), i);
            if (firstKey != null) {
                violations.add(uniqueness(path + ".priority", rule.priority(), "unique-priority-per-chain",
                    "Priority already used in " + rule.chain() + " by firewall_rules[" + firstKey + "]"));
            }

            Integer firstName = seenRuleNames.putIfAbsent(rule.chain() + "#" + rule.name().trim(), i);
            if (firstName != null) {
                violations.add(uniqueness(path + ".name", rule.name(), "unique-rule-name-per-chain",
                    "Rule name already used in " + rule.chain() + " by firewall_rules[" + firstName + "]"));
            }
        }
        return violations;
    }

    // ==================== Referential integrity ====================

    private List<Violation> checkReferences(NetworkState state) {
        Set<Integer> resolvable = new HashSet<>(protectedSegmentIds);
        resolvable.add(MANAGEMENT_VLAN);
        state.segments().forEach(s -> resolvable.add(s.vlanId()));

        List<Violation> violations = new ArrayList<>();
        for (int i = 0; i < state.firewallRules().size(); i++) {
            FirewallRule rule = state.firewallRules().get(i);
            String path = "firewall_rules[" + i + "]";
            checkReference(path + ".source.segment", rule.source(), resolvable, violations);
            checkReference(path + ".destination.segment", rule.destination(), resolvable, violations);
        }
        return violations;
    }

    private void checkReference(String field, RuleSelector selector, Set<Integer> resolvable, List<Violation> violations) {
        if (selector.referencesSegment() && !resolvable.contains(selector.segment())) {
            violations.add(new Violation(ViolationClass.REFERENTIAL, field, selector.segment(), "segment-reference",
                "No declared segment has VLAN id " + selector.segment()));
        }
    }

    // ==================== Hardware ====================

    private List<Violation> checkHardware(NetworkState state, HardwareProfile profile) {
        int count = state.segments().size();
        if (count <= profile.maxSegments()) {
            return List.of();
        }
        return List.of(new Violation(ViolationClass.HARDWARE, "segments", count, "hardware-segment-ceiling",
            String.format("%s supports at most %d managed segments, found %d",
                profile.displayName() != null ? profile.displayName() : profile.id(),
                profile.maxSegments(), count)));
    }

    private static Violation structural(String field, Object value, String rule, String message) {
        return new Violation(ViolationClass.STRUCTURAL, field, value, rule, message);
    }

    private static Violation uniqueness(String field, Object value, String rule, String message) {
        return new Violation(ViolationClass.UNIQUENESS, field, value, rule, message);
    }
}
