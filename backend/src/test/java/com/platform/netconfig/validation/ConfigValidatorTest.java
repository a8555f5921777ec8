package com.platform.netconfig.validation;

import com.platform.netconfig.model.DhcpOption;
import com.platform.netconfig.model.DhcpScope;
import com.platform.netconfig.model.FirewallRule;
import com.platform.netconfig.model.HardwareProfile;
import com.platform.netconfig.model.NetworkSegment;
import com.platform.netconfig.model.NetworkState;
import com.platform.netconfig.model.RuleSelector;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.platform.netconfig.support.NetworkFixtures.denyRule;
import static com.platform.netconfig.support.NetworkFixtures.segment;
import static com.platform.netconfig.support.NetworkFixtures.state;
import static org.assertj.core.api.Assertions.assertThat;

class ConfigValidatorTest {

    private static final HardwareProfile USG_3P = new HardwareProfile("usg3p", "UniFi Security Gateway 3P", 3);
    private static final HardwareProfile UDM_PRO = new HardwareProfile("udm-pro", "UniFi Dream Machine Pro", 31);

    private final ConfigValidator validator = new ConfigValidator(Set.of(1));

    @Test
    void acceptsWellFormedState() {
        NetworkState desired = state(
            List.of(segment(10, "Trusted"), segment(30, "IoT")),
            List.of(denyRule("LAN_IN", 2000, "block-iot", 30, 10)));

        ValidationResult result = validator.validate(desired, UDM_PRO);

        assertThat(result.isValid()).isTrue();
        assertThat(result.violations()).isEmpty();
    }

    @Test
    void acceptsExactlyTheSegmentCeiling() {
        NetworkState desired = state(segment(10), segment(20), segment(30));

        assertThat(validator.validate(desired, USG_3P).isValid()).isTrue();
    }

    @Test
    void rejectsOneSegmentOverTheCeiling() {
        NetworkState desired = state(segment(10), segment(20), segment(30), segment(40));

        ValidationResult result = validator.validate(desired, USG_3P);

        assertThat(result.failedClass()).isEqualTo(ViolationClass.HARDWARE);
        assertThat(result.violations()).singleElement().satisfies(v -> {
            assertThat(v.rule()).isEqualTo("hardware-segment-ceiling");
            assertThat(v.message()).contains("at most 3").contains("found 4");
        });
    }

    @Test
    void rejectsOverlappingSubnetsInEitherOrder() {
        NetworkSegment wide = new NetworkSegment(10, "wide", null, "10.0.0.0/16", "10.0.0.1", null, null, null);
        NetworkSegment narrow = segment(20, "narrow");

        for (NetworkState desired : List.of(state(wide, narrow), state(narrow, wide))) {
            ValidationResult result = validator.validate(desired, UDM_PRO);

            assertThat(result.failedClass()).isEqualTo(ViolationClass.UNIQUENESS);
            assertThat(result.violations()).extracting(Violation::rule).containsExactly("subnet-overlap");
        }
    }

    @Test
    void rejectsDuplicateVlanAndRulePriority() {
        NetworkState desired = state(
            List.of(segment(10, "a"), new NetworkSegment(10, "b", null, "10.0.11.0/24", "10.0.11.1", null, null, null)),
            List.of(denyRule("LAN_IN", 2000, "one", 10, 10), denyRule("LAN_IN", 2000, "two", 10, 10)));

        ValidationResult result = validator.validate(desired, UDM_PRO);

        assertThat(result.failedClass()).isEqualTo(ViolationClass.UNIQUENESS);
        assertThat(result.violations()).extracting(Violation::rule)
            .containsExactlyInAnyOrder("unique-vlan-id", "unique-priority-per-chain");
    }

    @Test
    void rejectsManagementVlanAndConfiguredProtectedVlans() {
        ConfigValidator strict = new ConfigValidator(Set.of(1, 99));
        NetworkSegment management = new NetworkSegment(1, "Default", null, "192.168.1.0/24", "192.168.1.1",
            null, null, null);
        NetworkSegment reserved = new NetworkSegment(99, "Reserved", null, "10.0.99.0/24", "10.0.99.1",
            null, null, null);

        ValidationResult result = strict.validate(state(management, reserved), UDM_PRO);

        assertThat(result.failedClass()).isEqualTo(ViolationClass.STRUCTURAL);
        assertThat(result.violations()).extracting(Violation::field)
            .containsExactly("segments[0].vlan_id", "segments[1].vlan_id");
        assertThat(result.violations()).extracting(Violation::rule).containsOnly("protected-segment");
    }

    @Test
    void reportsEveryStructuralViolationBeforeLaterClasses() {
        NetworkSegment broken = new NetworkSegment(20, "broken", null, "10.0.20.0/24", "10.0.21.1",
            new DhcpScope(true, "10.0.20.200", "10.0.20.100", null, null), null, null);
        FirewallRule badRule = new FirewallRule("LAN_IN", 0, "dns", "permit", "all",
            new RuleSelector(null, null, "53"), null, null);
        // duplicate VLAN would be a uniqueness violation, which must not be reported yet
        NetworkState desired = state(List.of(broken, segment(20, "dup")), List.of(badRule));

        ValidationResult result = validator.validate(desired, UDM_PRO);

        assertThat(result.failedClass()).isEqualTo(ViolationClass.STRUCTURAL);
        assertThat(result.violations()).extracting(Violation::rule).containsExactlyInAnyOrder(
            "gateway-in-subnet", "dhcp-range-order", "positive", "known-action", "port-protocol");
    }

    @Test
    void rejectsDhcpRangeCoveringGateway() {
        NetworkSegment segment = new NetworkSegment(20, "lan", null, "10.0.20.0/24", "10.0.20.1",
            new DhcpScope(true, "10.0.20.1", "10.0.20.254", null, null), null, null);

        ValidationResult result = validator.validate(state(segment), UDM_PRO);

        assertThat(result.violations()).extracting(Violation::rule).containsExactly("dhcp-excludes-gateway");
    }

    @Test
    void rejectsReferenceToUndeclaredSegment() {
        NetworkState desired = state(
            List.of(segment(10)),
            List.of(denyRule("LAN_IN", 2000, "to-ghost", 10, 77)));

        ValidationResult result = validator.validate(desired, UDM_PRO);

        assertThat(result.failedClass()).isEqualTo(ViolationClass.REFERENTIAL);
        assertThat(result.violations()).singleElement().satisfies(v -> {
            assertThat(v.field()).isEqualTo("firewall_rules[0].destination.segment");
            assertThat(v.value()).isEqualTo(77);
        });
    }

    @Test
    void managementVlanIsAValidRuleReference() {
        ConfigValidator noConfiguredProtection = new ConfigValidator(Set.of());
        NetworkState desired = state(
            List.of(segment(30)),
            List.of(denyRule("LAN_IN", 2000, "iot-to-mgmt", 30, 1)));

        assertThat(noConfiguredProtection.validate(desired, UDM_PRO).isValid()).isTrue();
    }

    @Test
    void emptyStateIsValid() {
        assertThat(validator.validate(NetworkState.empty(), USG_3P).isValid()).isTrue();
    }

    @Test
    void rejectsAddressesNotWrittenInCanonicalForm() {
        NetworkSegment padded = new NetworkSegment(10, "padded", null, "10.0.010.0/24", "10.0.10.01",
            new DhcpScope(true, "10.0.10.100", "10.0.10.200", null, List.of("010.0.10.1")), null, null);
        NetworkSegment signedPrefix = new NetworkSegment(20, "signed", null, "10.0.20.0/+24", "10.0.20.1",
            null, null, null);
        NetworkSegment zeroPrefix = new NetworkSegment(30, "zero", null, "10.0.30.0/024", "10.0.30.1",
            null, null, null);

        ValidationResult result = validator.validate(state(padded, signedPrefix, zeroPrefix), UDM_PRO);

        assertThat(result.failedClass()).isEqualTo(ViolationClass.STRUCTURAL);
        assertThat(result.violations()).extracting(Violation::field).containsExactly(
            "segments[0].subnet", "segments[0].gateway", "segments[0].dhcp.dns_servers[0]",
            "segments[1].subnet", "segments[2].subnet");
        assertThat(result.violations()).extracting(Violation::rule).containsOnly("canonical-form");
        assertThat(result.violations().get(0).message()).isEqualTo("Write as 10.0.10.0/24");
        assertThat(result.violations().get(3).message()).isEqualTo("Write as 10.0.20.0/24");
    }

    @Test
    void rejectsPaddedOrZeroPrefixedPorts() {
        FirewallRule padded = new FirewallRule("LAN_IN", 2000, "dns", "allow", "udp",
            null, new RuleSelector(10, null, " 53"), null);
        FirewallRule zeroPrefixed = new FirewallRule("LAN_IN", 2001, "web", "allow", "tcp",
            null, new RuleSelector(10, null, "080-0443"), null);
        FirewallRule canonical = new FirewallRule("LAN_IN", 2002, "ntp", "allow", "udp",
            null, new RuleSelector(10, null, "123"), null);

        ValidationResult result = validator.validate(
            state(List.of(segment(10)), List.of(padded, zeroPrefixed, canonical)), UDM_PRO);

        assertThat(result.violations()).extracting(Violation::field)
            .containsExactly("firewall_rules[0].destination.port", "firewall_rules[1].destination.port");
        assertThat(result.violations()).extracting(Violation::message)
            .containsExactly("Write as 53", "Write as 80-443");
    }

    @Test
    void rejectsNonCanonicalSelectorCidr() {
        FirewallRule rule = new FirewallRule("LAN_IN", 2000, "from-lab", "deny", null,
            new RuleSelector(null, "192.168.001.0/24", null), RuleSelector.segment(10), null);

        ValidationResult result = validator.validate(state(List.of(segment(10)), List.of(rule)), UDM_PRO);

        assertThat(result.violations()).singleElement().satisfies(v -> {
            assertThat(v.field()).isEqualTo("firewall_rules[0].source.cidr");
            assertThat(v.rule()).isEqualTo("canonical-form");
        });
    }

    @Test
    void acceptsDhcpOptionsAndMulticastSwitches() {
        NetworkSegment base = segment(10);
        NetworkSegment segment = new NetworkSegment(10, "lab", null, base.subnet(), base.gateway(),
            new DhcpScope(true, "10.0.10.100", "10.0.10.200", null, null,
                List.of(new DhcpOption(42, "10.0.10.1"), new DhcpOption(66, "tftp.lab.lan"))),
            null, null, true, true);

        assertThat(validator.validate(state(segment), UDM_PRO).isValid()).isTrue();
    }

    @Test
    void rejectsInvalidDhcpOptions() {
        NetworkSegment base = segment(10);
        NetworkSegment segment = new NetworkSegment(10, "lab", null, base.subnet(), base.gateway(),
            new DhcpScope(true, "10.0.10.100", "10.0.10.200", null, null, List.of(
                new DhcpOption(0, "x"),
                new DhcpOption(255, "x"),
                new DhcpOption(6, "10.0.10.1"),
                new DhcpOption(42, "10.0.10.1"),
                new DhcpOption(42, "10.0.10.2"),
                new DhcpOption(null, " "))),
            null, null);

        ValidationResult result = validator.validate(state(segment), UDM_PRO);

        assertThat(result.failedClass()).isEqualTo(ViolationClass.STRUCTURAL);
        assertThat(result.violations()).extracting(Violation::rule).containsExactly(
            "dhcp-option-range", "dhcp-option-range", "dhcp-option-managed", "dhcp-option-unique",
            "required", "required");
        assertThat(result.violations().get(3).field()).isEqualTo("segments[0].dhcp.options[4].option");
        assertThat(result.violations().get(3).message()).contains("segments[0].dhcp.options[3]");
    }
}
