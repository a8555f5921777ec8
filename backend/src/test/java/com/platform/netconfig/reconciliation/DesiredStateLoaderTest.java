package com.platform.netconfig.reconciliation;

import com.platform.netconfig.error.ErrorCode;
import com.platform.netconfig.error.ValidationException;
import com.platform.netconfig.model.DhcpOption;
import com.platform.netconfig.model.DhcpScope;
import com.platform.netconfig.model.HardwareProfile;
import com.platform.netconfig.model.NetworkSegment;
import com.platform.netconfig.model.NetworkState;
import com.platform.netconfig.model.RuleSelector;
import com.platform.netconfig.validation.ConfigValidator;
import com.platform.netconfig.validation.Violation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class DesiredStateLoaderTest {

    private final DesiredStateLoader loader = new DesiredStateLoader();

    @Test
    void loadsSampleDocument() throws URISyntaxException {
        Path sample = Paths.get(getClass().getResource("/desired-state/network.yaml").toURI());

        NetworkState state = loader.load(sample);

        assertThat(state.segments()).extracting(NetworkSegment::vlanId).containsExactly(10, 20, 30);
        assertThat(state.firewallRules()).hasSize(3);
        assertThat(state.segments().get(1).purpose()).isEqualTo("guest");
        assertThat(state.segments().get(1).dhcp().leaseSeconds()).isEqualTo(3600);
        assertThat(state.firewallRules().get(2).destination())
            .isEqualTo(new RuleSelector(null, "10.0.10.1/32", "53"));
        NetworkSegment iot = state.segments().get(2);
        assertThat(iot.igmpSnooping()).isTrue();
        assertThat(iot.multicastDns()).isTrue();
        assertThat(iot.dhcp().options()).containsExactly(new DhcpOption(42, "10.0.30.1"));
        assertThat(new ConfigValidator(Set.of(1))
            .validate(state, new HardwareProfile("usg3p", "USG", 3)).isValid()).isTrue();
    }

    @Test
    void appliesDefaultsForOmittedFields() {
        NetworkState state = loader.parse("""
            segments:
              - vlan_id: 40
                name: Cameras
                subnet: 10.0.40.0/24
                gateway: 10.0.40.1
            firewall_rules:
              - chain: lan-in
                priority: 10
                name: Block
                action: DENY
            """);

        NetworkSegment segment = state.segments().get(0);
        assertThat(segment.purpose()).isEqualTo("corporate");
        assertThat(segment.enabled()).isTrue();
        assertThat(segment.dhcp()).isEqualTo(DhcpScope.disabled());
        assertThat(segment.igmpSnooping()).isFalse();
        assertThat(segment.multicastDns()).isFalse();
        assertThat(state.firewallRules().get(0).chain()).isEqualTo("LAN_IN");
        assertThat(state.firewallRules().get(0).action()).isEqualTo("deny");
        assertThat(state.firewallRules().get(0).protocol()).isEqualTo("all");
    }

    @Test
    void acceptsJson() {
        NetworkState state = loader.parse("{\"segments\": [{\"vlan_id\": 50, \"name\": \"Lab\"}]}");

        assertThat(state.segments()).extracting(NetworkSegment::name).containsExactly("Lab");
        assertThat(state.firewallRules()).isEmpty();
    }

    @Test
    void blankDocumentIsEmptyState() {
        assertThat(loader.parse("  \n")).isEqualTo(NetworkState.empty());
    }

    @Test
    void unknownKeyIsReportedWithItsPath() {
        assertThatThrownBy(() -> loader.parse("""
            segments:
              - vlan: 40
                name: Cameras
            """))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> {
                ValidationException ve = (ValidationException) e;
                assertThat(ve.getErrorCode()).isEqualTo(ErrorCode.DESIRED_STATE_UNREADABLE);
                assertThat(ve.getViolations()).extracting(Violation::field, Violation::rule)
                    .containsExactly(tuple("segments[0].vlan", "document-schema"));
            });
    }

    @Test
    void wrongTypeCarriesRejectedValue() {
        assertThatThrownBy(() -> loader.parse("""
            segments:
              - vlan_id: ten
            """))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> {
                List<Violation> violations = ((ValidationException) e).getViolations();
                assertThat(violations).singleElement().satisfies(v -> {
                    assertThat(v.field()).isEqualTo("segments[0].vlan_id");
                    assertThat(v.value()).isEqualTo("ten");
                });
            });
    }

    @Test
    void syntaxErrorIsUnreadable() {
        assertThatThrownBy(() -> loader.parse("segments: [ {vlan_id: 10"))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ValidationException) e).getViolations())
                .extracting(Violation::rule).containsExactly("document-syntax"));
    }

    @Test
    void missingFileIsNotFound(@TempDir Path dir) {
        assertThatThrownBy(() -> loader.load(dir.resolve("absent.yaml")))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ValidationException) e).getErrorCode())
                .isEqualTo(ErrorCode.DESIRED_STATE_NOT_FOUND));
    }
}
