package com.platform.netconfig.controller;

import com.platform.netconfig.model.FirewallRule;
import com.platform.netconfig.model.NetworkSegment;
import com.platform.netconfig.model.NetworkState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.platform.netconfig.support.NetworkFixtures.denyRule;
import static com.platform.netconfig.support.NetworkFixtures.segment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LiveStateFetcherTest {

    @Test
    void ordersSegmentsByVlanAndRulesByChainAndPriority() {
        ControllerClient client = mock(ControllerClient.class);
        when(client.fetchSegments()).thenReturn(List.of(segment(30), segment(10), segment(20)));
        when(client.fetchFirewallRules()).thenReturn(List.of(
            denyRule("LAN_IN", 2010, "c", 10, 20),
            denyRule("GUEST_IN", 1, "b", 10, 20),
            denyRule("LAN_IN", 2002, "a", 10, 20)));

        NetworkState live = new LiveStateFetcher(client).fetch();

        assertThat(live.segments()).extracting(NetworkSegment::vlanId).containsExactly(10, 20, 30);
        assertThat(live.firewallRules()).extracting(FirewallRule::name).containsExactly("b", "a", "c");
    }
}
