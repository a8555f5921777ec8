package com.platform.netconfig.controller.unifi;

import com.platform.netconfig.controller.unifi.UniFiModels.DhcpOptionConf;
import com.platform.netconfig.controller.unifi.UniFiModels.FirewallRuleConf;
import com.platform.netconfig.controller.unifi.UniFiModels.NetworkConf;
import com.platform.netconfig.model.DhcpOption;
import com.platform.netconfig.model.DhcpScope;
import com.platform.netconfig.model.FirewallRule;
import com.platform.netconfig.model.Ipv4Cidr;
import com.platform.netconfig.model.NetworkSegment;
import com.platform.netconfig.model.RuleSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Bidirectional mappers between domain objects and UniFi controller DTOs.
 *
 * <p>Live objects are normalised into exactly the shape a desired-state
 * document would produce, so an unchanged object never diffs.
 */
@Slf4j
@Component
public class ControllerModelMapper {
    
    static final int UNTAGGED_VLAN = 1;
    
    private static final String NETWORK_TYPE = "NETv4";
    
    // ==================== Segments ====================
    
    /**
     * VLAN tag of a network. The untagged default LAN is the management VLAN.
     */
    public int vlanOf(NetworkConf conf) {
        if (Boolean.TRUE.equals(conf.getVlanEnabled()) && conf.getVlan() != null) {
            return conf.getVlan();
        }
        return UNTAGGED_VLAN;
    }
    
    /**
     * Whether a network entry is a managed LAN segment (WAN uplinks and VPNs are not).
     */
    public boolean isSegment(NetworkConf conf) {
        String purpose = conf.getPurpose();
        return purpose == null
            || purpose.equals("corporate")
            || purpose.equals("guest")
            || purpose.equals("vlan-only");
    }
    
    public NetworkSegment toSegment(NetworkConf conf) {
        String subnet = null;
        String gateway = null;
        if (conf.getIpSubnet() != null && !conf.getIpSubnet().isBlank()) {
            try {
                subnet = Ipv4Cidr.enclosing(conf.getIpSubnet()).toString();
                gateway = conf.getIpSubnet().substring(0, conf.getIpSubnet().indexOf('/'));
            } catch (IllegalArgumentException e) {
                log.warn("Network {} has malformed ip_subnet '{}': {}", conf.getName(), conf.getIpSubnet(), e.getMessage());
                subnet = conf.getIpSubnet();
            }
        }
        
        return new NetworkSegment(
            vlanOf(conf),
            conf.getName(),
            conf.getPurpose(),
            subnet,
            gateway,
            toDhcpScope(conf),
            blankToNull(conf.getDomainName()),
            conf.getEnabled(),
            conf.getIgmpSnooping(),
            conf.getMdnsEnabled()
        );
    }
    
    private DhcpScope toDhcpScope(NetworkConf conf) {
        if (!Boolean.TRUE.equals(conf.getDhcpdEnabled())) {
            return DhcpScope.disabled();
        }
        List<String> dns = List.of();
        if (Boolean.TRUE.equals(conf.getDhcpdDnsEnabled())) {
            dns = Stream.of(conf.getDhcpdDns1(), conf.getDhcpdDns2(), conf.getDhcpdDns3(), conf.getDhcpdDns4())
                .filter(server -> server != null && !server.isBlank())
                .toList();
        }
        List<DhcpOption> options = conf.getDhcpdOptions() == null ? List.of() : conf.getDhcpdOptions().stream()
            .map(o -> new DhcpOption(o.getOption(), o.getValue()))
            .toList();
        return new DhcpScope(true, conf.getDhcpdStart(), conf.getDhcpdStop(), conf.getDhcpdLeasetime(), dns, options);
    }
    
    /**
     * Controller payload for a segment. {@code id} is null for a create.
     */
    public NetworkConf toNetworkConf(NetworkSegment segment, String id) {
        NetworkConf conf = new NetworkConf();
        conf.setId(id);
        conf.setName(segment.name());
        conf.setPurpose(segment.purpose());
        conf.setNetworkgroup("LAN");
        conf.setVlanEnabled(segment.vlanId() != UNTAGGED_VLAN);
        conf.setVlan(segment.vlanId() != UNTAGGED_VLAN ? segment.vlanId() : null);
        
        if (segment.subnet() != null && segment.gateway() != null) {
            int prefix = Ipv4Cidr.parse(segment.subnet()).prefixLength();
            conf.setIpSubnet(segment.gateway() + "/" + prefix);
        }
        
        DhcpScope dhcp = segment.dhcp();
        conf.setDhcpdEnabled(dhcp.isEnabled());
        if (dhcp.isEnabled()) {
            conf.setDhcpdStart(dhcp.start());
            conf.setDhcpdStop(dhcp.stop());
            conf.setDhcpdLeasetime(dhcp.leaseSeconds());
            List<String> dns = dhcp.dnsServers();
            conf.setDhcpdDnsEnabled(!dns.isEmpty());
            conf.setDhcpdDns1(dns.size() > 0 ? dns.get(0) : "");
            conf.setDhcpdDns2(dns.size() > 1 ? dns.get(1) : "");
            conf.setDhcpdDns3(dns.size() > 2 ? dns.get(2) : "");
            conf.setDhcpdDns4(dns.size() > 3 ? dns.get(3) : "");
            conf.setDhcpdOptions(dhcp.options().stream().map(ControllerModelMapper::toOptionConf).toList());
        }
        conf.setDomainName(segment.domainName() != null ? segment.domainName() : "");
        conf.setIgmpSnooping(segment.igmpSnooping());
        conf.setMdnsEnabled(segment.multicastDns());
        conf.setEnabled(segment.enabled());
        return conf;
    }
    
    private static DhcpOptionConf toOptionConf(DhcpOption option) {
        DhcpOptionConf conf = new DhcpOptionConf();
        conf.setOption(option.option());
        conf.setValue(option.value());
        return conf;
    }
    
    // ==================== Firewall rules ====================
    
    /**
     * Converts a controller rule, resolving network references through
     * {@code vlanByNetworkId}.
     */
    public FirewallRule toRule(FirewallRuleConf conf, Map<String, Integer> vlanByNetworkId) {
        if (hasGroups(conf.getSrcFirewallgroupIds()) || hasGroups(conf.getDstFirewallgroupIds())) {
            log.warn("Rule {} uses firewall groups, which are not managed; groups are ignored", conf.getName());
        }
        return new FirewallRule(
            conf.getRuleset(),
            conf.getRuleIndex(),
            conf.getName(),
            fromControllerAction(conf.getAction()),
            conf.getProtocol(),
            toSelector(conf.getName(), conf.getSrcNetworkconfId(), conf.getSrcAddress(), conf.getSrcPort(), vlanByNetworkId),
            toSelector(conf.getName(), conf.getDstNetworkconfId(), conf.getDstAddress(), conf.getDstPort(), vlanByNetworkId),
            conf.getEnabled()
        );
    }
    
    private RuleSelector toSelector(String ruleName, String networkId, String address, String port,
                                    Map<String, Integer> vlanByNetworkId) {
        Integer segment = null;
        if (networkId != null && !networkId.isBlank()) {
            segment = vlanByNetworkId.get(networkId);
            if (segment == null) {
                log.warn("Rule {} references unknown network {}", ruleName, networkId);
            }
        }
        return new RuleSelector(segment, blankToNull(address), blankToNull(port));
    }
    
    /**
     * Controller payload for a rule. {@code id} is null for a create.
     *
     * @throws IllegalArgumentException if a referenced segment has no controller network
     */
    public FirewallRuleConf toRuleConf(FirewallRule rule, String id, Map<Integer, String> networkIdByVlan) {
        FirewallRuleConf conf = new FirewallRuleConf();
        conf.setId(id);
        conf.setName(rule.name());
        conf.setRuleset(rule.chain());
        conf.setRuleIndex(rule.priority());
        conf.setAction(toControllerAction(rule.action()));
        conf.setProtocol(rule.protocol());
        conf.setEnabled(rule.enabled());
        conf.setLogging(false);
        conf.setSrcFirewallgroupIds(new ArrayList<>());
        conf.setDstFirewallgroupIds(new ArrayList<>());
        
        RuleSelector src = rule.source();
        conf.setSrcNetworkconfId(networkId(src, networkIdByVlan));
        conf.setSrcNetworkconfType(src.referencesSegment() ? NETWORK_TYPE : null);
        conf.setSrcAddress(emptyIfNull(src.cidr()));
        conf.setSrcPort(emptyIfNull(src.port()));
        
        RuleSelector dst = rule.destination();
        conf.setDstNetworkconfId(networkId(dst, networkIdByVlan));
        conf.setDstNetworkconfType(dst.referencesSegment() ? NETWORK_TYPE : null);
        conf.setDstAddress(emptyIfNull(dst.cidr()));
        conf.setDstPort(emptyIfNull(dst.port()));
        return conf;
    }
    
    private String networkId(RuleSelector selector, Map<Integer, String> networkIdByVlan) {
        if (!selector.referencesSegment()) {
            return "";
        }
        String id = networkIdByVlan.get(selector.segment());
        if (id == null) {
            throw new IllegalArgumentException("No controller network for segment " + selector.segment());
        }
        return id;
    }
    
    static String toControllerAction(String action) {
        return switch (action) {
            case "allow" -> "accept";
            case "deny" -> "drop";
            default -> action;
        };
    }
    
    static String fromControllerAction(String action) {
        if (action == null) {
            return null;
        }
        return switch (action.toLowerCase(Locale.ROOT)) {
            case "accept" -> "allow";
            case "drop" -> "deny";
            default -> action.toLowerCase(Locale.ROOT);
        };
    }
    
    private static boolean hasGroups(List<String> groups) {
        return groups != null && !groups.isEmpty();
    }
    
    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
    
    private static String emptyIfNull(String value) {
        return value == null ? "" : value;
    }
}
