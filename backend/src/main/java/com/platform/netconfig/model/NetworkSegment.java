package com.platform.netconfig.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A VLAN-backed network segment: its tag, subnet, gateway and DHCP scope,
 * plus the IGMP snooping and multicast DNS switches of the LAN.
 *
 * <p>Fields are kept in their document form (boxed numbers, address strings)
 * so the validator can report every malformed value instead of failing at
 * the first one during parsing. Defaults are applied here so a desired
 * segment and its normalised live counterpart compare equal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NetworkSegment(
    @JsonProperty("vlan_id") Integer vlanId,
    String name,
    String purpose,
    String subnet,
    String gateway,
    DhcpScope dhcp,
    @JsonProperty("domain_name") String domainName,
    Boolean enabled,
    @JsonProperty("igmp_snooping") Boolean igmpSnooping,
    @JsonProperty("multicast_dns") Boolean multicastDns
) implements ManagedObject {
    
    public static final String DEFAULT_PURPOSE = "corporate";
    
    public NetworkSegment {
        purpose = purpose == null ? DEFAULT_PURPOSE : purpose;
        dhcp = dhcp == null ? DhcpScope.disabled() : dhcp;
        enabled = enabled == null ? Boolean.TRUE : enabled;
        igmpSnooping = igmpSnooping == null ? Boolean.FALSE : igmpSnooping;
        multicastDns = multicastDns == null ? Boolean.FALSE : multicastDns;
    }
    
    public NetworkSegment(Integer vlanId, String name, String purpose, String subnet, String gateway,
                          DhcpScope dhcp, String domainName, Boolean enabled) {
        this(vlanId, name, purpose, subnet, gateway, dhcp, domainName, enabled, null, null);
    }
    
    @Override
    public ObjectIdentity identity() {
        return ObjectIdentity.segment(vlanId);
    }
}
