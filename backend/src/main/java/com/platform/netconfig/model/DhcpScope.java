package com.platform.netconfig.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;

/**
 * DHCP server settings of a segment.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DhcpScope(
    Boolean enabled,
    String start,
    String stop,
    @JsonProperty("lease_seconds") Integer leaseSeconds,
    @JsonProperty("dns_servers") List<String> dnsServers,
    List<DhcpOption> options
) {
    
    public static final int DEFAULT_LEASE_SECONDS = 86400;
    
    public DhcpScope {
        enabled = enabled == null ? Boolean.TRUE : enabled;
        leaseSeconds = leaseSeconds == null ? DEFAULT_LEASE_SECONDS : leaseSeconds;
        dnsServers = dnsServers == null ? List.of() : List.copyOf(dnsServers);
        options = options == null ? List.of() : List.copyOf(options);
    }
    
    public DhcpScope(Boolean enabled, String start, String stop, Integer leaseSeconds, List<String> dnsServers) {
        this(enabled, start, stop, leaseSeconds, dnsServers, null);
    }
    
    public static DhcpScope disabled() {
        return new DhcpScope(false, null, null, null, null);
    }
    
    /**
     * The same scope with its options ordered by option number. Option order
     * carries no meaning to DHCP clients.
     */
    public DhcpScope withSortedOptions() {
        List<DhcpOption> sorted = options.stream()
            .sorted(Comparator.comparing(DhcpOption::option, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
        return new DhcpScope(enabled, start, stop, leaseSeconds, dnsServers, sorted);
    }
    
    @JsonIgnore
    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }
}
