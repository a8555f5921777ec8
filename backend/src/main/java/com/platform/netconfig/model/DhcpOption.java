package com.platform.netconfig.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A raw DHCP option handed out with every lease, e.g. option 42 (NTP servers).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DhcpOption(Integer option, String value) {
}
