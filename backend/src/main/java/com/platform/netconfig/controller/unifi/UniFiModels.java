package com.platform.netconfig.controller.unifi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * DTOs for UniFi controller API communication.
 */
public class UniFiModels {
    
    /**
     * Envelope wrapping every controller response.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiResponse<T> {
        private Meta meta;
        private List<T> data;
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Meta {
        private String rc; // "ok" or "error"
        private String msg;
        
        public boolean isOk() {
            return "ok".equalsIgnoreCase(rc);
        }
    }
    
    @Data
    public static class LoginRequest {
        private String username;
        private String password;
        private boolean remember = false;
    }
    
    /**
     * A network configuration entry ({@code rest/networkconf}).
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class NetworkConf {
        @JsonProperty("_id")
        private String id;
        
        private String name;
        private String purpose; // corporate, guest, wan, vlan-only, remote-user-vpn
        
        @JsonProperty("vlan_enabled")
        private Boolean vlanEnabled;
        
        private Integer vlan;
        
        @JsonProperty("ip_subnet")
        private String ipSubnet; // gateway address with prefix, e.g. 10.0.10.1/24
        
        @JsonProperty("dhcpd_enabled")
        private Boolean dhcpdEnabled;
        
        @JsonProperty("dhcpd_start")
        private String dhcpdStart;
        
        @JsonProperty("dhcpd_stop")
        private String dhcpdStop;
        
        @JsonProperty("dhcpd_leasetime")
        private Integer dhcpdLeasetime;
        
        @JsonProperty("dhcpd_dns_enabled")
        private Boolean dhcpdDnsEnabled;
        
        @JsonProperty("dhcpd_dns_1")
        private String dhcpdDns1;
        
        @JsonProperty("dhcpd_dns_2")
        private String dhcpdDns2;
        
        @JsonProperty("dhcpd_dns_3")
        private String dhcpdDns3;
        
        @JsonProperty("dhcpd_dns_4")
        private String dhcpdDns4;
        
        @JsonProperty("dhcpd_options")
        private List<DhcpOptionConf> dhcpdOptions;
        
        @JsonProperty("domain_name")
        private String domainName;
        
        @JsonProperty("igmp_snooping")
        private Boolean igmpSnooping;
        
        @JsonProperty("mdns_enabled")
        private Boolean mdnsEnabled;
        
        private Boolean enabled;
        
        private String networkgroup;
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DhcpOptionConf {
        private Integer option;
        private String value;
    }
    
    /**
     * A firewall rule entry ({@code rest/firewallrule}).
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FirewallRuleConf {
        @JsonProperty("_id")
        private String id;
        
        private String name;
        private String ruleset;
        
        @JsonProperty("rule_index")
        private Integer ruleIndex;
        
        private String action; // accept, drop, reject
        private String protocol;
        private Boolean enabled;
        private Boolean logging;
        
        @JsonProperty("src_networkconf_id")
        private String srcNetworkconfId;
        
        @JsonProperty("src_networkconf_type")
        private String srcNetworkconfType;
        
        @JsonProperty("src_address")
        private String srcAddress;
        
        @JsonProperty("src_port")
        private String srcPort;
        
        @JsonProperty("src_firewallgroup_ids")
        private List<String> srcFirewallgroupIds;
        
        @JsonProperty("dst_networkconf_id")
        private String dstNetworkconfId;
        
        @JsonProperty("dst_networkconf_type")
        private String dstNetworkconfType;
        
        @JsonProperty("dst_address")
        private String dstAddress;
        
        @JsonProperty("dst_port")
        private String dstPort;
        
        @JsonProperty("dst_firewallgroup_ids")
        private List<String> dstFirewallgroupIds;
    }
    
    /**
     * Controller system information ({@code stat/sysinfo}).
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SysInfo {
        private String version;
        private String hostname;
        private String name;
    }
    
    @Data
    public static class BackupRequest {
        private String cmd = "backup";
        private int days = 0;
    }
    
    /**
     * Response of {@code cmd/backup}: a relative download path for the archive.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BackupLocation {
        private String url;
    }
}
