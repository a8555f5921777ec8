package com.platform.netconfig.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Source or destination of a firewall rule. Matches a managed segment by
 * VLAN tag, a literal CIDR block, or anything when both are absent; an
 * optional port or port range narrows it further.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuleSelector(Integer segment, String cidr, String port) {
    
    public static RuleSelector any() {
        return new RuleSelector(null, null, null);
    }
    
    public static RuleSelector segment(int vlanId) {
        return new RuleSelector(vlanId, null, null);
    }
    
    @JsonIgnore
    public boolean referencesSegment() {
        return segment != null;
    }
}
