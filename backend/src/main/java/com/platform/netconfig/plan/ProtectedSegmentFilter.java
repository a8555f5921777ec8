package com.platform.netconfig.plan;

import com.platform.netconfig.config.NetConfigProperties;
import com.platform.netconfig.diff.Operation;
import com.platform.netconfig.model.ObjectType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Drops every operation on a protected segment. VLAN 1 (management) is always
 * protected, whatever the configuration or the live state says.
 */
@Component
public class ProtectedSegmentFilter implements OperationFilter {
    
    public static final int MANAGEMENT_VLAN = 1;
    
    private final Set<String> protectedKeys;
    
    @Autowired
    public ProtectedSegmentFilter(NetConfigProperties properties) {
        this(Set.copyOf(properties.getProtectedSegmentIds()));
    }
    
    ProtectedSegmentFilter(Set<Integer> protectedSegmentIds) {
        Set<String> keys = new HashSet<>();
        keys.add(String.valueOf(MANAGEMENT_VLAN));
        protectedSegmentIds.forEach(id -> keys.add(String.valueOf(id)));
        this.protectedKeys = Set.copyOf(keys);
    }
    
    @Override
    public Optional<String> reject(Operation operation) {
        if (operation.targetType() == ObjectType.SEGMENT && protectedKeys.contains(operation.identity().key())) {
            return Optional.of("segment " + operation.identity().key() + " is protected");
        }
        return Optional.empty();
    }
}
