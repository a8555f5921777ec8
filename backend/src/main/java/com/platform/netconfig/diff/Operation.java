package com.platform.netconfig.diff;

import com.platform.netconfig.model.ManagedObject;
import com.platform.netconfig.model.ObjectIdentity;
import com.platform.netconfig.model.ObjectType;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * One change needed to move live state toward desired state.
 *
 * <p>The id is derived from kind and target identity ({@code create:segment/30}),
 * so the same change computed on a retried run carries the same id.
 *
 * @param desired       target object after the change, null for deletes
 * @param current       object as it exists on the controller, null for creates
 * @param changedFields names of differing fields, for updates
 * @param dependsOn     ids of operations that must complete first
 */
public record Operation(
    String id,
    OperationKind kind,
    ObjectIdentity identity,
    ManagedObject desired,
    ManagedObject current,
    List<String> changedFields,
    Set<String> dependsOn
) {
    
    public Operation {
        changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
        dependsOn = dependsOn == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(dependsOn));
    }
    
    public static String idOf(OperationKind kind, ObjectIdentity identity) {
        return kind.verb() + ":" + identity;
    }
    
    public static Operation create(ManagedObject desired, Set<String> dependsOn) {
        return new Operation(idOf(OperationKind.CREATE, desired.identity()), OperationKind.CREATE,
            desired.identity(), desired, null, List.of(), dependsOn);
    }
    
    public static Operation update(ManagedObject current, ManagedObject desired, List<String> changedFields,
                                   Set<String> dependsOn) {
        return new Operation(idOf(OperationKind.UPDATE, desired.identity()), OperationKind.UPDATE,
            desired.identity(), desired, current, changedFields, dependsOn);
    }
    
    public static Operation delete(ManagedObject current, Set<String> dependsOn) {
        return new Operation(idOf(OperationKind.DELETE, current.identity()), OperationKind.DELETE,
            current.identity(), null, current, List.of(), dependsOn);
    }
    
    public ObjectType targetType() {
        return identity.type();
    }
    
    public Operation withDependsOn(Set<String> newDependsOn) {
        return new Operation(id, kind, identity, desired, current, changedFields, newDependsOn);
    }
}
