package com.platform.netconfig.model;

/**
 * Authoritative identity of a managed object: the VLAN tag for segments,
 * chain plus priority for firewall rules. Used as the matching key for
 * diffing and for every remote call, never a controller-generated id.
 */
public record ObjectIdentity(ObjectType type, String key) implements Comparable<ObjectIdentity> {
    
    public static ObjectIdentity segment(int vlanId) {
        return new ObjectIdentity(ObjectType.SEGMENT, String.valueOf(vlanId));
    }
    
    public static ObjectIdentity rule(String chain, int priority) {
        return new ObjectIdentity(ObjectType.FIREWALL_RULE, chain + "#" + priority);
    }
    
    @Override
    public int compareTo(ObjectIdentity other) {
        int byType = type.compareTo(other.type);
        if (byType != 0) {
            return byType;
        }
        if (type == ObjectType.SEGMENT) {
            return Integer.compare(Integer.parseInt(key), Integer.parseInt(other.key));
        }
        int hash = key.lastIndexOf('#');
        int otherHash = other.key.lastIndexOf('#');
        int byChain = key.substring(0, hash).compareTo(other.key.substring(0, otherHash));
        if (byChain != 0) {
            return byChain;
        }
        return Integer.compare(
            Integer.parseInt(key.substring(hash + 1)),
            Integer.parseInt(other.key.substring(otherHash + 1)));
    }
    
    @Override
    public String toString() {
        return type.label() + "/" + key;
    }
}
