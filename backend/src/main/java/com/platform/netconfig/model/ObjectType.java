package com.platform.netconfig.model;

/**
 * Kinds of controller objects the reconciler manages.
 */
public enum ObjectType {
    SEGMENT("segment"),
    FIREWALL_RULE("rule");
    
    private final String label;
    
    ObjectType(String label) {
        this.label = label;
    }
    
    public String label() {
        return label;
    }
}
