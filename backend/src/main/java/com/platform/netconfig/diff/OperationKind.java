package com.platform.netconfig.diff;

/**
 * What an operation does to its target object.
 */
public enum OperationKind {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");
    
    private final String verb;
    
    OperationKind(String verb) {
        this.verb = verb;
    }
    
    public String verb() {
        return verb;
    }
}
