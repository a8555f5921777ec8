package com.platform.netconfig.model;

/**
 * An object the reconciler creates, updates or deletes on the controller.
 */
public interface ManagedObject {
    
    ObjectIdentity identity();
}
