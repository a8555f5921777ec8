package com.platform.netconfig.backup;

/**
 * Takes a restorable copy of the controller configuration before a live apply.
 */
public interface SnapshotProvider {
    
    /**
     * @throws com.platform.netconfig.error.SnapshotException if no snapshot could be stored
     */
    SnapshotHandle snapshot();
}
