package com.platform.netconfig.error;

/**
 * Pre-apply backup failed. Fatal: the apply aborts before mutating anything.
 */
public class SnapshotException extends NetConfigException {
    
    public SnapshotException(String message, Throwable cause) {
        super(ErrorCode.SNAPSHOT_FAILED, message, cause);
    }
}
