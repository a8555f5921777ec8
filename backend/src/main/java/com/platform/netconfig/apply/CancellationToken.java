package com.platform.netconfig.apply;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a run and whoever may cancel it.
 * The applier checks it between operations, never in the middle of one.
 */
public class CancellationToken {
    
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    
    public static CancellationToken none() {
        return new CancellationToken();
    }
    
    public void cancel() {
        cancelled.set(true);
    }
    
    public boolean isCancelled() {
        return cancelled.get();
    }
}
