package com.platform.netconfig.backup;

import java.time.Instant;

/**
 * Where a snapshot was stored and how large it is.
 */
public record SnapshotHandle(String id, String location, long sizeBytes, Instant takenAt) {
}
