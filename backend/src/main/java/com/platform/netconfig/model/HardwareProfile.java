package com.platform.netconfig.model;

/**
 * Gateway class and the number of segments it can manage.
 */
public record HardwareProfile(String id, String displayName, int maxSegments) {
}
