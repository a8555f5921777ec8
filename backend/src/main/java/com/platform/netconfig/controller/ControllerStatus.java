package com.platform.netconfig.controller;

/**
 * Reachability and version information reported by the controller.
 */
public record ControllerStatus(
    String url,
    String site,
    String version,
    String hostname,
    int segments,
    int firewallRules
) {
}
