package com.platform.netconfig.validation;

/**
 * Check classes, in the order the validator runs them.
 */
public enum ViolationClass {
    STRUCTURAL,
    UNIQUENESS,
    REFERENTIAL,
    HARDWARE
}
