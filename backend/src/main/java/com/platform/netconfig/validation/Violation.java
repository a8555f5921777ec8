package com.platform.netconfig.validation;

/**
 * A single problem with the desired state.
 *
 * @param field path of the offending field, e.g. {@code segments[2].subnet}
 * @param value the rejected value as written in the document
 * @param rule  short name of the violated rule, e.g. {@code subnet-overlap}
 */
public record Violation(
    ViolationClass violationClass,
    String field,
    Object value,
    String rule,
    String message
) {
    
    @Override
    public String toString() {
        return String.format("%s = '%s' violates %s: %s", field, value, rule, message);
    }
}
