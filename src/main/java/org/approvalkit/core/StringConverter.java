package org.approvalkit.core;

/**
 * Turns a verified value into its final text. Called exactly once per verified value.
 */
@FunctionalInterface
public interface StringConverter {
    String toString(Object value);
}
