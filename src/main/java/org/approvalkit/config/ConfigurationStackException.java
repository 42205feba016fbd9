package org.approvalkit.config;

/**
 * A {@link Disposer} was released out of order or leaked past the end of a test.
 */
public final class ConfigurationStackException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public ConfigurationStackException(final String message) {
        super(message);
    }
}
