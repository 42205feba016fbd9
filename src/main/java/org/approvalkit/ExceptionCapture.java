package org.approvalkit;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of running an operation whose exception message is verified: either the exception it threw,
 * or nothing.
 */
public final class ExceptionCapture {
    public static final String NO_EXCEPTION_THROWN = "*** no exception thrown ***";

    private static final ExceptionCapture NO_FAILURE = new ExceptionCapture(null);

    private final Exception thrown;

    private ExceptionCapture(Exception thrown) {
        this.thrown = thrown;
    }

    /**
     * Runs {@code operation} and captures the exception it throws. Errors are not captured.
     */
    public static ExceptionCapture of(ThrowingRunnable operation) {
        Objects.requireNonNull(operation, "operation");
        try {
            operation.run();
        } catch (Exception e) {
            return new ExceptionCapture(e);
        }
        return NO_FAILURE;
    }

    public boolean failed() {
        return thrown != null;
    }

    public Optional<Exception> exception() {
        return Optional.ofNullable(thrown);
    }

    /**
     * The exception's message, its class name when the message is null, or
     * {@value #NO_EXCEPTION_THROWN}.
     */
    public String messageText() {
        if (thrown == null) {
            return NO_EXCEPTION_THROWN;
        }
        String message = thrown.getMessage();
        return message == null ? thrown.getClass().getName() : message;
    }
}
