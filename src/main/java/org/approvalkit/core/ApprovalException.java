package org.approvalkit.core;

import java.nio.file.Path;
import java.util.Objects;
import org.opentest4j.AssertionFailedError;

/**
 * A failed verification. Extends the JUnit platform's assertion failure so every runner reports it as
 * a test failure rather than an error.
 */
public abstract class ApprovalException extends AssertionFailedError {
    private static final long serialVersionUID = 1L;

    private final transient Path receivedFile;
    private final transient Path approvedFile;

    protected ApprovalException(
            final String message,
            final Path receivedFile,
            final Path approvedFile,
            final Object expected,
            final Object actual) {
        super(message, expected, actual);
        this.receivedFile = Objects.requireNonNull(receivedFile, "receivedFile");
        this.approvedFile = Objects.requireNonNull(approvedFile, "approvedFile");
    }

    public Path receivedFile() {
        return receivedFile;
    }

    public Path approvedFile() {
        return approvedFile;
    }
}
