package org.approvalkit.core;

import java.nio.file.Path;

/**
 * The received file differs from the approved file.
 */
public final class ApprovalMismatchException extends ApprovalException {
    private static final long serialVersionUID = 1L;

    private final boolean reporterHandled;

    public ApprovalMismatchException(
            final Path receivedFile,
            final Path approvedFile,
            final boolean reporterHandled,
            final String approvedText,
            final String receivedText) {
        super(
                "Failed Approval: received does not match approved\n"
                        + "Received: " + receivedFile + "\n"
                        + "Approved: " + approvedFile + "\n"
                        + FileApprover.reporterNote(reporterHandled),
                receivedFile,
                approvedFile,
                approvedText,
                receivedText);
        this.reporterHandled = reporterHandled;
    }

    public boolean reporterHandled() {
        return reporterHandled;
    }
}
