package org.approvalkit.core;

import java.nio.file.Path;

/**
 * No approved file exists yet. The received output is compared against an empty baseline.
 */
public final class ApprovalMissingException extends ApprovalException {
    private static final long serialVersionUID = 1L;

    private final boolean reporterHandled;

    public ApprovalMissingException(
            final Path receivedFile,
            final Path approvedFile,
            final boolean reporterHandled,
            final String receivedText) {
        super(
                "Failed Approval: approved file not found\n"
                        + "Received: " + receivedFile + "\n"
                        + "Approved: " + approvedFile + "\n"
                        + FileApprover.reporterNote(reporterHandled) + "\n"
                        + "To approve, copy the received file to the approved file and commit it.",
                receivedFile,
                approvedFile,
                "",
                receivedText);
        this.reporterHandled = reporterHandled;
    }

    public boolean reporterHandled() {
        return reporterHandled;
    }
}
