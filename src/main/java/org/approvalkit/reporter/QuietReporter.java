package org.approvalkit.reporter;

import java.nio.file.Path;

/**
 * Does nothing. Used where no interactive tool should or can run.
 */
public final class QuietReporter implements ApprovalFailureReporter {
    public static final QuietReporter INSTANCE = new QuietReporter();

    @Override
    public boolean report(Path receivedFile, Path approvedFile) {
        return false;
    }

    @Override
    public String toString() {
        return "QuietReporter";
    }
}
