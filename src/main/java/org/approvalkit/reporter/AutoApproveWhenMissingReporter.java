package org.approvalkit.reporter;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Approves first-run output only. Mismatches against an existing approved file are left alone.
 */
public final class AutoApproveWhenMissingReporter extends AutoApproveReporter {
    @Override
    public boolean report(Path receivedFile, Path approvedFile) {
        if (Files.exists(approvedFile)) {
            return false;
        }
        approve(receivedFile, approvedFile);
        return true;
    }

    @Override
    public String toString() {
        return "AutoApproveWhenMissingReporter";
    }
}
