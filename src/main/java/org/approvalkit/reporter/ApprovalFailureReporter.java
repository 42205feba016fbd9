package org.approvalkit.reporter;

import java.nio.file.Path;

/**
 * Surfaces a mismatch between a received and an approved file.
 */
@FunctionalInterface
public interface ApprovalFailureReporter {
    /**
     * @return true when this reporter handled the mismatch, e.g. launched a tool. The verification fails
     *     either way.
     */
    boolean report(Path receivedFile, Path approvedFile);
}
