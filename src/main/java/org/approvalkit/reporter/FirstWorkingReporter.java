package org.approvalkit.reporter;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Tries reporters in order and stops at the first one that handles the mismatch.
 */
public final class FirstWorkingReporter implements ApprovalFailureReporter {
    private final List<ApprovalFailureReporter> reporters;

    public FirstWorkingReporter(ApprovalFailureReporter... reporters) {
        this(List.of(reporters));
    }

    public FirstWorkingReporter(List<? extends ApprovalFailureReporter> reporters) {
        this.reporters = List.copyOf(Objects.requireNonNull(reporters, "reporters"));
    }

    public List<ApprovalFailureReporter> reporters() {
        return reporters;
    }

    @Override
    public boolean report(Path receivedFile, Path approvedFile) {
        for (ApprovalFailureReporter reporter : reporters) {
            if (reporter.report(receivedFile, approvedFile)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "FirstWorkingReporter" + reporters;
    }
}
