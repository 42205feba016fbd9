package org.approvalkit.reporter;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Invokes every reporter. Handled when at least one of them handled the mismatch.
 */
public final class MultiReporter implements ApprovalFailureReporter {
    private final List<ApprovalFailureReporter> reporters;

    public MultiReporter(ApprovalFailureReporter... reporters) {
        this(List.of(reporters));
    }

    public MultiReporter(List<? extends ApprovalFailureReporter> reporters) {
        this.reporters = List.copyOf(Objects.requireNonNull(reporters, "reporters"));
    }

    @Override
    public boolean report(Path receivedFile, Path approvedFile) {
        boolean handled = false;
        for (ApprovalFailureReporter reporter : reporters) {
            handled |= reporter.report(receivedFile, approvedFile);
        }
        return handled;
    }

    @Override
    public String toString() {
        return "MultiReporter" + reporters;
    }
}
