package org.approvalkit.reporter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.approvalkit.obs.JsonLinesLogger;
import org.approvalkit.obs.VerificationContext;
import org.approvalkit.obs.VerificationJournal;

/**
 * Records mismatches as structured log events and journal entries. Meant to be front-loaded; never
 * handles the mismatch.
 */
public final class JournalReporter implements ApprovalFailureReporter {
    private final JsonLinesLogger logger;
    private final VerificationJournal journal;

    public JournalReporter(JsonLinesLogger logger, VerificationJournal journal) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    @Override
    public boolean report(Path receivedFile, Path approvedFile) {
        boolean approvedExists = Files.exists(approvedFile);
        VerificationContext context = VerificationContext.builder(testIdOf(approvedFile), "report")
            .approvedFile(approvedFile)
            .receivedFile(receivedFile)
            .build();
        logger.warn("approval mismatch reported", context, Map.of("approvedExists", approvedExists));
        journal.record(
            context,
            approvedExists ? VerificationJournal.Outcome.MISMATCH : VerificationJournal.Outcome.MISSING_APPROVED);
        return false;
    }

    private static String testIdOf(Path approvedFile) {
        String fileName = approvedFile.getFileName().toString();
        int marker = fileName.lastIndexOf(".approved");
        return marker > 0 ? fileName.substring(0, marker) : fileName;
    }

    @Override
    public String toString() {
        return "JournalReporter";
    }
}
