package org.approvalkit.reporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.approvalkit.obs.NoOpJsonLinesLogger;
import org.approvalkit.obs.StructuredJsonLinesLogger;
import org.approvalkit.obs.VerificationJournal;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReporterFactoryTest {
    private final ReporterFactory factory = new ReporterFactory(
            NoOpJsonLinesLogger.INSTANCE, new VerificationJournal(4), Map.of("CI", "true"), command -> {});

    @Test
    void resolvesConfiguredNames() {
        assertSame(QuietReporter.INSTANCE, factory.create("quiet"));
        assertInstanceOf(DefaultReporter.class, factory.create("Default"));
        assertInstanceOf(AutoApproveWhenMissingReporter.class, factory.create("auto-approve-when-missing"));
        assertInstanceOf(AutoApproveReporter.class, factory.create("auto-approve"));
        assertInstanceOf(JournalReporter.class, factory.create("journal"));
        assertEquals(
                DiffPrograms.MELD,
                assertInstanceOf(DiffToolReporter.class, factory.create("meld")).program());
    }

    @Test
    void rejectsUnknownNames() {
        assertThrows(IllegalArgumentException.class, () -> factory.create("notepad"));
        assertFalse(ReporterFactory.isKnown("notepad"));
        assertFalse(ReporterFactory.isKnown(null));
        assertTrue(ReporterFactory.isKnown(" KDiff3 "));
    }

    @Test
    void journalReporterLogsAndRecordsWithoutHandling(@TempDir final Path tempDir) throws Exception {
        final ByteArrayOutputStream output = new ByteArrayOutputStream();
        final VerificationJournal journal = new VerificationJournal(4);
        final JournalReporter reporter = new JournalReporter(new StructuredJsonLinesLogger(output), journal);
        final Path received = Files.writeString(tempDir.resolve("OrderTest.totals.received.txt"), "6\n");
        final Path approved = tempDir.resolve("OrderTest.totals.approved.txt");

        assertFalse(reporter.report(received, approved));

        final Document event = Document.parse(output.toString(StandardCharsets.UTF_8).trim());
        assertEquals("WARN", event.getString("level"));
        assertEquals("OrderTest.totals", event.getString("testId"));
        assertEquals("report", event.getString("operation"));
        assertFalse(event.getBoolean("approvedExists"));
        assertEquals(VerificationJournal.Outcome.MISSING_APPROVED, journal.entries().get(0).outcome());
    }
}
