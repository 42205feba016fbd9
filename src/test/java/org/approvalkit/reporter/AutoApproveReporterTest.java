package org.approvalkit.reporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AutoApproveReporterTest {
    @Test
    void copiesReceivedOverApproved(@TempDir final Path tempDir) throws Exception {
        final Path received = Files.writeString(tempDir.resolve("T.m.received.txt"), "6\n");
        final Path approved = Files.writeString(tempDir.resolve("T.m.approved.txt"), "5\n");

        assertTrue(new AutoApproveReporter().report(received, approved));

        assertEquals("6\n", Files.readString(approved, StandardCharsets.UTF_8));
        assertTrue(Files.exists(received));
    }

    @Test
    void whenMissingOnlyApprovesFirstRuns(@TempDir final Path tempDir) throws Exception {
        final Path received = Files.writeString(tempDir.resolve("T.m.received.txt"), "6\n");
        final Path existing = Files.writeString(tempDir.resolve("T.m.approved.txt"), "5\n");
        final Path missing = tempDir.resolve("sub").resolve("T.n.approved.txt");
        final AutoApproveWhenMissingReporter reporter = new AutoApproveWhenMissingReporter();

        assertFalse(reporter.report(received, existing));
        assertEquals("5\n", Files.readString(existing, StandardCharsets.UTF_8));

        assertTrue(reporter.report(received, missing));
        assertEquals("6\n", Files.readString(missing, StandardCharsets.UTF_8));
    }
}
