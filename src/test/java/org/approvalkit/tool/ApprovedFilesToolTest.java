package org.approvalkit.tool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ApprovedFilesToolTest {
    @TempDir
    Path tempDir;

    private Path received;
    private Path nestedReceived;
    private Path scrubbedCopy;

    @BeforeEach
    void setUp() throws Exception {
        received = tempDir.resolve("OrderTest.total.received.txt");
        nestedReceived = tempDir.resolve("approval_tests").resolve("OrderTest.json.2.received.json");
        scrubbedCopy = tempDir.resolve("report.scrubbed.received.csv");
        Files.createDirectories(nestedReceived.getParent());
        Files.writeString(received, "new total", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("OrderTest.total.approved.txt"), "old total", StandardCharsets.UTF_8);
        Files.writeString(nestedReceived, "{}\n", StandardCharsets.UTF_8);
        Files.writeString(scrubbedCopy, "id\n", StandardCharsets.UTF_8);
    }

    @Test
    void listsReceivedFilesByDefault() throws Exception {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();

        final int exitCode = ApprovedFilesTool.run(
                new String[] {"--dir=" + tempDir}, new PrintStream(out, true, StandardCharsets.UTF_8), nullStream());

        final String output = out.toString(StandardCharsets.UTF_8);
        assertEquals(0, exitCode);
        assertTrue(output.contains(received.toString()));
        assertTrue(output.contains(nestedReceived.toString()));
        assertFalse(output.contains("scrubbed"));
        assertTrue(output.contains("received files: 2"));
    }

    @Test
    void approveMovesReceivedOverApproved() throws Exception {
        final int exitCode = ApprovedFilesTool.run(
                new String[] {"--dir=" + tempDir, "--approve"}, nullStream(), nullStream());

        assertEquals(0, exitCode);
        assertFalse(Files.exists(received));
        assertEquals(
                "new total",
                Files.readString(tempDir.resolve("OrderTest.total.approved.txt"), StandardCharsets.UTF_8));
        assertTrue(Files.exists(nestedReceived.resolveSibling("OrderTest.json.2.approved.json")));
        assertTrue(Files.exists(scrubbedCopy));
    }

    @Test
    void cleanDeletesReceivedFilesOnly() throws Exception {
        final int exitCode = ApprovedFilesTool.run(
                new String[] {"--dir=" + tempDir, "--clean"}, nullStream(), nullStream());

        assertEquals(0, exitCode);
        assertEquals(List.of(), ApprovedFilesTool.findReceivedFiles(tempDir));
        assertTrue(Files.exists(tempDir.resolve("OrderTest.total.approved.txt")));
    }

    @Test
    void approvedNameReplacesTheLastReceivedMarker() {
        assertEquals(
                Path.of("a", "X.received.test.approved.txt"),
                ApprovedFilesTool.approvedFileFor(Path.of("a", "X.received.test.received.txt")));
    }

    @Test
    void usageErrorsExitWithTwo() {
        final ByteArrayOutputStream err = new ByteArrayOutputStream();
        final PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8);

        assertEquals(2, ApprovedFilesTool.run(new String[] {"--list"}, nullStream(), errStream));
        assertEquals(2, ApprovedFilesTool.run(new String[] {"--dir=x", "--list", "--clean"}, nullStream(), errStream));
        assertEquals(2, ApprovedFilesTool.run(new String[] {"--bogus"}, nullStream(), errStream));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage: ApprovedFilesTool"));
        assertEquals(0, ApprovedFilesTool.run(new String[] {"--help"}, nullStream(), nullStream()));
    }

    @Test
    void missingDirectoryExitsWithOne() {
        final ByteArrayOutputStream err = new ByteArrayOutputStream();

        final int exitCode = ApprovedFilesTool.run(
                new String[] {"--dir=" + tempDir.resolve("absent")},
                nullStream(),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(1, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("is not a directory"));
    }

    private static PrintStream nullStream() {
        return new PrintStream(OutputStream.nullOutputStream());
    }
}
