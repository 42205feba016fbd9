package org.approvalkit.reporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DiffToolReporterTest {
    @Test
    void launchesInstalledToolWithBothFilesAndCreatesMissingApproved(@TempDir final Path tempDir) throws Exception {
        final Path bin = installFakeTool(tempDir, "meld");
        final Path received = Files.writeString(tempDir.resolve("T.m.received.txt"), "new");
        final Path approved = tempDir.resolve("approved").resolve("T.m.approved.txt");
        final List<List<String>> launched = new ArrayList<>();

        final DiffToolReporter reporter =
                new DiffToolReporter(DiffPrograms.MELD, launched::add, Map.of("PATH", bin.toString()));

        assertTrue(reporter.isInstalled());
        assertTrue(reporter.report(received, approved));
        assertEquals(
                List.of(List.of(bin.resolve("meld").toString(), received.toString(), approved.toString())),
                launched);
        assertTrue(Files.exists(approved));
        assertEquals(0L, Files.size(approved));
    }

    @Test
    void unhandledWhenToolIsNotInstalled(@TempDir final Path tempDir) {
        final List<List<String>> launched = new ArrayList<>();
        final DiffToolReporter reporter =
                new DiffToolReporter(DiffPrograms.KDIFF3, launched::add, Map.of("PATH", tempDir.toString()));

        assertFalse(reporter.report(tempDir.resolve("r.txt"), tempDir.resolve("a.txt")));
        assertTrue(launched.isEmpty());
        assertFalse(Files.exists(tempDir.resolve("a.txt")));
    }

    @Test
    void launchFailurePropagates(@TempDir final Path tempDir) throws Exception {
        final Path bin = installFakeTool(tempDir, "meld");
        final DiffToolReporter reporter = new DiffToolReporter(
                DiffPrograms.MELD,
                command -> {
                    throw new IOException("cannot execute");
                },
                Map.of("PATH", bin.toString()));

        assertThrows(
                UncheckedIOException.class,
                () -> reporter.report(tempDir.resolve("r.txt"), tempDir.resolve("a.txt")));
    }

    @Test
    void argumentTemplatesAreExpanded() {
        final List<String> command = DiffPrograms.P4MERGE.command(
                Path.of("/usr/bin/p4merge"), Path.of("r.txt"), Path.of("a.txt"));

        assertEquals(List.of("/usr/bin/p4merge", "r.txt", "a.txt", "a.txt", "a.txt"), command);
        assertEquals(DiffPrograms.VS_CODE, DiffPrograms.byName(" VSCode ").orElseThrow());
        assertTrue(DiffPrograms.byName("notepad").isEmpty());
    }

    @Test
    void defaultReporterIsQuietOnCi() {
        final List<List<String>> launched = new ArrayList<>();
        final DefaultReporter reporter = new DefaultReporter(Map.of("GITHUB_ACTIONS", "true"), launched::add);

        assertSame(QuietReporter.INSTANCE, reporter.delegate());
        assertFalse(reporter.report(Path.of("r.txt"), Path.of("a.txt")));
    }

    @Test
    void defaultReporterUsesFirstInstalledTool(@TempDir final Path tempDir) throws Exception {
        final Path bin = installFakeTool(tempDir, "meld");
        installFakeTool(tempDir, "kdiff3");
        final Path received = Files.writeString(tempDir.resolve("T.m.received.txt"), "x");
        final List<List<String>> launched = new ArrayList<>();

        final DefaultReporter reporter = new DefaultReporter(Map.of("PATH", bin.toString()), launched::add);

        assertInstanceOf(FirstWorkingReporter.class, reporter.delegate());
        assertTrue(reporter.report(received, tempDir.resolve("T.m.approved.txt")));
        assertEquals(1, launched.size());
        assertEquals(bin.resolve("kdiff3").toString(), launched.get(0).get(0));
    }

    @Test
    void ciDetectionIgnoresBlankAndFalseValues() {
        assertFalse(new CiEnvironment(Map.of("CI", "false", "TRAVIS", " ")).isCi());
        assertTrue(new CiEnvironment(Map.of("TF_BUILD", "True")).isCi());
        assertFalse(new CiEnvironment(Map.of()).isCi());
    }

    private static Path installFakeTool(final Path tempDir, final String name) throws IOException {
        final Path bin = Files.createDirectories(tempDir.resolve("bin"));
        final Path tool = Files.writeString(bin.resolve(name), "#!/bin/sh\nexit 0\n");
        assertTrue(tool.toFile().setExecutable(true));
        return bin;
    }
}
