package org.approvalkit.reporter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Opens the received and approved files in an external diff tool.
 *
 * <p>Not handled when the tool is not installed. A missing approved file is created empty first so that
 * the tool shows the whole received output as new. The tool's exit status is not inspected.
 */
public final class DiffToolReporter implements ApprovalFailureReporter {
    private final DiffProgram program;
    private final ProcessLauncher launcher;
    private final Map<String, String> environment;

    public DiffToolReporter(DiffProgram program) {
        this(program, ProcessLauncher.system(), System.getenv());
    }

    public DiffToolReporter(DiffProgram program, ProcessLauncher launcher, Map<String, String> environment) {
        this.program = Objects.requireNonNull(program, "program");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    }

    public DiffProgram program() {
        return program;
    }

    public boolean isInstalled() {
        return program.locate(environment.get("PATH")).isPresent();
    }

    @Override
    public boolean report(Path receivedFile, Path approvedFile) {
        Optional<Path> executable = program.locate(environment.get("PATH"));
        if (executable.isEmpty()) {
            return false;
        }
        try {
            ensureApprovedFileExists(approvedFile);
            launcher.launch(program.command(executable.get(), receivedFile, approvedFile));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to launch " + program.name() + " for " + receivedFile, e);
        }
        return true;
    }

    private static void ensureApprovedFileExists(Path approvedFile) throws IOException {
        if (Files.exists(approvedFile)) {
            return;
        }
        Path parent = approvedFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.createFile(approvedFile);
    }

    @Override
    public String toString() {
        return "DiffToolReporter[" + program.name() + "]";
    }
}
