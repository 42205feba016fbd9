package org.approvalkit.reporter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * An external diff or merge tool: where it may be installed and how it takes its two file arguments.
 *
 * <p>Argument templates use {@code %received} and {@code %approved} placeholders.
 */
public final class DiffProgram {
    private final String name;
    private final List<String> executableCandidates;
    private final List<String> argumentTemplate;

    public DiffProgram(String name, List<String> executableCandidates, List<String> argumentTemplate) {
        this.name = requireText(name, "name");
        this.executableCandidates = List.copyOf(Objects.requireNonNull(executableCandidates, "executableCandidates"));
        this.argumentTemplate = List.copyOf(Objects.requireNonNull(argumentTemplate, "argumentTemplate"));
        if (this.executableCandidates.isEmpty()) {
            throw new IllegalArgumentException("executableCandidates must not be empty");
        }
    }

    public String name() {
        return name;
    }

    public List<String> executableCandidates() {
        return executableCandidates;
    }

    /**
     * First installed candidate. Bare names are looked up on {@code PATH}.
     */
    public Optional<Path> locate(String pathVariable) {
        for (String candidate : executableCandidates) {
            Path asPath = Path.of(candidate);
            if (asPath.isAbsolute()) {
                if (Files.isExecutable(asPath)) {
                    return Optional.of(asPath);
                }
                continue;
            }
            if (pathVariable == null || pathVariable.isBlank()) {
                continue;
            }
            for (String directory : pathVariable.split(java.io.File.pathSeparator)) {
                if (directory.isBlank()) {
                    continue;
                }
                for (String executableName : executableNames(candidate)) {
                    Path resolved = Path.of(directory).resolve(executableName);
                    if (Files.isRegularFile(resolved) && Files.isExecutable(resolved)) {
                        return Optional.of(resolved);
                    }
                }
            }
        }
        return Optional.empty();
    }

    public List<String> command(Path executable, Path receivedFile, Path approvedFile) {
        List<String> command = new ArrayList<>(argumentTemplate.size() + 1);
        command.add(executable.toString());
        for (String argument : argumentTemplate) {
            command.add(argument
                .replace("%received", receivedFile.toString())
                .replace("%approved", approvedFile.toString()));
        }
        return command;
    }

    private static List<String> executableNames(String candidate) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win") && !candidate.toLowerCase(Locale.ROOT).endsWith(".exe")) {
            return List.of(candidate + ".exe", candidate + ".cmd", candidate);
        }
        return List.of(candidate);
    }

    private static String requireText(String value, String fieldName) {
        String normalized = value == null ? null : value.trim();
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    @Override
    public String toString() {
        return name;
    }
}
