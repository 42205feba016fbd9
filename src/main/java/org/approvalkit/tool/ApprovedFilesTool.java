package org.approvalkit.tool;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists, approves or deletes the received files left behind by failed verifications.
 */
public final class ApprovedFilesTool {
    static final String RECEIVED_MARKER = ".received.";
    static final String APPROVED_MARKER = ".approved.";
    private static final String SCRUBBED_MARKER = ".scrubbed.received.";

    enum Mode {
        LIST,
        APPROVE,
        CLEAN
    }

    private ApprovedFilesTool() {}

    public static void main(final String[] args) {
        final int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(final String[] args, final PrintStream out, final PrintStream err) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");

        final Config config;
        try {
            config = Config.fromArgs(args);
        } catch (final IllegalArgumentException exception) {
            err.println(exception.getMessage());
            printUsage(err);
            return 2;
        }

        if (config.help()) {
            printUsage(out);
            return 0;
        }

        try {
            final List<Path> receivedFiles = findReceivedFiles(config.dir());
            switch (config.mode()) {
                case LIST -> {
                    for (final Path received : receivedFiles) {
                        out.println(received);
                    }
                    out.println("received files: " + receivedFiles.size());
                }
                case APPROVE -> {
                    for (final Path received : receivedFiles) {
                        final Path approved = approvedFileFor(received);
                        Files.move(received, approved, StandardCopyOption.REPLACE_EXISTING);
                        out.println("approved: " + approved);
                    }
                    out.println("approved files: " + receivedFiles.size());
                }
                case CLEAN -> {
                    for (final Path received : receivedFiles) {
                        Files.deleteIfExists(received);
                        out.println("deleted: " + received);
                    }
                    out.println("deleted files: " + receivedFiles.size());
                }
            }
            return 0;
        } catch (final IOException | RuntimeException exception) {
            err.println("approved files tool failed: " + exception.getMessage());
            return 1;
        }
    }

    static List<Path> findReceivedFiles(final Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("--dir is not a directory: " + dir);
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> isApprovableReceivedFile(path.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    static Path approvedFileFor(final Path receivedFile) {
        final String fileName = receivedFile.getFileName().toString();
        final int marker = fileName.lastIndexOf(RECEIVED_MARKER);
        if (marker < 0) {
            throw new IllegalArgumentException("not a received file: " + receivedFile);
        }
        return receivedFile.resolveSibling(
                fileName.substring(0, marker) + APPROVED_MARKER + fileName.substring(marker + RECEIVED_MARKER.length()));
    }

    private static boolean isApprovableReceivedFile(final String fileName) {
        // scrubbed copies of existing files have no approved file of the same name
        return fileName.contains(RECEIVED_MARKER) && !fileName.contains(SCRUBBED_MARKER);
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: ApprovedFilesTool --dir=<dir> [--list|--approve|--clean]");
        stream.println("  --dir=<dir>   Directory searched recursively for *.received.* files");
        stream.println("  --list        Print the received files (default)");
        stream.println("  --approve     Move every received file over its approved file");
        stream.println("  --clean       Delete every received file");
        stream.println("  --help        Show usage");
    }

    private record Config(Path dir, Mode mode, boolean help) {
        static Config fromArgs(final String[] args) {
            Path dir = null;
            Mode mode = null;
            boolean help = false;

            for (final String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    help = true;
                    continue;
                }
                if (arg.startsWith("--dir=")) {
                    final String value = arg.substring("--dir=".length()).trim();
                    if (value.isEmpty()) {
                        throw new IllegalArgumentException("--dir= must have a value");
                    }
                    dir = Path.of(value);
                    continue;
                }
                final Mode requested = switch (arg) {
                    case "--list" -> Mode.LIST;
                    case "--approve" -> Mode.APPROVE;
                    case "--clean" -> Mode.CLEAN;
                    default -> throw new IllegalArgumentException("unknown argument: " + arg);
                };
                if (mode != null && mode != requested) {
                    throw new IllegalArgumentException("only one of --list, --approve, --clean may be given");
                }
                mode = requested;
            }

            if (!help && dir == null) {
                throw new IllegalArgumentException("--dir=<dir> is required");
            }
            return new Config(dir, mode == null ? Mode.LIST : mode, help);
        }
    }
}
