package org.approvalkit.reporter;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.approvalkit.obs.JsonLinesLogger;
import org.approvalkit.obs.VerificationJournal;

/**
 * Resolves reporter names used in configuration files.
 */
public final class ReporterFactory {
    private final JsonLinesLogger logger;
    private final VerificationJournal journal;
    private final Map<String, String> environment;
    private final ProcessLauncher launcher;

    public ReporterFactory(
            final JsonLinesLogger logger,
            final VerificationJournal journal,
            final Map<String, String> environment,
            final ProcessLauncher launcher) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.launcher = Objects.requireNonNull(launcher, "launcher");
    }

    /**
     * @throws IllegalArgumentException for unknown names
     */
    public ApprovalFailureReporter create(final String name) {
        final String normalized = Objects.requireNonNull(name, "name").trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "default":
                return new DefaultReporter(environment, launcher);
            case "quiet":
                return QuietReporter.INSTANCE;
            case "auto-approve":
                return new AutoApproveReporter();
            case "auto-approve-when-missing":
                return new AutoApproveWhenMissingReporter();
            case "journal":
                return new JournalReporter(logger, journal);
            default:
                return DiffPrograms.byName(normalized)
                        .<ApprovalFailureReporter>map(program -> new DiffToolReporter(program, launcher, environment))
                        .orElseThrow(() -> new IllegalArgumentException("unknown reporter: " + name));
        }
    }

    public static boolean isKnown(final String name) {
        if (name == null) {
            return false;
        }
        final String normalized = name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "default", "quiet", "auto-approve", "auto-approve-when-missing", "journal" -> true;
            default -> DiffPrograms.byName(normalized).isPresent();
        };
    }
}
