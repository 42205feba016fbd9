package org.approvalkit.config;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.approvalkit.core.ApprovalComparator;
import org.approvalkit.core.FileApprover;
import org.approvalkit.namer.ApprovalNamer;
import org.approvalkit.namer.NamerCreator;
import org.approvalkit.namer.SourceDirectoryResolver;
import org.approvalkit.obs.JsonLinesLogger;
import org.approvalkit.obs.NoOpJsonLinesLogger;
import org.approvalkit.obs.StructuredJsonLinesLogger;
import org.approvalkit.obs.VerificationJournal;
import org.approvalkit.reporter.ApprovalFailureReporter;
import org.approvalkit.reporter.ProcessLauncher;
import org.approvalkit.reporter.ReporterFactory;

/**
 * Process-wide defaults for verifications: namer, reporter, front-loaded reporters, approved-file
 * subdirectory and per-extension comparators.
 *
 * <p>Defaults are changed only through {@code use*} methods, each returning a {@link Disposer} that
 * restores the previous value. All overrides share one stack. The shared instance is created from
 * {@link ApprovalsSettingsLoader} on first use. Access is synchronized, but overrides are visible to every
 * thread, so tests that install them must not run concurrently with other verifying tests.
 */
public final class ApprovalsConfiguration {
    private static ApprovalsConfiguration shared;

    private final ApprovalsSettings settings;
    private final JsonLinesLogger logger;
    private final VerificationJournal journal;
    private final ReporterFactory reporterFactory;
    private final SourceDirectoryResolver sourceDirectoryResolver;
    private final Deque<Disposer> stack = new ArrayDeque<>();

    private NamerCreator namerCreator;
    private ApprovalFailureReporter reporter;
    private List<ApprovalFailureReporter> frontLoadedReporters;
    private String subdirectory;
    private Map<String, ApprovalComparator> comparators;

    public ApprovalsConfiguration(final ApprovalsSettings settings) {
        this(settings, System.getenv(), ProcessLauncher.system(), Path.of(""));
    }

    public ApprovalsConfiguration(
            final ApprovalsSettings settings,
            final Map<String, String> environment,
            final ProcessLauncher launcher,
            final Path baseDirectory) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.logger = createLogger(settings.log());
        this.journal = new VerificationJournal(settings.journalCapacity());
        this.reporterFactory = new ReporterFactory(logger, journal, environment, launcher);
        this.sourceDirectoryResolver = new SourceDirectoryResolver(baseDirectory, settings.testSourceRoots());
        this.namerCreator = NamerCreator.standard();
        this.reporter = reporterFactory.create(settings.reporter());
        final List<ApprovalFailureReporter> frontLoaded = new ArrayList<>();
        for (final String name : settings.frontLoadedReporters()) {
            frontLoaded.add(reporterFactory.create(name));
        }
        this.frontLoadedReporters = List.copyOf(frontLoaded);
        this.subdirectory = settings.subdirectory();
        this.comparators = Map.of();
    }

    public static synchronized ApprovalsConfiguration shared() {
        if (shared == null) {
            shared = new ApprovalsConfiguration(ApprovalsSettingsLoader.load());
        }
        return shared;
    }

    public ApprovalsSettings settings() {
        return settings;
    }

    public JsonLinesLogger logger() {
        return logger;
    }

    public VerificationJournal journal() {
        return journal;
    }

    public ReporterFactory reporterFactory() {
        return reporterFactory;
    }

    public SourceDirectoryResolver sourceDirectoryResolver() {
        return sourceDirectoryResolver;
    }

    public synchronized NamerCreator namerCreator() {
        return namerCreator;
    }

    public synchronized ApprovalNamer defaultNamer() {
        return namerCreator.create(subdirectory);
    }

    public synchronized ApprovalFailureReporter defaultReporter() {
        return reporter;
    }

    public synchronized List<ApprovalFailureReporter> frontLoadedReporters() {
        return frontLoadedReporters;
    }

    public synchronized String subdirectory() {
        return subdirectory;
    }

    public synchronized ApprovalComparator comparatorFor(final String fileExtension) {
        return comparators.get(normalizeExtension(fileExtension));
    }

    /**
     * Approver bound to the front-loaded reporters and comparators in force now.
     */
    public synchronized FileApprover fileApprover() {
        final Map<String, ApprovalComparator> snapshot = comparators;
        return new FileApprover(
                frontLoadedReporters,
                extension -> snapshot.get(normalizeExtension(extension)),
                logger,
                journal);
    }

    public synchronized Disposer useAsDefaultNamer(final NamerCreator creator) {
        Objects.requireNonNull(creator, "creator");
        final NamerCreator previous = namerCreator;
        namerCreator = creator;
        return push(Disposer.Axis.NAMER, creator.toString(), () -> namerCreator = previous);
    }

    public synchronized Disposer useAsDefaultReporter(final ApprovalFailureReporter newReporter) {
        Objects.requireNonNull(newReporter, "reporter");
        final ApprovalFailureReporter previous = reporter;
        reporter = newReporter;
        return push(Disposer.Axis.REPORTER, newReporter.toString(), () -> reporter = previous);
    }

    public synchronized Disposer useAsFrontLoadedReporter(final ApprovalFailureReporter frontLoaded) {
        Objects.requireNonNull(frontLoaded, "reporter");
        final List<ApprovalFailureReporter> previous = frontLoadedReporters;
        final List<ApprovalFailureReporter> next = new ArrayList<>(previous);
        next.add(frontLoaded);
        frontLoadedReporters = List.copyOf(next);
        return push(Disposer.Axis.FRONT_LOADED_REPORTER, frontLoaded.toString(), () -> frontLoadedReporters = previous);
    }

    public synchronized Disposer useApprovalsSubdirectory(final String newSubdirectory) {
        final String normalized = newSubdirectory == null ? "" : newSubdirectory.trim();
        if (normalized.contains("..") || Path.of(normalized).isAbsolute()) {
            throw new IllegalArgumentException("subdirectory must be a relative path without '..': " + normalized);
        }
        final String previous = subdirectory;
        subdirectory = normalized;
        return push(Disposer.Axis.SUBDIRECTORY, normalized, () -> subdirectory = previous);
    }

    public synchronized Disposer useComparatorForFileExtension(
            final String fileExtension, final ApprovalComparator comparator) {
        Objects.requireNonNull(comparator, "comparator");
        final String extension = normalizeExtension(fileExtension);
        final Map<String, ApprovalComparator> previous = comparators;
        final Map<String, ApprovalComparator> next = new HashMap<>(previous);
        next.put(extension, comparator);
        comparators = Map.copyOf(next);
        return push(Disposer.Axis.COMPARATOR, extension, () -> comparators = previous);
    }

    /**
     * Number of overrides currently open.
     */
    public synchronized int depth() {
        return stack.size();
    }

    /**
     * Releases open overrides, most recent first, until {@code depth} remain.
     *
     * @return the overrides that were released
     */
    public synchronized List<Disposer> unwindTo(final int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative");
        }
        final List<Disposer> released = new ArrayList<>();
        while (stack.size() > depth) {
            final Disposer top = stack.pop();
            top.restore();
            released.add(top);
        }
        return released;
    }

    synchronized void release(final Disposer disposer) {
        if (disposer.isReleased()) {
            return;
        }
        final Disposer top = stack.peek();
        if (top != disposer) {
            throw new ConfigurationStackException(
                    "Disposer " + disposer + " released out of order; release " + top
                            + " first. Open overrides must be closed in reverse order of creation.");
        }
        stack.pop();
        disposer.restore();
    }

    private Disposer push(final Disposer.Axis axis, final String description, final Runnable restore) {
        final Disposer disposer = new Disposer(this, axis, description, restore);
        stack.push(disposer);
        return disposer;
    }

    private static String normalizeExtension(final String fileExtension) {
        if (fileExtension == null || fileExtension.isBlank()) {
            throw new IllegalArgumentException("fileExtension must not be blank");
        }
        final String trimmed = fileExtension.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }

    private static JsonLinesLogger createLogger(final String log) {
        final String normalized = log == null ? ApprovalsSettings.LOG_NONE : log.trim();
        if (ApprovalsSettings.LOG_NONE.equalsIgnoreCase(normalized)) {
            return NoOpJsonLinesLogger.INSTANCE;
        }
        if (ApprovalsSettings.LOG_STDERR.equalsIgnoreCase(normalized)) {
            return StructuredJsonLinesLogger.standardError();
        }
        return StructuredJsonLinesLogger.appendingTo(Path.of(normalized));
    }
}
