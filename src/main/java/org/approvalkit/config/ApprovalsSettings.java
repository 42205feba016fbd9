package org.approvalkit.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.approvalkit.namer.SourceDirectoryResolver;
import org.approvalkit.reporter.ReporterFactory;

/**
 * Startup configuration, read once from {@code approvals.yaml} and {@code approvals.*} system properties.
 */
public final class ApprovalsSettings {
    public static final String LOG_NONE = "none";
    public static final String LOG_STDERR = "stderr";
    public static final int DEFAULT_JOURNAL_CAPACITY = 256;

    private final String subdirectory;
    private final String reporter;
    private final List<String> frontLoadedReporters;
    private final List<String> testSourceRoots;
    private final String log;
    private final int journalCapacity;

    private ApprovalsSettings(final Builder builder) {
        this.subdirectory = builder.subdirectory == null ? "" : builder.subdirectory.trim();
        this.reporter = builder.reporter;
        this.frontLoadedReporters = List.copyOf(builder.frontLoadedReporters);
        this.testSourceRoots = List.copyOf(builder.testSourceRoots);
        this.log = builder.log;
        this.journalCapacity = builder.journalCapacity;
    }

    public static ApprovalsSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .subdirectory(subdirectory)
                .reporter(reporter)
                .frontLoadedReporters(frontLoadedReporters)
                .testSourceRoots(testSourceRoots)
                .log(log)
                .journalCapacity(journalCapacity);
    }

    public String subdirectory() {
        return subdirectory;
    }

    public String reporter() {
        return reporter;
    }

    public List<String> frontLoadedReporters() {
        return frontLoadedReporters;
    }

    public List<String> testSourceRoots() {
        return testSourceRoots;
    }

    public String log() {
        return log;
    }

    public int journalCapacity() {
        return journalCapacity;
    }

    public static final class Builder {
        private String subdirectory = "";
        private String reporter = "default";
        private List<String> frontLoadedReporters = List.of();
        private List<String> testSourceRoots = SourceDirectoryResolver.DEFAULT_TEST_SOURCE_ROOTS;
        private String log = LOG_NONE;
        private int journalCapacity = DEFAULT_JOURNAL_CAPACITY;

        private Builder() {}

        public Builder subdirectory(final String subdirectory) {
            this.subdirectory = subdirectory;
            return this;
        }

        public Builder reporter(final String reporter) {
            this.reporter = reporter;
            return this;
        }

        public Builder frontLoadedReporters(final List<String> frontLoadedReporters) {
            this.frontLoadedReporters = Objects.requireNonNull(frontLoadedReporters, "frontLoadedReporters");
            return this;
        }

        public Builder testSourceRoots(final List<String> testSourceRoots) {
            this.testSourceRoots = Objects.requireNonNull(testSourceRoots, "testSourceRoots");
            return this;
        }

        public Builder log(final String log) {
            this.log = log;
            return this;
        }

        public Builder journalCapacity(final int journalCapacity) {
            this.journalCapacity = journalCapacity;
            return this;
        }

        /**
         * @throws ApprovalsSettingsException listing every invalid value
         */
        public ApprovalsSettings build() {
            final List<String> errors = new ArrayList<>();
            if (subdirectory != null && (subdirectory.contains("..") || subdirectory.startsWith("/"))) {
                errors.add("subdirectory must be a relative path without '..': " + subdirectory);
            }
            if (!ReporterFactory.isKnown(reporter)) {
                errors.add("reporter is unknown: " + reporter);
            }
            for (final String name : frontLoadedReporters) {
                if (!ReporterFactory.isKnown(name)) {
                    errors.add("frontLoadedReporters contains unknown reporter: " + name);
                }
            }
            if (testSourceRoots.isEmpty()) {
                errors.add("testSourceRoots must not be empty");
            }
            for (final String root : testSourceRoots) {
                if (root == null || root.isBlank()) {
                    errors.add("testSourceRoots must not contain blank entries");
                }
            }
            if (log == null || log.isBlank()) {
                errors.add("log must be 'none', 'stderr' or a file path");
            }
            if (journalCapacity <= 0) {
                errors.add("journalCapacity must be greater than zero");
            }
            if (!errors.isEmpty()) {
                throw new ApprovalsSettingsException(errors);
            }
            return new ApprovalsSettings(this);
        }
    }
}
