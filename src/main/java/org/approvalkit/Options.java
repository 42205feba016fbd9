package org.approvalkit;

import java.util.Objects;
import java.util.Optional;
import org.approvalkit.core.DefaultStringConverter;
import org.approvalkit.core.StringConverter;
import org.approvalkit.namer.ApprovalNamer;
import org.approvalkit.reporter.ApprovalFailureReporter;
import org.approvalkit.scrub.Scrubber;
import org.approvalkit.writer.ApprovalWriter;

/**
 * Per-verification customisation. Immutable: every {@code with*} method returns a new instance.
 */
public final class Options {
    private static final Options DEFAULTS = new Options(
            null, null, null, ApprovalWriter.DEFAULT_FILE_EXTENSION, null, DefaultStringConverter.INSTANCE);

    private final Scrubber scrubber;
    private final ApprovalFailureReporter reporter;
    private final ApprovalNamer namer;
    private final String fileExtension;
    private final String nameSuffix;
    private final StringConverter stringConverter;

    private Options(
            Scrubber scrubber,
            ApprovalFailureReporter reporter,
            ApprovalNamer namer,
            String fileExtension,
            String nameSuffix,
            StringConverter stringConverter) {
        this.scrubber = scrubber;
        this.reporter = reporter;
        this.namer = namer;
        this.fileExtension = fileExtension;
        this.nameSuffix = nameSuffix;
        this.stringConverter = stringConverter;
    }

    public static Options defaults() {
        return DEFAULTS;
    }

    public Options withScrubber(Scrubber newScrubber) {
        return new Options(
                Objects.requireNonNull(newScrubber, "scrubber"), reporter, namer, fileExtension, nameSuffix,
                stringConverter);
    }

    /**
     * Reporter for this verification only, instead of the configured default.
     */
    public Options withReporter(ApprovalFailureReporter newReporter) {
        return new Options(
                scrubber, Objects.requireNonNull(newReporter, "reporter"), namer, fileExtension, nameSuffix,
                stringConverter);
    }

    public Options withNamer(ApprovalNamer newNamer) {
        return new Options(
                scrubber, reporter, Objects.requireNonNull(newNamer, "namer"), fileExtension, nameSuffix,
                stringConverter);
    }

    public Options withFileExtension(String newFileExtension) {
        return new Options(
                scrubber, reporter, namer, ApprovalWriter.normalizeExtension(newFileExtension), nameSuffix,
                stringConverter);
    }

    /**
     * Extra file-name segment, e.g. a parameter value, appended after the test name.
     */
    public Options withNameSuffix(String newNameSuffix) {
        return new Options(scrubber, reporter, namer, fileExtension, newNameSuffix, stringConverter);
    }

    public Options withStringConverter(StringConverter newStringConverter) {
        return new Options(
                scrubber, reporter, namer, fileExtension, nameSuffix,
                Objects.requireNonNull(newStringConverter, "stringConverter"));
    }

    public Optional<Scrubber> scrubber() {
        return Optional.ofNullable(scrubber);
    }

    public Optional<ApprovalFailureReporter> reporter() {
        return Optional.ofNullable(reporter);
    }

    public Optional<ApprovalNamer> namer() {
        return Optional.ofNullable(namer);
    }

    public String fileExtension() {
        return fileExtension;
    }

    public Optional<String> nameSuffix() {
        return Optional.ofNullable(nameSuffix);
    }

    public StringConverter stringConverter() {
        return stringConverter;
    }

    public String scrub(String text) {
        return scrubber == null ? text : scrubber.scrub(text);
    }
}
