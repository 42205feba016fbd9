package org.approvalkit;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Function;
import org.approvalkit.config.ApprovalsConfiguration;
import org.approvalkit.config.Disposer;
import org.approvalkit.core.ApprovalComparator;
import org.approvalkit.namer.ApprovalNamer;
import org.approvalkit.namer.ApprovalTestContext;
import org.approvalkit.namer.ExistingFileNamer;
import org.approvalkit.namer.NamerCreator;
import org.approvalkit.namer.TestIdentity;
import org.approvalkit.reporter.ApprovalFailureReporter;
import org.approvalkit.writer.ApprovalWriter;
import org.approvalkit.writer.ExistingFileWriter;
import org.approvalkit.writer.StringApprovalWriter;
import org.bson.BsonDocument;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

/**
 * Entry points for approval tests.
 *
 * <p>Each verification writes a {@code .received} file next to the test source, compares it with the
 * {@code .approved} file of the same name and fails the test when they differ. Approved files are
 * named {@code <TestClass>.<testMethod>.approved.<ext>}; further verifications in the same test add
 * {@code .2}, {@code .3} and so on.
 */
public final class Approvals {
    public static final String DEFAULT_SUBDIRECTORY = "approval_tests";

    private static final JsonWriterSettings PRETTY_JSON = JsonWriterSettings.builder()
            .outputMode(JsonMode.RELAXED)
            .indent(true)
            .indentCharacters("  ")
            .newLineCharacters("\n")
            .build();

    private Approvals() {}

    // Single values

    public static void verify(final String text) {
        verify(text, Options.defaults());
    }

    public static void verify(final String text, final Options options) {
        Objects.requireNonNull(text, "text");
        verify(new StringApprovalWriter(text, options.fileExtension()), options);
    }

    /**
     * Verifies a writer's payload. A scrubber in {@code options} applies to text writers.
     */
    public static void verify(final ApprovalWriter writer) {
        verify(writer, Options.defaults());
    }

    public static void verify(final ApprovalWriter writer, final Options options) {
        Objects.requireNonNull(writer, "writer");
        Objects.requireNonNull(options, "options");
        final ApprovalsConfiguration configuration = ApprovalsConfiguration.shared();
        final TestIdentity identity = nextIdentity(configuration, options);
        final ApprovalNamer namer = options.namer().orElseGet(configuration::defaultNamer);
        configuration.fileApprover().verify(
                namer, identity, writer, reporterFor(configuration, options), options.scrubber().orElse(null));
    }

    /**
     * Converts {@code value} with the options' string converter, called once, and verifies the result.
     */
    public static void verify(final Object value) {
        verify(value, Options.defaults());
    }

    public static void verify(final Object value, final Options options) {
        verify(options.stringConverter().toString(value), options);
    }

    public static <T> void verify(final T value, final Function<? super T, String> converter) {
        verify(value, converter, Options.defaults());
    }

    public static <T> void verify(
            final T value, final Function<? super T, String> converter, final Options options) {
        Objects.requireNonNull(converter, "converter");
        verify(converter.apply(value), options);
    }

    /**
     * Verifies a JSON object, pretty printed so that diffs are line based. Written as {@code .json}.
     */
    public static void verifyJson(final String json) {
        verifyJson(json, Options.defaults());
    }

    public static void verifyJson(final String json, final Options options) {
        Objects.requireNonNull(json, "json");
        final String pretty = BsonDocument.parse(json).toJson(PRETTY_JSON) + "\n";
        verify(pretty, options.withFileExtension(".json"));
    }

    // Exceptions

    /**
     * Verifies the message of the exception {@code operation} throws, or
     * {@value ExceptionCapture#NO_EXCEPTION_THROWN} when it completes normally.
     */
    public static void verifyExceptionMessage(final ThrowingRunnable operation) {
        verifyExceptionMessage(operation, Options.defaults());
    }

    public static void verifyExceptionMessage(final ThrowingRunnable operation, final Options options) {
        verify(ExceptionCapture.of(operation).messageText(), options);
    }

    // Collections

    public static <T> void verifyAll(final Iterable<T> items) {
        verifyAll("", items, Options.defaults());
    }

    public static <T> void verifyAll(final String header, final Iterable<T> items, final Options options) {
        verifyAll(header, items, item -> options.stringConverter().toString(item), options);
    }

    public static <T> void verifyAll(
            final String header, final Iterable<T> items, final Function<? super T, String> converter) {
        verifyAll(header, items, converter, Options.defaults());
    }

    /**
     * Verifies all items as one file: the header, two blank lines, then one {@code [i] = value} line per
     * item. An empty header leaves out the header block.
     */
    public static <T> void verifyAll(
            final String header,
            final Iterable<T> items,
            final Function<? super T, String> converter,
            final Options options) {
        verify(formatAll(header, items, converter), options);
    }

    public static <T> void verifyAll(
            final String header, final T[] items, final Function<? super T, String> converter) {
        verifyAll(header, Arrays.asList(items), converter, Options.defaults());
    }

    public static <T> void verifyAll(
            final String header,
            final T[] items,
            final Function<? super T, String> converter,
            final Options options) {
        verifyAll(header, Arrays.asList(items), converter, options);
    }

    static <T> String formatAll(
            final String header, final Iterable<T> items, final Function<? super T, String> converter) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(converter, "converter");
        final StringBuilder sb = new StringBuilder();
        if (header != null && !header.isEmpty()) {
            sb.append(header).append("\n\n\n");
        }
        int index = 0;
        final Iterator<T> iterator = items.iterator();
        while (iterator.hasNext()) {
            sb.append('[').append(index++).append("] = ").append(converter.apply(iterator.next())).append('\n');
        }
        return sb.toString();
    }

    // Existing files

    /**
     * Verifies a file produced elsewhere. The file itself is the received side and is never deleted.
     */
    public static void verifyExistingFile(final Path file) {
        verifyExistingFile(file, Options.defaults());
    }

    public static void verifyExistingFile(final Path file, final Options options) {
        Objects.requireNonNull(options, "options");
        final ApprovalsConfiguration configuration = ApprovalsConfiguration.shared();
        ExistingFileWriter writer = new ExistingFileWriter(file);
        if (options.scrubber().isPresent()) {
            writer = writer.withScrubber(options.scrubber().get());
        }
        final ApprovalNamer namer = new ExistingFileNamer(
                writer.receivedFile(), options.namer().orElseGet(configuration::defaultNamer));
        configuration.fileApprover().verify(
                namer, nextIdentity(configuration, options), writer, reporterFor(configuration, options));
    }

    // Configuration

    public static ApprovalNamer getDefaultNamer() {
        return ApprovalsConfiguration.shared().defaultNamer();
    }

    public static Disposer useApprovalsSubdirectory() {
        return useApprovalsSubdirectory(DEFAULT_SUBDIRECTORY);
    }

    public static Disposer useApprovalsSubdirectory(final String subdirectory) {
        return ApprovalsConfiguration.shared().useApprovalsSubdirectory(subdirectory);
    }

    public static Disposer useAsDefaultReporter(final ApprovalFailureReporter reporter) {
        return ApprovalsConfiguration.shared().useAsDefaultReporter(reporter);
    }

    public static Disposer useAsFrontLoadedReporter(final ApprovalFailureReporter reporter) {
        return ApprovalsConfiguration.shared().useAsFrontLoadedReporter(reporter);
    }

    public static Disposer useAsDefaultNamer(final NamerCreator namerCreator) {
        return ApprovalsConfiguration.shared().useAsDefaultNamer(namerCreator);
    }

    public static Disposer useComparatorForFileExtension(
            final String fileExtension, final ApprovalComparator comparator) {
        return ApprovalsConfiguration.shared().useComparatorForFileExtension(fileExtension, comparator);
    }

    private static TestIdentity nextIdentity(final ApprovalsConfiguration configuration, final Options options) {
        return ApprovalTestContext.current()
                .nextIdentity(configuration.sourceDirectoryResolver(), options.nameSuffix().orElse(null));
    }

    private static ApprovalFailureReporter reporterFor(
            final ApprovalsConfiguration configuration, final Options options) {
        return options.reporter().orElseGet(configuration::defaultReporter);
    }
}
