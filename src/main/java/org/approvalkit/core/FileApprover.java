package org.approvalkit.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.approvalkit.namer.ApprovalNamer;
import org.approvalkit.namer.TestIdentity;
import org.approvalkit.obs.JsonLinesLogger;
import org.approvalkit.obs.VerificationContext;
import org.approvalkit.obs.VerificationJournal;
import org.approvalkit.reporter.ApprovalFailureReporter;
import org.approvalkit.scrub.Scrubber;
import org.approvalkit.writer.ApprovalWriter;

/**
 * Writes the received file, compares it with the approved file and reports mismatches.
 *
 * <p>On a match the received file is cleaned up. On a mismatch every front-loaded reporter runs, then
 * the primary reporter, and an {@link ApprovalException} is thrown whatever the reporters returned; the
 * received file stays on disk. A reporter that throws does not stop the others or replace that failure.
 * A missing approved file is a mismatch against an empty baseline.
 * I/O failures surface as {@link UncheckedIOException} and are never retried.
 */
public final class FileApprover {
    private static final long MAX_DIFF_TEXT_BYTES = 1024L * 1024L;

    private final List<ApprovalFailureReporter> frontLoadedReporters;
    private final Function<String, ApprovalComparator> comparatorLookup;
    private final JsonLinesLogger logger;
    private final VerificationJournal journal;

    public FileApprover(
            final List<? extends ApprovalFailureReporter> frontLoadedReporters,
            final Function<String, ApprovalComparator> comparatorLookup,
            final JsonLinesLogger logger,
            final VerificationJournal journal) {
        this.frontLoadedReporters = List.copyOf(Objects.requireNonNull(frontLoadedReporters, "frontLoadedReporters"));
        this.comparatorLookup = Objects.requireNonNull(comparatorLookup, "comparatorLookup");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    public void verify(
            final ApprovalNamer namer,
            final TestIdentity identity,
            final ApprovalWriter writer,
            final ApprovalFailureReporter reporter) {
        verify(namer, identity, writer, reporter, null);
    }

    /**
     * @param scrubber applied to text payloads before they are written, may be null
     */
    public void verify(
            final ApprovalNamer namer,
            final TestIdentity identity,
            final ApprovalWriter writer,
            final ApprovalFailureReporter reporter,
            final Scrubber scrubber) {
        Objects.requireNonNull(namer, "namer");
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(writer, "writer");
        Objects.requireNonNull(reporter, "reporter");

        final ApprovalWriter effectiveWriter = scrubber == null ? writer : writer.withScrubber(scrubber);
        final String extension = effectiveWriter.fileExtension();
        final Path approvedFile = namer.approvedFile(identity, extension);
        final Path receivedFile = namer.receivedFile(identity, extension);
        final VerificationContext context = VerificationContext.builder(identity.baseName(), "verify")
                .approvedFile(approvedFile)
                .receivedFile(receivedFile)
                .build();

        try {
            effectiveWriter.writeReceivedFile(receivedFile);
        } catch (final IOException e) {
            recordError(context, e);
            throw new UncheckedIOException("Failed to write received file " + receivedFile, e);
        }

        if (!Files.exists(approvedFile)) {
            final String receivedText = readForDiff(receivedFile);
            final ReportOutcome reported = report(context, receivedFile, approvedFile, reporter);
            journal.record(context, VerificationJournal.Outcome.MISSING_APPROVED);
            logger.warn("approved file missing", context, Map.of("reporterHandled", reported.handled));
            throw reported.attachTo(
                    new ApprovalMissingException(receivedFile, approvedFile, reported.handled, receivedText));
        }

        final boolean matches;
        try {
            matches = comparatorFor(extension).contentsMatch(receivedFile, approvedFile);
        } catch (final IOException e) {
            recordError(context, e);
            throw new UncheckedIOException("Failed to compare " + receivedFile + " with " + approvedFile, e);
        }

        if (matches) {
            effectiveWriter.cleanUpReceived(receivedFile);
            journal.record(context, VerificationJournal.Outcome.PASSED);
            logger.info("verification passed", context);
            return;
        }

        // reporters may rewrite the approved file, so capture both sides first
        final String approvedText = readForDiff(approvedFile);
        final String receivedText = readForDiff(receivedFile);
        final ReportOutcome reported = report(context, receivedFile, approvedFile, reporter);
        journal.record(context, VerificationJournal.Outcome.MISMATCH);
        logger.warn("verification mismatch", context, Map.of("reporterHandled", reported.handled));
        throw reported.attachTo(new ApprovalMismatchException(
                receivedFile, approvedFile, reported.handled, approvedText, receivedText));
    }

    public List<ApprovalFailureReporter> frontLoadedReporters() {
        return frontLoadedReporters;
    }

    static String reporterNote(final boolean reporterHandled) {
        return reporterHandled
                ? "A reporter was invoked to show the difference."
                : "No reporter handled the difference.";
    }

    /**
     * Runs every front-loaded reporter, then the primary one. A reporter that throws is recorded and
     * skipped; its exception is later attached to the verification failure as suppressed.
     */
    private ReportOutcome report(
            final VerificationContext context,
            final Path receivedFile,
            final Path approvedFile,
            final ApprovalFailureReporter reporter) {
        final List<RuntimeException> failures = new ArrayList<>();
        for (final ApprovalFailureReporter frontLoaded : frontLoadedReporters) {
            invoke(context, frontLoaded, receivedFile, approvedFile, failures);
        }
        final boolean handled = invoke(context, reporter, receivedFile, approvedFile, failures);
        return new ReportOutcome(handled, failures);
    }

    private boolean invoke(
            final VerificationContext context,
            final ApprovalFailureReporter reporter,
            final Path receivedFile,
            final Path approvedFile,
            final List<RuntimeException> failures) {
        try {
            return reporter.report(receivedFile, approvedFile);
        } catch (final RuntimeException e) {
            failures.add(e);
            journal.record(context, VerificationJournal.Outcome.REPORTER_ERROR, reporter + ": " + e);
            logger.error(
                    "reporter failed", context, Map.of("reporter", String.valueOf(reporter), "error", e.toString()));
            return false;
        }
    }

    private ApprovalComparator comparatorFor(final String extension) {
        final ApprovalComparator comparator = comparatorLookup.apply(extension);
        return comparator == null ? BinaryComparator.INSTANCE : comparator;
    }

    private void recordError(final VerificationContext context, final IOException e) {
        journal.record(context, VerificationJournal.Outcome.ERROR, e.toString());
        logger.error("verification i/o failure", context, Map.of("error", e.toString()));
    }

    /**
     * File contents as text for IDE diff views, or null for large or non-UTF-8 files.
     */
    private static String readForDiff(final Path file) {
        try {
            if (!Files.exists(file) || Files.size(file) > MAX_DIFF_TEXT_BYTES) {
                return null;
            }
            final byte[] bytes = Files.readAllBytes(file);
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (final CharacterCodingException e) {
            return null;
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private static final class ReportOutcome {
        private final boolean handled;
        private final List<RuntimeException> failures;

        private ReportOutcome(final boolean handled, final List<RuntimeException> failures) {
            this.handled = handled;
            this.failures = failures;
        }

        private <E extends ApprovalException> E attachTo(final E failure) {
            for (final RuntimeException reporterFailure : failures) {
                failure.addSuppressed(reporterFailure);
            }
            return failure;
        }
    }
}
