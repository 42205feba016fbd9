package org.approvalkit.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.approvalkit.scrub.Scrubber;

/**
 * Produces the received side of a single verification.
 */
public interface ApprovalWriter {
    String DEFAULT_FILE_EXTENSION = ".txt";

    /**
     * File extension of the received and approved files, including the leading dot.
     */
    String fileExtension();

    /**
     * Writes the payload to {@code receivedFile}, replacing any stale content.
     */
    void writeReceivedFile(Path receivedFile) throws IOException;

    /**
     * Called after a successful match. Deletes the received file unless the writer does not own it.
     */
    default void cleanUpReceived(Path receivedFile) {
        try {
            Files.deleteIfExists(receivedFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete received file " + receivedFile, e);
        }
    }

    /**
     * Returns a writer whose text payload is scrubbed. Writers without a text payload return themselves.
     */
    default ApprovalWriter withScrubber(Scrubber scrubber) {
        return this;
    }

    static String normalizeExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return DEFAULT_FILE_EXTENSION;
        }
        String trimmed = extension.trim();
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }
}
