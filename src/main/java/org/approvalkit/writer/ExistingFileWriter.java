package org.approvalkit.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.approvalkit.scrub.Scrubber;

/**
 * Treats a file the caller already produced as the received side of a verification.
 *
 * <p>The caller's file is never written or deleted. With a scrubber, a scrubbed copy named
 * {@code <stem>.scrubbed.received<ext>} is written next to it and becomes the received side.
 */
public final class ExistingFileWriter implements ApprovalWriter {
    private final Path existingFile;
    private final Scrubber scrubber;

    public ExistingFileWriter(Path existingFile) {
        this(existingFile, null);
    }

    private ExistingFileWriter(Path existingFile, Scrubber scrubber) {
        this.existingFile = Objects.requireNonNull(existingFile, "existingFile").toAbsolutePath().normalize();
        this.scrubber = scrubber;
        if (!Files.isRegularFile(this.existingFile)) {
            throw new IllegalArgumentException("existing file does not exist: " + this.existingFile);
        }
    }

    public Path existingFile() {
        return existingFile;
    }

    /**
     * Path the comparison reads as received: the caller's file, or its scrubbed copy.
     */
    public Path receivedFile() {
        if (scrubber == null) {
            return existingFile;
        }
        String fileName = existingFile.getFileName().toString();
        String stem = fileName.endsWith(fileExtension())
                ? fileName.substring(0, fileName.length() - fileExtension().length())
                : fileName;
        return existingFile.resolveSibling(stem + ".scrubbed.received" + fileExtension());
    }

    @Override
    public String fileExtension() {
        String fileName = existingFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return DEFAULT_FILE_EXTENSION;
        }
        return fileName.substring(dot);
    }

    @Override
    public void writeReceivedFile(Path receivedFile) throws IOException {
        if (scrubber == null) {
            return;
        }
        String scrubbed = scrubber.scrub(Files.readString(existingFile, StandardCharsets.UTF_8));
        Files.writeString(receivedFile, scrubbed, StandardCharsets.UTF_8);
    }

    @Override
    public void cleanUpReceived(Path receivedFile) {
        if (scrubber == null || receivedFile.toAbsolutePath().normalize().equals(existingFile)) {
            return;
        }
        try {
            Files.deleteIfExists(receivedFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete scrubbed copy " + receivedFile, e);
        }
    }

    @Override
    public ExistingFileWriter withScrubber(Scrubber scrubber) {
        return new ExistingFileWriter(existingFile, Objects.requireNonNull(scrubber, "scrubber"));
    }
}
