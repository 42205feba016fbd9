package org.approvalkit.writer;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.approvalkit.scrub.Scrubber;

/**
 * Writes a text payload as UTF-8.
 */
public final class StringApprovalWriter implements ApprovalWriter {
    private final String text;
    private final String fileExtension;

    public StringApprovalWriter(String text) {
        this(text, DEFAULT_FILE_EXTENSION);
    }

    public StringApprovalWriter(String text, String fileExtension) {
        this.text = Objects.requireNonNull(text, "text");
        this.fileExtension = ApprovalWriter.normalizeExtension(fileExtension);
    }

    public String text() {
        return text;
    }

    @Override
    public String fileExtension() {
        return fileExtension;
    }

    @Override
    public void writeReceivedFile(Path receivedFile) throws IOException {
        Path parent = receivedFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(receivedFile, StandardCharsets.UTF_8)) {
            writer.write(text);
        }
    }

    @Override
    public ApprovalWriter withScrubber(Scrubber scrubber) {
        Objects.requireNonNull(scrubber, "scrubber");
        return new StringApprovalWriter(scrubber.scrub(text), fileExtension);
    }
}
