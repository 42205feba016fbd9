package org.approvalkit.writer;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes a byte payload verbatim. Binary payloads are never scrubbed.
 */
public final class BinaryApprovalWriter implements ApprovalWriter {
    private final byte[] payload;
    private final String fileExtension;

    public BinaryApprovalWriter(byte[] payload, String fileExtension) {
        this.payload = Objects.requireNonNull(payload, "payload").clone();
        this.fileExtension = ApprovalWriter.normalizeExtension(fileExtension);
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
        try (OutputStream out = Files.newOutputStream(receivedFile)) {
            out.write(payload);
        }
    }
}
