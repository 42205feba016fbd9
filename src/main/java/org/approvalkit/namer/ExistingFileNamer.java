package org.approvalkit.namer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Uses a caller-supplied file as the received side; the approved side comes from another namer.
 */
public final class ExistingFileNamer implements ApprovalNamer {
    private final Path receivedFile;
    private final ApprovalNamer approvedNamer;

    public ExistingFileNamer(Path receivedFile, ApprovalNamer approvedNamer) {
        this.receivedFile = Objects.requireNonNull(receivedFile, "receivedFile");
        this.approvedNamer = Objects.requireNonNull(approvedNamer, "approvedNamer");
    }

    @Override
    public Path approvedFile(TestIdentity identity, String fileExtension) {
        return approvedNamer.approvedFile(identity, fileExtension);
    }

    @Override
    public Path receivedFile(TestIdentity identity, String fileExtension) {
        return receivedFile;
    }
}
