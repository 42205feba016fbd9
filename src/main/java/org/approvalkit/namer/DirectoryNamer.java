package org.approvalkit.namer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Keeps approved and received files in one fixed directory, whatever the test's source location.
 */
public final class DirectoryNamer implements ApprovalNamer {
    private final Path directory;

    public DirectoryNamer(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path directory() {
        return directory;
    }

    @Override
    public Path approvedFile(TestIdentity identity, String fileExtension) {
        return directory.resolve(identity.baseName() + TestNamer.APPROVED + fileExtension);
    }

    @Override
    public Path receivedFile(TestIdentity identity, String fileExtension) {
        return directory.resolve(identity.baseName() + TestNamer.RECEIVED + fileExtension);
    }
}
