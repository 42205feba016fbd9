package org.approvalkit.namer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Places approved and received files next to the test source file.
 */
public final class TestNamer implements ApprovalNamer {
    public static final String APPROVED = ".approved";
    public static final String RECEIVED = ".received";

    @Override
    public Path approvedFile(TestIdentity identity, String fileExtension) {
        return fileFor(identity, APPROVED, fileExtension);
    }

    @Override
    public Path receivedFile(TestIdentity identity, String fileExtension) {
        return fileFor(identity, RECEIVED, fileExtension);
    }

    static Path fileFor(TestIdentity identity, String kind, String fileExtension) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(fileExtension, "fileExtension");
        return identity.sourceDirectory().resolve(identity.baseName() + kind + fileExtension);
    }
}
