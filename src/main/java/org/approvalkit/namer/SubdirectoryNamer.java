package org.approvalkit.namer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Relocates the files of another namer into a subdirectory of their directory, keeping file names.
 */
public final class SubdirectoryNamer implements ApprovalNamer {
    private final ApprovalNamer delegate;
    private final String subdirectory;

    public SubdirectoryNamer(ApprovalNamer delegate, String subdirectory) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        String normalized = subdirectory == null ? "" : subdirectory.trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("subdirectory must not be blank");
        }
        if (Path.of(normalized).isAbsolute() || normalized.contains("..")) {
            throw new IllegalArgumentException("subdirectory must be a relative path without '..': " + normalized);
        }
        this.subdirectory = normalized;
    }

    public String subdirectory() {
        return subdirectory;
    }

    @Override
    public Path approvedFile(TestIdentity identity, String fileExtension) {
        return relocate(delegate.approvedFile(identity, fileExtension));
    }

    @Override
    public Path receivedFile(TestIdentity identity, String fileExtension) {
        return relocate(delegate.receivedFile(identity, fileExtension));
    }

    private Path relocate(Path file) {
        return file.resolveSibling(subdirectory).resolve(file.getFileName());
    }
}
