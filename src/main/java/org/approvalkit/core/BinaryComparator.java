package org.approvalkit.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Byte-for-byte comparison. The default for every file extension.
 */
public final class BinaryComparator implements ApprovalComparator {
    public static final BinaryComparator INSTANCE = new BinaryComparator();

    @Override
    public boolean contentsMatch(final Path receivedFile, final Path approvedFile) throws IOException {
        return Files.mismatch(receivedFile, approvedFile) == -1L;
    }
}
