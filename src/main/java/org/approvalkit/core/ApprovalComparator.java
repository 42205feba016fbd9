package org.approvalkit.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decides whether a received file matches its approved file. Both files exist when called.
 */
@FunctionalInterface
public interface ApprovalComparator {
    boolean contentsMatch(Path receivedFile, Path approvedFile) throws IOException;
}
