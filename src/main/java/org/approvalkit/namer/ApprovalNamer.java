package org.approvalkit.namer;

import java.nio.file.Path;

/**
 * Derives the approved and received file locations of a verification. Implementations must be pure
 * functions of their arguments.
 */
public interface ApprovalNamer {
    Path approvedFile(TestIdentity identity, String fileExtension);

    Path receivedFile(TestIdentity identity, String fileExtension);
}
