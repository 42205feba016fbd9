package org.approvalkit.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Compares UTF-8 text, treating CRLF and LF as equal. Useful for approved files checked out with
 * platform line endings.
 */
public final class LineEndingInsensitiveComparator implements ApprovalComparator {
    @Override
    public boolean contentsMatch(final Path receivedFile, final Path approvedFile) throws IOException {
        final String received = Files.readString(receivedFile, StandardCharsets.UTF_8);
        final String approved = Files.readString(approvedFile, StandardCharsets.UTF_8);
        return normalize(received).equals(normalize(approved));
    }

    private static String normalize(final String text) {
        return text.replace("\r\n", "\n");
    }
}
