package org.approvalkit.obs;

import java.util.Map;

/**
 * Logger used when no log destination is configured.
 */
public final class NoOpJsonLinesLogger implements JsonLinesLogger {
    public static final NoOpJsonLinesLogger INSTANCE = new NoOpJsonLinesLogger();

    private NoOpJsonLinesLogger() {}

    @Override
    public void log(String level, String message, VerificationContext context, Map<String, ?> fields) {
    }

    @Override
    public void close() {
    }
}
