package org.approvalkit.obs;

import java.util.Collections;
import java.util.Map;

/**
 * Minimal structured logger that writes one JSON object per line.
 */
public interface JsonLinesLogger extends AutoCloseable {
    void log(String level, String message, VerificationContext context, Map<String, ?> fields);

    default void log(String level, String message, VerificationContext context) {
        log(level, message, context, Collections.emptyMap());
    }

    default void info(String message, VerificationContext context, Map<String, ?> fields) {
        log("INFO", message, context, fields);
    }

    default void info(String message, VerificationContext context) {
        info(message, context, Collections.emptyMap());
    }

    default void warn(String message, VerificationContext context, Map<String, ?> fields) {
        log("WARN", message, context, fields);
    }

    default void error(String message, VerificationContext context, Map<String, ?> fields) {
        log("ERROR", message, context, fields);
    }

    @Override
    void close();
}
