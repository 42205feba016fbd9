package org.approvalkit.config;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated configuration errors.
 */
public final class ApprovalsSettingsException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public ApprovalsSettingsException(final List<String> errors) {
        super(formatMessage(errors));
        this.errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
    }

    public List<String> errors() {
        return errors;
    }

    private static String formatMessage(final List<String> errors) {
        final List<String> normalized = List.copyOf(Objects.requireNonNull(errors, "errors"));
        if (normalized.isEmpty()) {
            return "approvals configuration is invalid";
        }
        final StringBuilder sb = new StringBuilder();
        sb.append("approvals configuration is invalid (")
                .append(normalized.size())
                .append(" issue(s))");
        for (final String error : normalized) {
            sb.append('\n').append("- ").append(error);
        }
        return sb.toString();
    }
}
