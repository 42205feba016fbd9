package org.approvalkit.obs;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every structured log event of a verification.
 */
public final class VerificationContext {
    private final String testId;
    private final String operation;
    private final String approvedFile;
    private final String receivedFile;

    private VerificationContext(Builder builder) {
        this.testId = requireText(builder.testId, "testId");
        this.operation = requireText(builder.operation, "operation");
        this.approvedFile = builder.approvedFile == null ? null : builder.approvedFile.toString();
        this.receivedFile = builder.receivedFile == null ? null : builder.receivedFile.toString();
    }

    public static VerificationContext of(String testId, String operation) {
        return builder(testId, operation).build();
    }

    public static Builder builder(String testId, String operation) {
        return new Builder(testId, operation);
    }

    public String testId() {
        return testId;
    }

    public String operation() {
        return operation;
    }

    public Optional<String> approvedFile() {
        return Optional.ofNullable(approvedFile);
    }

    public Optional<String> receivedFile() {
        return Optional.ofNullable(receivedFile);
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("testId", testId);
        fields.put("operation", operation);
        if (approvedFile != null) {
            fields.put("approvedFile", approvedFile);
        }
        if (receivedFile != null) {
            fields.put("receivedFile", receivedFile);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = value == null ? null : value.trim();
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    public static final class Builder {
        private final String testId;
        private final String operation;
        private Path approvedFile;
        private Path receivedFile;

        private Builder(String testId, String operation) {
            this.testId = Objects.requireNonNull(testId, "testId");
            this.operation = Objects.requireNonNull(operation, "operation");
        }

        public Builder approvedFile(Path approvedFile) {
            this.approvedFile = approvedFile;
            return this;
        }

        public Builder receivedFile(Path receivedFile) {
            this.receivedFile = receivedFile;
            return this;
        }

        public VerificationContext build() {
            return new VerificationContext(this);
        }
    }
}
