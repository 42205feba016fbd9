package org.approvalkit.namer;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Identifies one verification call: where the test lives, which test it is, and which call within
 * the test. Only used to derive file names.
 */
public final class TestIdentity {
    private final Path sourceDirectory;
    private final String sourceFileStem;
    private final String testName;
    private final int discriminator;
    private final String nameSuffix;

    public TestIdentity(Path sourceDirectory, String sourceFileStem, String testName) {
        this(sourceDirectory, sourceFileStem, testName, 1, null);
    }

    public TestIdentity(
        Path sourceDirectory,
        String sourceFileStem,
        String testName,
        int discriminator,
        String nameSuffix
    ) {
        this.sourceDirectory = Objects.requireNonNull(sourceDirectory, "sourceDirectory");
        this.sourceFileStem = requireText(sourceFileStem, "sourceFileStem");
        this.testName = requireText(testName, "testName");
        if (discriminator < 1) {
            throw new IllegalArgumentException("discriminator must be at least 1");
        }
        this.discriminator = discriminator;
        this.nameSuffix = normalize(nameSuffix);
    }

    public Path sourceDirectory() {
        return sourceDirectory;
    }

    public String sourceFileStem() {
        return sourceFileStem;
    }

    public String testName() {
        return testName;
    }

    public int discriminator() {
        return discriminator;
    }

    public Optional<String> nameSuffix() {
        return Optional.ofNullable(nameSuffix);
    }

    /**
     * {@code Stem.testName[.suffix][.N]}, the discriminator only appearing from the second call on.
     */
    public String baseName() {
        StringBuilder sb = new StringBuilder(sourceFileStem).append('.').append(testName);
        if (nameSuffix != null) {
            sb.append('.').append(nameSuffix);
        }
        if (discriminator > 1) {
            sb.append('.').append(discriminator);
        }
        return sb.toString();
    }

    public TestIdentity withNameSuffix(String suffix) {
        return new TestIdentity(sourceDirectory, sourceFileStem, testName, discriminator, suffix);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TestIdentity that)) {
            return false;
        }
        return discriminator == that.discriminator
            && sourceDirectory.equals(that.sourceDirectory)
            && sourceFileStem.equals(that.sourceFileStem)
            && testName.equals(that.testName)
            && Objects.equals(nameSuffix, that.nameSuffix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceDirectory, sourceFileStem, testName, discriminator, nameSuffix);
    }

    @Override
    public String toString() {
        return sourceDirectory.resolve(baseName()).toString();
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
