package org.approvalkit.namer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Maps a test class to the directory holding its source file.
 */
public final class SourceDirectoryResolver {
    public static final List<String> DEFAULT_TEST_SOURCE_ROOTS =
            List.of("src/test/java", "src/test/kotlin", "src/test/groovy");
    private static final List<String> SOURCE_SUFFIXES = List.of(".java", ".kt", ".groovy");

    private final Path baseDirectory;
    private final List<String> testSourceRoots;

    public SourceDirectoryResolver(final Path baseDirectory, final List<String> testSourceRoots) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory").toAbsolutePath().normalize();
        this.testSourceRoots = List.copyOf(Objects.requireNonNull(testSourceRoots, "testSourceRoots"));
        if (this.testSourceRoots.isEmpty()) {
            throw new IllegalArgumentException("testSourceRoots must not be empty");
        }
    }

    public static SourceDirectoryResolver forWorkingDirectory(final List<String> testSourceRoots) {
        return new SourceDirectoryResolver(Path.of(""), testSourceRoots);
    }

    public List<String> testSourceRoots() {
        return testSourceRoots;
    }

    /**
     * First source root that contains the class's source file, else the package directory under the
     * first root.
     */
    public Path resolve(final Class<?> testClass) {
        Objects.requireNonNull(testClass, "testClass");
        final Class<?> topLevel = topLevelClass(testClass);
        final String packagePath = topLevel.getPackageName().replace('.', '/');
        for (final String root : testSourceRoots) {
            final Path packageDirectory = baseDirectory.resolve(root).resolve(packagePath);
            for (final String suffix : SOURCE_SUFFIXES) {
                if (Files.isRegularFile(packageDirectory.resolve(topLevel.getSimpleName() + suffix))) {
                    return packageDirectory;
                }
            }
        }
        return baseDirectory.resolve(testSourceRoots.get(0)).resolve(packagePath);
    }

    static Class<?> topLevelClass(final Class<?> type) {
        Class<?> current = type;
        while (current.getEnclosingClass() != null) {
            current = current.getEnclosingClass();
        }
        return current;
    }
}
