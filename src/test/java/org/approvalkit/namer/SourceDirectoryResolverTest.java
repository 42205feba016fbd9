package org.approvalkit.namer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceDirectoryResolverTest {
    @Test
    void picksFirstRootContainingTheSourceFile(@TempDir final Path tempDir) throws Exception {
        final Path kotlinPackage = tempDir.resolve("src/test/kotlin/org/approvalkit/namer");
        Files.createDirectories(kotlinPackage);
        Files.writeString(kotlinPackage.resolve("SourceDirectoryResolverTest.kt"), "");

        final SourceDirectoryResolver resolver =
                new SourceDirectoryResolver(tempDir, SourceDirectoryResolver.DEFAULT_TEST_SOURCE_ROOTS);

        assertEquals(kotlinPackage.toAbsolutePath().normalize(), resolver.resolve(SourceDirectoryResolverTest.class));
    }

    @Test
    void nestedClassesResolveToTheirTopLevelSource(@TempDir final Path tempDir) throws Exception {
        final Path javaPackage = tempDir.resolve("src/test/java/org/approvalkit/namer");
        Files.createDirectories(javaPackage);
        Files.writeString(javaPackage.resolve("SourceDirectoryResolverTest.java"), "");

        final SourceDirectoryResolver resolver =
                new SourceDirectoryResolver(tempDir, SourceDirectoryResolver.DEFAULT_TEST_SOURCE_ROOTS);

        assertEquals(javaPackage.toAbsolutePath().normalize(), resolver.resolve(Nested.class));
    }

    @Test
    void fallsBackToFirstRootWhenNoSourceExists(@TempDir final Path tempDir) {
        final SourceDirectoryResolver resolver = new SourceDirectoryResolver(tempDir, List.of("tests", "more-tests"));

        assertEquals(
                tempDir.toAbsolutePath().normalize().resolve("tests/org/approvalkit/namer"),
                resolver.resolve(SourceDirectoryResolverTest.class));
    }

    @Test
    void requiresAtLeastOneRoot(@TempDir final Path tempDir) {
        assertThrows(IllegalArgumentException.class, () -> new SourceDirectoryResolver(tempDir, List.of()));
    }

    static final class Nested {}
}
