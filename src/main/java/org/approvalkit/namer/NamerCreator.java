package org.approvalkit.namer;

/**
 * Creates the default namer, given the subdirectory policy in force when a verification runs.
 */
@FunctionalInterface
public interface NamerCreator {
    ApprovalNamer create(String subdirectory);

    /**
     * {@link TestNamer}, relocated by {@link SubdirectoryNamer} when a subdirectory is set.
     */
    static NamerCreator standard() {
        return subdirectory -> subdirectory == null || subdirectory.isBlank()
                ? new TestNamer()
                : new SubdirectoryNamer(new TestNamer(), subdirectory);
    }
}
