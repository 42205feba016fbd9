package org.approvalkit.namer;

import java.util.Objects;
import java.util.Optional;

/**
 * The test currently running on this thread, and how many verifications it has made so far.
 *
 * <p>Test framework integrations {@link #enter enter} a context before each test and {@link #exit} it
 * afterwards. Without one, the running test is located from the call stack and the verification
 * counter restarts whenever the located test changes.
 *
 * <p>All invocations of one repeated or parameterized test share a counter, so they are named
 * {@code test}, {@code test.2}, {@code test.3} in invocation order whichever way the context was found.
 */
public final class ApprovalTestContext {
    private static final ThreadLocal<ApprovalTestContext> INSTALLED = new ThreadLocal<>();
    private static final ThreadLocal<ApprovalTestContext> LOCATED = new ThreadLocal<>();

    private final Class<?> testClass;
    private final String methodName;
    private int verificationCount;

    private ApprovalTestContext(final Class<?> testClass, final String methodName) {
        this.testClass = Objects.requireNonNull(testClass, "testClass");
        this.methodName = Objects.requireNonNull(methodName, "methodName");
    }

    public static ApprovalTestContext enter(final Class<?> testClass, final String methodName) {
        final ApprovalTestContext context = create(testClass, methodName);
        INSTALLED.set(context);
        return context;
    }

    /**
     * A context that is not installed yet, for integrations that keep one per test across invocations.
     */
    public static ApprovalTestContext create(final Class<?> testClass, final String methodName) {
        return new ApprovalTestContext(testClass, methodName);
    }

    /**
     * Installs a context created earlier, keeping its verification count.
     */
    public static void resume(final ApprovalTestContext context) {
        INSTALLED.set(Objects.requireNonNull(context, "context"));
    }

    public boolean isFor(final Class<?> candidateClass, final String candidateMethod) {
        return testClass.equals(candidateClass) && methodName.equals(candidateMethod);
    }

    public static void exit() {
        INSTALLED.remove();
        LOCATED.remove();
    }

    public static Optional<ApprovalTestContext> installed() {
        return Optional.ofNullable(INSTALLED.get());
    }

    /**
     * The installed context, or one for the test found on the call stack.
     *
     * @throws IllegalStateException when no running test can be determined
     */
    public static ApprovalTestContext current() {
        final ApprovalTestContext installed = INSTALLED.get();
        if (installed != null) {
            return installed;
        }
        final StackWalker.StackFrame frame = TestMethodLocator.locate()
                .orElseThrow(() -> new IllegalStateException(
                        "Could not determine the running test. Register ApprovalsExtension or verify from a "
                                + "method annotated with @Test."));
        final ApprovalTestContext previous = LOCATED.get();
        if (previous != null && previous.isFor(frame.getDeclaringClass(), frame.getMethodName())) {
            return previous;
        }
        final ApprovalTestContext located = new ApprovalTestContext(frame.getDeclaringClass(), frame.getMethodName());
        LOCATED.set(located);
        return located;
    }

    public Class<?> testClass() {
        return testClass;
    }

    public String methodName() {
        return methodName;
    }

    public synchronized int verificationCount() {
        return verificationCount;
    }

    /**
     * Allocates the identity of the next verification in this test.
     */
    public TestIdentity nextIdentity(final SourceDirectoryResolver resolver, final String nameSuffix) {
        Objects.requireNonNull(resolver, "resolver");
        final int discriminator;
        synchronized (this) {
            discriminator = ++verificationCount;
        }
        return new TestIdentity(
                resolver.resolve(testClass),
                SourceDirectoryResolver.topLevelClass(testClass).getSimpleName(),
                testName(),
                discriminator,
                nameSuffix);
    }

    /**
     * Identity of the first verification of this test, without consuming a call.
     */
    public TestIdentity peekIdentity(final SourceDirectoryResolver resolver) {
        return new TestIdentity(
                resolver.resolve(testClass),
                SourceDirectoryResolver.topLevelClass(testClass).getSimpleName(),
                testName());
    }

    private String testName() {
        final Class<?> topLevel = SourceDirectoryResolver.topLevelClass(testClass);
        if (topLevel == testClass) {
            return methodName;
        }
        final String nested = testClass.getName().substring(topLevel.getName().length() + 1).replace('$', '.');
        return nested + "." + methodName;
    }
}
