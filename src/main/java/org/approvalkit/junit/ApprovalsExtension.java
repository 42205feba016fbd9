package org.approvalkit.junit;

import java.util.List;
import org.approvalkit.config.ApprovalsConfiguration;
import org.approvalkit.config.ConfigurationStackException;
import org.approvalkit.config.Disposer;
import org.approvalkit.namer.ApprovalTestContext;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

/**
 * JUnit Jupiter integration: names approved files after the running test and fails tests that leave
 * configuration overrides open.
 *
 * <p>Invocations of a repeated, parameterized or other templated test share one verification counter,
 * kept in the template's store, so their files are named the same as without the extension.
 *
 * <p>A leaked {@link Disposer} is released before the failure is raised, so later tests start from the
 * configuration that was in force before the leaking test.
 *
 * <p>Register it with {@code @ExtendWith(ApprovalsExtension.class)}. The library also lists it for
 * Jupiter's extension auto-detection, which only takes effect when
 * {@code junit.jupiter.extensions.autodetection.enabled=true} is set, for example in
 * {@code junit-platform.properties}.
 */
public final class ApprovalsExtension implements BeforeEachCallback, AfterEachCallback {
    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(ApprovalsExtension.class);
    private static final String DEPTH_KEY = "configurationDepth";
    private static final String TEST_CONTEXT_KEY = "approvalTestContext";

    @Override
    public void beforeEach(final ExtensionContext context) {
        final Class<?> testClass = context.getRequiredTestClass();
        final String methodName = context.getRequiredTestMethod().getName();
        // a template invocation's parent carries the test method and outlives the single invocation
        final ExtensionContext owner =
                context.getParent().filter(parent -> parent.getTestMethod().isPresent()).orElse(context);
        ApprovalTestContext.resume(owner.getStore(NAMESPACE).getOrComputeIfAbsent(
                TEST_CONTEXT_KEY,
                key -> ApprovalTestContext.create(testClass, methodName),
                ApprovalTestContext.class));
        context.getStore(NAMESPACE).put(DEPTH_KEY, ApprovalsConfiguration.shared().depth());
    }

    @Override
    public void afterEach(final ExtensionContext context) {
        ApprovalTestContext.exit();
        final Integer depthBefore = context.getStore(NAMESPACE).remove(DEPTH_KEY, Integer.class);
        if (depthBefore == null) {
            return;
        }
        final List<Disposer> leaked = ApprovalsConfiguration.shared().unwindTo(depthBefore);
        if (!leaked.isEmpty()) {
            throw new ConfigurationStackException(
                    context.getDisplayName() + " left " + leaked.size()
                            + " configuration override(s) open: " + leaked
                            + ". Close every Disposer, e.g. with try-with-resources.");
        }
    }
}
