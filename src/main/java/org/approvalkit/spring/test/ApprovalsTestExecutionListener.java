package org.approvalkit.spring.test;

import org.approvalkit.namer.ApprovalTestContext;
import org.springframework.core.Ordered;
import org.springframework.test.context.TestContext;
import org.springframework.test.context.support.AbstractTestExecutionListener;

/**
 * Spring TestContext integration: names approved files after the running test method.
 *
 * <p>Repeated invocations of the same method keep counting verifications, matching
 * {@link org.approvalkit.junit.ApprovalsExtension}.
 */
public final class ApprovalsTestExecutionListener extends AbstractTestExecutionListener {
    private static final String CONTEXT_ATTRIBUTE = ApprovalsTestExecutionListener.class.getName() + ".context";

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void beforeTestMethod(final TestContext testContext) {
        final Class<?> testClass = testContext.getTestClass();
        final String methodName = testContext.getTestMethod().getName();
        final Object previous = testContext.getAttribute(CONTEXT_ATTRIBUTE);
        if (previous instanceof ApprovalTestContext context && context.isFor(testClass, methodName)) {
            ApprovalTestContext.resume(context);
            return;
        }
        testContext.setAttribute(CONTEXT_ATTRIBUTE, ApprovalTestContext.enter(testClass, methodName));
    }

    @Override
    public void afterTestMethod(final TestContext testContext) {
        ApprovalTestContext.exit();
    }
}
