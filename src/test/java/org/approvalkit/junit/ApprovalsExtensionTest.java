package org.approvalkit.junit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.platform.engine.discovery.DiscoverySelectors.selectClass;

import org.approvalkit.Approvals;
import org.approvalkit.config.ApprovalsConfiguration;
import org.approvalkit.config.ConfigurationStackException;
import org.approvalkit.config.Disposer;
import org.approvalkit.namer.ApprovalTestContext;
import org.approvalkit.namer.TestIdentity;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.platform.engine.TestExecutionResult;
import org.junit.platform.testkit.engine.EngineExecutionResults;
import org.junit.platform.testkit.engine.EngineTestKit;
import org.junit.platform.testkit.engine.Event;

@ExtendWith(ApprovalsExtension.class)
class ApprovalsExtensionTest {
    @Test
    void installsContextForTheRunningTest() {
        final ApprovalTestContext context = ApprovalTestContext.installed().orElseThrow();

        assertEquals(ApprovalsExtensionTest.class, context.testClass());
        assertEquals("installsContextForTheRunningTest", context.methodName());
        assertEquals(0, context.verificationCount());
    }

    @Test
    void identityNamesTheTestMethod() {
        final TestIdentity identity = ApprovalTestContext.current()
                .peekIdentity(ApprovalsConfiguration.shared().sourceDirectoryResolver());

        assertEquals("ApprovalsExtensionTest.identityNamesTheTestMethod", identity.baseName());
    }

    @Test
    void failsTestsThatLeaveOverridesOpenAndRestoresConfiguration() {
        final ApprovalsConfiguration configuration = ApprovalsConfiguration.shared();
        final int depth = configuration.depth();
        final String subdirectory = configuration.subdirectory();

        final EngineExecutionResults results = EngineTestKit.engine("junit-jupiter")
                .selectors(selectClass(LeakingCase.class))
                .execute();

        results.testEvents().assertStatistics(stats -> stats.started(2).succeeded(1).failed(1));
        final Event failed = results.testEvents().failed().stream().findFirst().orElseThrow();
        final Throwable failure = failed.getPayload(TestExecutionResult.class)
                .flatMap(TestExecutionResult::getThrowable)
                .orElseThrow();
        assertInstanceOf(ConfigurationStackException.class, failure);
        assertTrue(failure.getMessage().contains("SUBDIRECTORY(leaked)"));
        assertEquals(depth, configuration.depth());
        assertEquals(subdirectory, configuration.subdirectory());
    }

    @Nested
    class NestedTests {
        @Test
        void usesNestedClassInTheName() {
            final TestIdentity identity = ApprovalTestContext.current()
                    .peekIdentity(ApprovalsConfiguration.shared().sourceDirectoryResolver());

            assertEquals("ApprovalsExtensionTest.NestedTests.usesNestedClassInTheName", identity.baseName());
        }
    }

    /**
     * Run only through the engine test kit above.
     */
    @ExtendWith(ApprovalsExtension.class)
    static class LeakingCase {
        @Test
        void leaksAnOverride() {
            Approvals.useApprovalsSubdirectory("leaked");
        }

        @Test
        void closesItsOverride() {
            try (Disposer ignored = Approvals.useApprovalsSubdirectory("closed")) {
                assertEquals("closed", ApprovalsConfiguration.shared().subdirectory());
            }
        }
    }
}
