package org.approvalkit;

import java.util.List;
import org.approvalkit.scrub.Scrubbers;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Verifies against approved files checked in next to this class, located from the call stack.
 */
class ApprovalsSelfTest {
    @Test
    void shoppingList() {
        Approvals.verifyAll("Shopping list", List.of("apples", "bread"), item -> item.toUpperCase());
    }

    @Test
    void orderJson() {
        Approvals.verifyJson("{\"order\": 7, \"status\": \"shipped\"}");
    }

    @Test
    void scrubbedTimestamps() {
        Approvals.verify(
                "opened 2024-03-01T10:15:30Z\nclosed 2024-03-01T11:00:00Z\n",
                Options.defaults().withScrubber(Scrubbers.isoDates()));
    }

    @Nested
    class Receipts {
        @Test
        void total() {
            Approvals.verify("total: 42.00\n");
        }
    }
}
