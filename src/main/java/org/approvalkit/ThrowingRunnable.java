package org.approvalkit;

/**
 * Operation whose failure message is verified.
 */
@FunctionalInterface
public interface ThrowingRunnable {
    void run() throws Exception;
}
