package org.approvalkit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ExceptionCaptureTest {
    @Test
    void capturesCheckedAndUncheckedExceptions() {
        final ExceptionCapture checked = ExceptionCapture.of(() -> {
            throw new Exception("checked");
        });
        final ExceptionCapture unchecked = ExceptionCapture.of(() -> {
            throw new IllegalArgumentException("unchecked");
        });

        assertTrue(checked.failed());
        assertEquals("checked", checked.messageText());
        assertInstanceOf(IllegalArgumentException.class, unchecked.exception().orElseThrow());
    }

    @Test
    void completionIsRepresentedBySentinel() {
        final ExceptionCapture capture = ExceptionCapture.of(() -> {});

        assertFalse(capture.failed());
        assertTrue(capture.exception().isEmpty());
        assertEquals("*** no exception thrown ***", capture.messageText());
    }

    @Test
    void errorsAreNotCaptured() {
        final AssertionError error = new AssertionError("not mine");

        assertSame(error, assertThrows(AssertionError.class, () -> ExceptionCapture.of(() -> {
            throw error;
        })));
    }
}
