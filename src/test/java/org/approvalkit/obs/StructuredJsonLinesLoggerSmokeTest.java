package org.approvalkit.obs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StructuredJsonLinesLoggerSmokeTest {
    @Test
    void emitsContextAndCustomFieldsAsJsonLines() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        Clock fixedClock = Clock.fixed(Instant.parse("2026-02-23T10:00:00Z"), ZoneOffset.UTC);
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, fixedClock, true);

        VerificationContext context = VerificationContext.builder("OrderTest.totals", "verify")
            .approvedFile(Path.of("OrderTest.totals.approved.txt"))
            .receivedFile(Path.of("OrderTest.totals.received.txt"))
            .build();
        logger.warn("verification mismatch", context, Map.of("reporterHandled", true));

        logger.info("verification passed", VerificationContext.of("OrderTest.count", "verify"));
        logger.close();

        String[] lines = output.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(2, lines.length);

        Document first = Document.parse(lines[0]);
        assertEquals("2026-02-23T10:00:00Z", first.getString("timestamp"));
        assertEquals("WARN", first.getString("level"));
        assertEquals("verification mismatch", first.getString("message"));
        assertEquals("OrderTest.totals", first.getString("testId"));
        assertEquals("verify", first.getString("operation"));
        assertEquals("OrderTest.totals.approved.txt", first.getString("approvedFile"));
        assertEquals("OrderTest.totals.received.txt", first.getString("receivedFile"));
        assertTrue(first.getBoolean("reporterHandled"));

        Document second = Document.parse(lines[1]);
        assertEquals("INFO", second.getString("level"));
        assertEquals("OrderTest.count", second.getString("testId"));
        assertNull(second.get("approvedFile"));
        assertFalse(second.containsKey("reporterHandled"));
    }

    @Test
    void customFieldsCannotOverrideReservedKeys() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output);

        logger.info("text with \"quotes\"\nand a newline", VerificationContext.of("T.m", "verify"),
            Map.of("testId", "spoofed", "level", "DEBUG"));
        logger.close();

        Document event = Document.parse(output.toString(StandardCharsets.UTF_8).trim());
        assertEquals("T.m", event.getString("testId"));
        assertEquals("INFO", event.getString("level"));
        assertEquals("text with \"quotes\"\nand a newline", event.getString("message"));
    }

    @Test
    void appendsToLogFileAndRejectsUseAfterClose(@TempDir Path tempDir) throws Exception {
        Path logFile = tempDir.resolve("logs").resolve("approvals.jsonl");

        StructuredJsonLinesLogger first = StructuredJsonLinesLogger.appendingTo(logFile);
        first.info("one", VerificationContext.of("T.a", "verify"));
        first.close();
        StructuredJsonLinesLogger second = StructuredJsonLinesLogger.appendingTo(logFile);
        second.info("two", VerificationContext.of("T.b", "verify"));
        second.close();

        assertEquals(2, Files.readAllLines(logFile, StandardCharsets.UTF_8).size());
        assertThrows(IllegalStateException.class, () -> second.info("three", VerificationContext.of("T.c", "verify")));
    }
}
