package org.approvalkit.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

/**
 * JSON-lines logger for verification events, rendered as relaxed extended JSON. Keys are emitted in
 * sorted order so that log files written by repeated runs diff cleanly.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private static final JsonWriterSettings COMPACT_RELAXED =
            JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

    private final Writer writer;
    private final Clock clock;
    private final boolean autoFlush;
    private final boolean closeUnderlying;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), true, true);
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, Clock clock, boolean autoFlush) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), clock, autoFlush, true);
    }

    public StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush) {
        this(writer, clock, autoFlush, true);
    }

    private StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush, boolean closeUnderlying) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.autoFlush = autoFlush;
        this.closeUnderlying = closeUnderlying;
    }

    /**
     * Appends to {@code logFile}, creating it and its parent directories when missing.
     */
    public static StructuredJsonLinesLogger appendingTo(Path logFile) {
        Objects.requireNonNull(logFile, "logFile");
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return new StructuredJsonLinesLogger(
                Files.newBufferedWriter(
                    logFile,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND),
                Clock.systemUTC(),
                true,
                true);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open log file " + logFile, e);
        }
    }

    /**
     * Writes to standard error without ever closing it.
     */
    public static StructuredJsonLinesLogger standardError() {
        return new StructuredJsonLinesLogger(
            new OutputStreamWriter(System.err, StandardCharsets.UTF_8), Clock.systemUTC(), true, false);
    }

    @Override
    public synchronized void log(String level, String message, VerificationContext context, Map<String, ?> fields) {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
        Objects.requireNonNull(context, "context");
        Map<String, Object> event = new TreeMap<>();
        if (fields != null) {
            fields.forEach((key, value) -> {
                if (key != null && !key.isBlank()) {
                    event.put(key, value);
                }
            });
        }
        // reserved keys win over caller fields
        event.putAll(context.asFields());
        event.put("timestamp", Instant.now(clock).toString());
        event.put("level", level == null || level.isBlank() ? "INFO" : level.trim().toUpperCase(Locale.ROOT));
        event.put("message", message == null ? "" : message);

        BsonDocument document = new BsonDocument();
        event.forEach((key, value) -> document.append(key, toBson(value)));
        writeLine(document.toJson(COMPACT_RELAXED));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            if (closeUnderlying) {
                writer.close();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }

    private void writeLine(String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    private static BsonValue toBson(Object value) {
        if (value == null) {
            return BsonNull.VALUE;
        }
        if (value instanceof Boolean flag) {
            return BsonBoolean.valueOf(flag);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new BsonInt32(((Number) value).intValue());
        }
        if (value instanceof Long number) {
            return new BsonInt64(number);
        }
        if (value instanceof Double || value instanceof Float) {
            return new BsonDouble(((Number) value).doubleValue());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((key, nested) -> sorted.put(String.valueOf(key), nested));
            BsonDocument document = new BsonDocument();
            sorted.forEach((key, nested) -> document.append(key, toBson(nested)));
            return document;
        }
        if (value instanceof Collection<?> items) {
            BsonArray array = new BsonArray();
            for (Object item : items) {
                array.add(toBson(item));
            }
            return array;
        }
        return new BsonString(String.valueOf(value));
    }
}
