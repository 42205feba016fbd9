package org.approvalkit.obs;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-capacity ring buffer of recent verification outcomes for diagnostics.
 */
public final class VerificationJournal {
    public enum Outcome {
        PASSED,
        MISMATCH,
        MISSING_APPROVED,
        REPORTER_ERROR,
        ERROR
    }

    private final int capacity;
    private final Deque<Entry> entries;
    private long nextSequence;
    private long droppedCount;

    public VerificationJournal(final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be greater than zero");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
        this.nextSequence = 1L;
        this.droppedCount = 0L;
    }

    public int capacity() {
        return capacity;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long droppedCount() {
        return droppedCount;
    }

    public synchronized List<Entry> entries() {
        return List.copyOf(entries);
    }

    public void record(final VerificationContext context, final Outcome outcome) {
        record(context, outcome, null);
    }

    public synchronized void record(
            final VerificationContext context,
            final Outcome outcome,
            final String detail) {
        final Entry entry = new Entry(
                nextSequence++,
                Objects.requireNonNull(context, "context"),
                Objects.requireNonNull(outcome, "outcome"),
                normalize(detail));

        if (entries.size() == capacity) {
            entries.removeFirst();
            droppedCount++;
        }
        entries.addLast(entry);
    }

    /**
     * Entries that did not pass, oldest first.
     */
    public synchronized List<Entry> failures() {
        return entries.stream().filter(Entry::failed).toList();
    }

    public synchronized void clear() {
        entries.clear();
        droppedCount = 0L;
    }

    private static String normalize(final String detail) {
        if (detail == null) {
            return null;
        }
        final String trimmed = detail.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Entry {
        private final long sequence;
        private final VerificationContext context;
        private final Outcome outcome;
        private final String detail;

        private Entry(
                final long sequence,
                final VerificationContext context,
                final Outcome outcome,
                final String detail) {
            this.sequence = sequence;
            this.context = context;
            this.outcome = outcome;
            this.detail = detail;
        }

        public long sequence() {
            return sequence;
        }

        public VerificationContext context() {
            return context;
        }

        public Outcome outcome() {
            return outcome;
        }

        public String detail() {
            return detail;
        }

        public boolean failed() {
            return outcome != Outcome.PASSED;
        }
    }
}
