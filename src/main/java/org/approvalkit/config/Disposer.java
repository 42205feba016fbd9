package org.approvalkit.config;

import java.util.Objects;

/**
 * Scoped override of one default. Closing it restores the value that was in force before the override.
 *
 * <p>Disposers must be closed in reverse order of creation, which try-with-resources does naturally.
 * Closing one that is not the most recent open override throws {@link ConfigurationStackException} and
 * changes nothing. Closing twice is a no-op.
 */
public final class Disposer implements AutoCloseable {
    public enum Axis {
        NAMER,
        REPORTER,
        FRONT_LOADED_REPORTER,
        SUBDIRECTORY,
        COMPARATOR
    }

    private final ApprovalsConfiguration owner;
    private final Axis axis;
    private final String description;
    private final Runnable restore;
    private volatile boolean released;

    Disposer(final ApprovalsConfiguration owner, final Axis axis, final String description, final Runnable restore) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.axis = Objects.requireNonNull(axis, "axis");
        this.description = Objects.requireNonNull(description, "description");
        this.restore = Objects.requireNonNull(restore, "restore");
    }

    public Axis axis() {
        return axis;
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void close() {
        owner.release(this);
    }

    void restore() {
        restore.run();
        released = true;
    }

    @Override
    public String toString() {
        return axis + "(" + description + ")";
    }
}
