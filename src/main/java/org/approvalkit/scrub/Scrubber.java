package org.approvalkit.scrub;

import java.util.Objects;

/**
 * Normalises volatile content in received text before it is written and compared.
 *
 * <p>Implementations must be pure and idempotent: scrubbing already scrubbed text returns it unchanged.
 */
@FunctionalInterface
public interface Scrubber {
    String scrub(String text);

    default Scrubber andThen(final Scrubber next) {
        Objects.requireNonNull(next, "next");
        return text -> next.scrub(scrub(text));
    }

    static Scrubber identity() {
        return text -> text;
    }
}
