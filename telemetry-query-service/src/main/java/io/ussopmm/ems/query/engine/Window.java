package io.ussopmm.ems.query.engine;

import java.time.Instant;
import java.util.Objects;

/**
 * Inclusive time window {@code [from, to]}. A window with {@code from == to} covers one instant.
 * Bounds are checked when the window is queried, see {@link QueryEngine#series}.
 */
public record Window(Instant from, Instant to) {

    public Window {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public boolean isInverted() {
        return from.isAfter(to);
    }
}
