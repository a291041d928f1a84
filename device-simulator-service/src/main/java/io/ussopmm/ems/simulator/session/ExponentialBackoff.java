package io.ussopmm.ems.simulator.session;

import java.time.Duration;
import java.util.Random;

/**
 * Reconnect delays of one session.
 * <p>
 * The first delay after a reset is exactly {@code min}. Each further delay doubles the base,
 * adds a jitter in {@code [0, jitter * base)}, is capped at {@code max} and is never shorter
 * than the previous one. Confined to the session's scheduler thread.
 */
public class ExponentialBackoff {

    private final long minMillis;
    private final long maxMillis;
    private final double jitter;
    private final Random random;

    private int attempt;
    private long lastMillis;

    public ExponentialBackoff(Duration min, Duration max, double jitter, Random random) {
        if (min.isNegative() || min.isZero() || max.compareTo(min) < 0) {
            throw new IllegalArgumentException("backoff requires 0 < min <= max, got " + min + ", " + max);
        }
        if (jitter < 0) {
            throw new IllegalArgumentException("jitter must not be negative: " + jitter);
        }
        this.minMillis = min.toMillis();
        this.maxMillis = max.toMillis();
        this.jitter = jitter;
        this.random = random;
    }

    public Duration nextDelay() {
        long delay;
        if (attempt == 0) {
            delay = minMillis;
        } else {
            long base = minMillis << Math.min(attempt, 30);
            if (base <= 0 || base > maxMillis) {
                base = maxMillis;
            }
            long withJitter = base + (long) (random.nextDouble() * jitter * base);
            delay = Math.max(lastMillis, Math.min(withJitter, maxMillis));
        }
        attempt++;
        lastMillis = delay;
        return Duration.ofMillis(delay);
    }

    public void reset() {
        attempt = 0;
        lastMillis = 0;
    }

    /** Last delay handed out, zero right after a reset. */
    public Duration currentDelay() {
        return Duration.ofMillis(lastMillis);
    }
}
