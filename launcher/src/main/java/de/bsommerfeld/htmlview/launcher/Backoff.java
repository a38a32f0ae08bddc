package de.bsommerfeld.htmlview.launcher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Exponential backoff schedule: starts at {@code initial}, doubles after every
 * attempt and never exceeds {@code max}.
 *
 * <p>
 * With {@code 10ms / 1000ms / 10} the schedule is
 * {@code [10, 20, 40, 80, 160, 320, 640, 1000, 1000, 1000]}. Callers sleep
 * only <em>between</em> attempts, so the final entry is never waited for.
 *
 * @param initial     delay after the first failed attempt
 * @param max         upper bound for any single delay
 * @param maxAttempts number of attempts, {@link #UNBOUNDED} for deadline-driven polls
 */
public record Backoff(Duration initial, Duration max, int maxAttempts) {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    /** Result-file retrieval: 10 attempts, 10 ms doubling to 1 s. */
    public static final Backoff RESULT_READ = new Backoff(Duration.ofMillis(10), Duration.ofMillis(1000), 10);

    /** Command-response polling, bounded by a deadline instead of an attempt count. */
    public static final Backoff COMMAND_POLL = new Backoff(Duration.ofMillis(10), Duration.ofMillis(100), UNBOUNDED);

    public Backoff {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(max, "max");
        if (initial.isNegative() || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Backoff requires 0 <= initial <= max, got " + initial + " / " + max);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
    }

    /** Delay to apply after the given zero-based attempt failed. */
    public Duration delayForAttempt(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative: " + attempt);
        }
        Duration delay = initial;
        for (int i = 0; i < attempt && delay.compareTo(max) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(max) > 0 ? max : delay;
    }

    public boolean isBounded() {
        return maxAttempts != UNBOUNDED;
    }

    /** The full schedule, one entry per attempt. */
    public List<Duration> delays() {
        if (!isBounded()) {
            throw new IllegalStateException("Unbounded backoff has no finite schedule");
        }
        List<Duration> delays = new ArrayList<>(maxAttempts);
        for (int i = 0; i < maxAttempts; i++) {
            delays.add(delayForAttempt(i));
        }
        return delays;
    }

    /** Sum of {@link #delays()}. */
    public Duration total() {
        return delays().stream().reduce(Duration.ZERO, Duration::plus);
    }

    public Backoff withMaxAttempts(int maxAttempts) {
        return new Backoff(initial, max, maxAttempts);
    }
}
