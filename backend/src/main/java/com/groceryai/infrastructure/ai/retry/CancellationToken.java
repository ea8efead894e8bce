package com.groceryai.infrastructure.ai.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative cancellation for a retry loop: a manual cancel flag plus an optional deadline.
 * Safe to cancel from another thread.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(null, Clock.systemUTC());

    private final Instant deadline;
    private final Clock clock;
    private volatile boolean cancelled;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * A token that is never cancelled. Calling {@link #cancel()} on it has no effect.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    public static CancellationToken withDeadline(Duration timeout) {
        return withDeadline(timeout, Clock.systemUTC());
    }

    public static CancellationToken withDeadline(Duration timeout, Clock clock) {
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    public void cancel() {
        if (this != NONE) {
            cancelled = true;
        }
    }

    public boolean isCancelled() {
        return cancelled || (deadline != null && !clock.instant().isBefore(deadline));
    }

    /**
     * Time left until the deadline, or null when there is no deadline.
     */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Whether sleeping for the given duration would end past the deadline.
     */
    public boolean wouldExceedDeadline(Duration sleep) {
        Duration left = remaining();
        return left != null && sleep.compareTo(left) > 0;
    }
}
