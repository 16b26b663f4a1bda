package com.yearlylikes.processor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and deadline for a single processor run.
 * <p>
 * Processors call {@link #checkpoint()} between pages and batches, so a cancelled run stops
 * before the next remote call rather than in the middle of one.
 */
public final class RunContext {

    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private RunContext(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /** A context that is never past its deadline; it can still be cancelled. */
    public static RunContext unbounded() {
        return new RunContext(null, Clock.systemUTC());
    }

    public static RunContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static RunContext withTimeout(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a non-negative duration");
        }
        return new RunContext(clock.instant().plus(timeout), clock);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isDone() {
        return cancelled.get()
                || Thread.currentThread().isInterrupted()
                || (deadline != null && !clock.instant().isBefore(deadline));
    }

    public void checkpoint() throws RunCancelledException {
        if (cancelled.get()) {
            throw new RunCancelledException("Run was cancelled");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new RunCancelledException("Run was interrupted");
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new RunCancelledException("Run deadline of " + deadline + " exceeded");
        }
    }
}
