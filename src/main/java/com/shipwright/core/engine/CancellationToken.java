package com.shipwright.core.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation for one attempt: an explicit {@link #cancel(String)}
 * plus an optional absolute deadline. Waits return early as soon as either fires.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final Instant deadline;
    private final Clock clock;

    public CancellationToken(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static CancellationToken none(Clock clock) {
        return new CancellationToken(clock, null);
    }

    public static CancellationToken withTimeout(Clock clock, Duration timeout) {
        return new CancellationToken(clock, timeout != null ? clock.instant().plus(timeout) : null);
    }

    public void cancel(String why) {
        if (reason.compareAndSet(null, why)) {
            cancelled.countDown();
        }
    }

    public boolean isCancelled() {
        return reason.get() != null || deadlineExceeded();
    }

    public boolean deadlineExceeded() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Why the attempt was stopped, if it was.
     */
    public Optional<String> reason() {
        String explicit = reason.get();
        if (explicit != null) {
            return Optional.of(explicit);
        }
        return deadlineExceeded() ? Optional.of("attempt deadline exceeded") : Optional.empty();
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Waits up to {@code timeout}, capped at the deadline.
     *
     * @return {@code true} if the full wait elapsed, {@code false} if cancelled first
     */
    public boolean await(Duration timeout) {
        Duration wait = timeout;
        if (deadline != null) {
            Duration untilDeadline = Duration.between(clock.instant(), deadline);
            if (untilDeadline.compareTo(wait) < 0) {
                wait = untilDeadline.isNegative() ? Duration.ZERO : untilDeadline;
            }
        }
        try {
            if (cancelled.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel("interrupted");
            return false;
        }
        return !isCancelled();
    }
}
