package io.github.yok.timesheetlink.util;

import io.github.yok.timesheetlink.exception.ParseCancelledException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal passed explicitly through every parse and validation call.
 *
 * <p>
 * A token is cancelled either by {@link #cancel()} (typically from another thread) or by reaching
 * its optional deadline. Workers call {@link #throwIfCancelled()} at entry points and between rows;
 * nothing is interrupted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CancellationToken {

    /**
     * Token that is never cancelled. {@link #cancel()} is not supported on it.
     */
    public static final CancellationToken NONE = new CancellationToken(null, null, false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    // Clock used to evaluate the deadline; null when no deadline is set
    private final Clock clock;

    // Instant after which the token counts as cancelled; null when no deadline is set
    private final Instant deadline;

    private final boolean cancellable;

    private CancellationToken(Clock clock, Instant deadline, boolean cancellable) {
        this.clock = clock;
        this.deadline = deadline;
        this.cancellable = cancellable;
    }

    /**
     * Creates a token that is cancelled only through {@link #cancel()}.
     *
     * @return new token
     */
    public static CancellationToken create() {
        return new CancellationToken(null, null, true);
    }

    /**
     * Creates a token that is also cancelled once {@code timeout} has elapsed on {@code clock}.
     *
     * @param clock clock used to evaluate the deadline
     * @param timeout time budget starting now
     * @return new token
     */
    public static CancellationToken withTimeout(Clock clock, Duration timeout) {
        return new CancellationToken(clock, clock.instant().plus(timeout), true);
    }

    /**
     * Requests cancellation. Idempotent.
     *
     * @throws UnsupportedOperationException when called on {@link #NONE}
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("The shared NONE token cannot be cancelled");
        }
        cancelled.set(true);
    }

    /**
     * Returns whether cancellation was requested or the deadline has passed.
     *
     * @return {@code true} when work should stop
     */
    public boolean isCancelled() {
        return cancelled.get() || deadlineExceeded();
    }

    /**
     * Throws {@link ParseCancelledException} when the token is cancelled.
     *
     * @throws ParseCancelledException if cancellation was requested or the deadline passed
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new ParseCancelledException("operation cancelled");
        }
        if (deadlineExceeded()) {
            throw new ParseCancelledException("operation deadline exceeded");
        }
    }

    private boolean deadlineExceeded() {
        return deadline != null && clock.instant().isAfter(deadline);
    }
}
