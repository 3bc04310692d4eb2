// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Cooperative cancellation for block queries.
 *
 * <p>
 * The resolver polls the signal before each chain client call. A call already in flight
 * is not interrupted; once the signal reports cancelled, the next check raises
 * {@link sh.strata.core.error.QueryCancelledException}.
 *
 * <pre>{@code
 * BlockRecord block = resolver.getBlockByNumber(950, CancellationSignal.deadline(Duration.ofSeconds(2)));
 * }</pre>
 */
@FunctionalInterface
public interface CancellationSignal {

    /**
     * Returns whether the query should stop.
     *
     * @return true once cancelled
     */
    boolean isCancelled();

    /**
     * Returns a signal that never cancels.
     *
     * @return the no-op signal
     */
    static CancellationSignal none() {
        return NeverCancelled.INSTANCE;
    }

    /**
     * Returns a signal that cancels once {@code timeout} has elapsed from now.
     *
     * @param timeout the time budget
     * @return a deadline signal
     */
    static CancellationSignal deadline(Duration timeout) {
        return deadline(timeout, Clock.systemUTC());
    }

    /**
     * Returns a signal that cancels once {@code timeout} has elapsed on {@code clock}.
     *
     * @param timeout the time budget
     * @param clock   the clock to measure against
     * @return a deadline signal
     */
    static CancellationSignal deadline(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(clock, "clock");
        Instant deadline = deadlineAfter(clock.instant(), timeout);
        return () -> !clock.instant().isBefore(deadline);
    }

    // clamps to the Instant range instead of overflowing
    private static Instant deadlineAfter(Instant start, Duration timeout) {
        try {
            return start.plus(timeout);
        } catch (DateTimeException | ArithmeticException e) {
            return timeout.isNegative() ? Instant.MIN : Instant.MAX;
        }
    }

    /**
     * Adapts a boolean supplier, for example {@code Thread.currentThread()::isInterrupted}
     * or an {@code AtomicBoolean::get}.
     *
     * @param cancelled returns true once the query should stop
     * @return the adapted signal
     */
    static CancellationSignal of(BooleanSupplier cancelled) {
        Objects.requireNonNull(cancelled, "cancelled");
        return cancelled::getAsBoolean;
    }
}

enum NeverCancelled implements CancellationSignal {
    INSTANCE;

    @Override
    public boolean isCancelled() {
        return false;
    }
}
