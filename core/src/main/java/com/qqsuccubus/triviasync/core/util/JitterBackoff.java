package com.qqsuccubus.triviasync.core.util;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff used for resubscribes, reconnects and remote state calls.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 * <p>
 * Jitter spreads out the retries of many clients that lost the transport at the same moment.
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the next backoff delay with jitter.
     *
     * @param attempt   Retry attempt number (0-based)
     * @param base      Base delay
     * @param max       Maximum delay (cap)
     * @param jitterMax Maximum jitter to add
     * @return Computed delay (base * 2^attempt capped at max, plus jitter)
     */
    public static Duration next(int attempt, Duration base, Duration max, Duration jitterMax) {
        long baseMs = base.toMillis();
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0), 20)); // Cap exponent to avoid overflow

        long cappedMs = Math.min(expMs, max.toMillis());

        long jitterMs = jitterMax.isZero() ? 0 : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);

        return Duration.ofMillis(cappedMs + jitterMs);
    }

    /**
     * Reconnect delay with default parameters (base=3s, max=30s, jitter=1s).
     *
     * @param attempt Retry attempt number (0-based)
     * @return Computed delay
     */
    public static Duration next(int attempt) {
        return next(
                attempt,
                Duration.ofSeconds(3),   // base
                Duration.ofSeconds(30),  // max
                Duration.ofSeconds(1)    // jitterMax
        );
    }

    /**
     * Builds a Reactor {@link Retry} that waits {@link #next(int, Duration, Duration, Duration)}
     * between attempts on the given scheduler and gives up after {@code maxRetries}.
     *
     * @param maxRetries Maximum number of retries after the first failure
     * @param base       Base delay
     * @param max        Maximum delay (cap)
     * @param jitterMax  Maximum jitter to add
     * @param scheduler  Scheduler the delays run on
     * @return Retry strategy; the last failure is propagated once retries are exhausted
     */
    public static Retry retry(int maxRetries, Duration base, Duration max, Duration jitterMax, Scheduler scheduler) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            long attempt = signal.totalRetries();
            if (attempt >= maxRetries) {
                return Mono.error(signal.failure());
            }
            return Mono.delay(next((int) attempt, base, max, jitterMax), scheduler);
        }));
    }
}
