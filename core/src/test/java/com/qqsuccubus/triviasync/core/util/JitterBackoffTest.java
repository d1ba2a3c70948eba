package com.qqsuccubus.triviasync.core.util;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JitterBackoffTest {

    @Test
    void testNext_DoublesUntilCap() {
        Duration base = Duration.ofSeconds(1);
        Duration max = Duration.ofSeconds(30);

        assertEquals(Duration.ofSeconds(1), JitterBackoff.next(0, base, max, Duration.ZERO));
        assertEquals(Duration.ofSeconds(4), JitterBackoff.next(2, base, max, Duration.ZERO));
        assertEquals(Duration.ofSeconds(30), JitterBackoff.next(5, base, max, Duration.ZERO));
        assertEquals(Duration.ofSeconds(30), JitterBackoff.next(60, base, max, Duration.ZERO));
    }

    @Test
    void testNext_JitterStaysWithinBound() {
        for (int i = 0; i < 200; i++) {
            long ms = JitterBackoff.next(1).toMillis();
            assertTrue(ms >= 6_000 && ms <= 7_000, "delay " + ms);
        }
    }

    @Test
    void testRetry_GivesUpAfterMaxRetries() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> failing = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new IllegalStateException("boom"));
        });

        StepVerifier.withVirtualTime(() -> failing.retryWhen(JitterBackoff.retry(2, Duration.ofSeconds(1),
                Duration.ofSeconds(10), Duration.ZERO, scheduler)), () -> scheduler, Long.MAX_VALUE)
            .thenAwait(Duration.ofSeconds(1))
            .then(() -> assertEquals(2, attempts.get()))
            .thenAwait(Duration.ofSeconds(2))
            .expectErrorMessage("boom")
            .verify();

        assertEquals(3, attempts.get());
        scheduler.dispose();
    }

    @Test
    void testRetry_SucceedsOnLaterAttempt() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> flaky = Mono.defer(() -> attempts.incrementAndGet() < 3
            ? Mono.error(new IllegalStateException("not yet"))
            : Mono.just("ok"));

        StepVerifier.withVirtualTime(() -> flaky.retryWhen(JitterBackoff.retry(5, Duration.ofMillis(100),
                Duration.ofSeconds(1), Duration.ZERO, scheduler)), () -> scheduler, Long.MAX_VALUE)
            .thenAwait(Duration.ofSeconds(1))
            .expectNext("ok")
            .verifyComplete();

        scheduler.dispose();
    }
}
