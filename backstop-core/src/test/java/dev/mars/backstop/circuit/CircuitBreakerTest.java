package dev.mars.backstop.circuit;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.backstop.exception.CircuitOpenException;
import dev.mars.backstop.test.categories.TestCategories;
import dev.mars.backstop.test.support.MutableClock;
import dev.mars.backstop.transport.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CircuitBreaker state transitions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
@Tag(TestCategories.CORE)
class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;
    private List<String> transitions;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        transitions = new CopyOnWriteArrayList<>();
        CircuitBreakerConfig config = CircuitBreakerConfig.builder()
            .failureThreshold(2)
            .recoveryTimeout(Duration.ofSeconds(60))
            .listener((name, from, to) -> transitions.add(from + "->" + to))
            .build();
        breaker = new CircuitBreaker("orders-api", config, clock);
    }

    @Test
    void testStartsClosed() {
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
        assertNull(breaker.getLastFailureTime());
        assertDoesNotThrow(breaker::check);
    }

    @Test
    void testOpensExactlyAtThreshold() {
        breaker.recordFailure(new RuntimeException("first"));
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(1, breaker.getFailureCount());

        breaker.recordFailure(new RuntimeException("second"));
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(clock.instant(), breaker.getLastFailureTime());
        assertEquals(List.of("CLOSED->OPEN"), transitions);
    }

    @Test
    void testSuccessResetsConsecutiveCount() {
        breaker.recordFailure(new RuntimeException("one"));
        breaker.recordSuccess();
        breaker.recordFailure(new RuntimeException("two"));

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(1, breaker.getFailureCount());
    }

    @Test
    void testOpenCircuitRejectsWithRemainingTime() {
        breaker.recordFailure(new RuntimeException("a"));
        breaker.recordFailure(new RuntimeException("b"));
        clock.advance(Duration.ofSeconds(15));

        CircuitOpenException rejection = assertThrows(CircuitOpenException.class, breaker::check);

        assertEquals("orders-api", rejection.getBreakerName());
        assertEquals(2, rejection.getFailureCount());
        assertEquals(Duration.ofSeconds(45), rejection.getRemaining());
        assertEquals("Circuit breaker 'orders-api' is OPEN (failed 2 times). Retry after 45.0s", rejection.getMessage());
        assertEquals(1, breaker.snapshot().getRejectedCalls());
    }

    @Test
    void testRecoveryCycleThroughHalfOpen() {
        breaker.recordFailure(new RuntimeException("a"));
        breaker.recordFailure(new RuntimeException("b"));
        assertThrows(CircuitOpenException.class, breaker::check);

        clock.advance(Duration.ofSeconds(61));
        breaker.check();
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());

        breaker.recordSuccess();
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), transitions);
    }

    @Test
    void testFailedTrialReopens() {
        breaker.recordFailure(new RuntimeException("a"));
        breaker.recordFailure(new RuntimeException("b"));
        clock.advance(Duration.ofSeconds(60));
        breaker.check();

        breaker.recordFailure(new RuntimeException("trial"));

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertThrows(CircuitOpenException.class, breaker::check);
    }

    @Test
    void testResetIsIdempotent() {
        breaker.recordFailure(new RuntimeException("a"));
        breaker.recordFailure(new RuntimeException("b"));

        breaker.reset();
        breaker.reset();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
        assertNull(breaker.getLastFailureTime());
        assertEquals(List.of("CLOSED->OPEN", "OPEN->CLOSED"), transitions);
    }

    @Test
    void testForceOpen() {
        breaker.forceOpen();

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertThrows(CircuitOpenException.class, breaker::check);
    }

    @Test
    void testExceptionFilterIgnoresOtherFailures() {
        CircuitBreaker filtered = new CircuitBreaker("filtered", CircuitBreakerConfig.builder()
            .failureThreshold(1)
            .recoveryTimeout(Duration.ofSeconds(5))
            .recordExceptions(TransportException.class)
            .build(), clock);

        filtered.recordFailure(new IllegalStateException("not counted"));
        assertEquals(CircuitState.CLOSED, filtered.getState());
        assertEquals(1, filtered.snapshot().getIgnoredFailures());

        filtered.recordFailure(TransportException.network("refused", null));
        assertEquals(CircuitState.OPEN, filtered.getState());
    }

    @Test
    void testListenerExceptionDoesNotBreakTransition() {
        breaker.addListener((name, from, to) -> {
            throw new IllegalStateException("listener failure");
        });

        breaker.recordFailure(new RuntimeException("a"));
        breaker.recordFailure(new RuntimeException("b"));

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(List.of("CLOSED->OPEN"), transitions);
    }

    @Test
    void testCallWrapsOperation() {
        assertEquals("ok", breaker.call(() -> "ok"));

        assertThrows(IllegalStateException.class, () -> breaker.call(() -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals(1, breaker.getFailureCount());

        CircuitBreakerSnapshot snapshot = breaker.snapshot();
        assertEquals(1, snapshot.getSuccessfulCalls());
        assertEquals(1, snapshot.getFailedCalls());
        assertEquals(0.5, snapshot.getFailureRate(), 0.0001);
    }

    @Test
    void testConcurrentFailuresAreCountedExactly() throws InterruptedException {
        CircuitBreaker shared = new CircuitBreaker("shared", CircuitBreakerConfig.of(1_000, Duration.ofSeconds(5)), clock);
        AtomicInteger opened = new AtomicInteger();
        shared.addListener((name, from, to) -> {
            if (to == CircuitState.OPEN) {
                opened.incrementAndGet();
            }
        });

        int threads = 8;
        int perThread = 125;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        shared.recordFailure(new RuntimeException("concurrent"));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(threads * perThread, shared.getFailureCount());
        assertEquals(CircuitState.OPEN, shared.getState());
        assertEquals(1, opened.get());
    }

    @Test
    void testInvalidConfigRejected() {
        assertThrows(IllegalArgumentException.class, () -> CircuitBreakerConfig.of(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> CircuitBreakerConfig.of(1, Duration.ZERO));
    }
}
