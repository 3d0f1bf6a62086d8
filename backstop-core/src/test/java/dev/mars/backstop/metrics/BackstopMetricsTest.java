package dev.mars.backstop.metrics;

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

import dev.mars.backstop.circuit.CircuitBreaker;
import dev.mars.backstop.circuit.CircuitBreakerConfig;
import dev.mars.backstop.exception.RetriesExhaustedException;
import dev.mars.backstop.retry.RetryExecutor;
import dev.mars.backstop.retry.RetryOrchestrator;
import dev.mars.backstop.retry.RetryPolicy;
import dev.mars.backstop.test.categories.TestCategories;
import dev.mars.backstop.test.support.MutableClock;
import dev.mars.backstop.test.support.RecordingSleeper;
import dev.mars.backstop.test.support.ScriptedTransport;
import dev.mars.backstop.transport.RequestDescription;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BackstopMetrics against a SimpleMeterRegistry.
 */
@Tag(TestCategories.CORE)
class BackstopMetricsTest {

    private static final RequestDescription REQUEST = RequestDescription.of("GET", "https://api.example.com/stock");

    private MeterRegistry registry;
    private BackstopMetrics metrics;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new BackstopMetrics("test-instance");
        metrics.bindTo(registry);
        clock = new MutableClock();
    }

    private double counter(String name) {
        return registry.get(name).tag("instance", "test-instance").counter().count();
    }

    @Test
    void testMetersRegistered() {
        assertNotNull(registry.find("backstop.requests.attempts").counter());
        assertNotNull(registry.find("backstop.requests.retries").counter());
        assertNotNull(registry.find("backstop.requests.succeeded").counter());
        assertNotNull(registry.find("backstop.requests.failed").counter());
        assertNotNull(registry.find("backstop.requests.duration").timer());
    }

    @Test
    void testCallbacksCountAttemptsRetriesAndOutcomes() throws Exception {
        RetryPolicy policy = RetryPolicy.builder().maxRetries(2).backoffFactor(Duration.ofMillis(100)).build();
        RetryExecutor executor = new RetryExecutor(
            new RetryOrchestrator(policy, null, metrics.callbacks(), clock), new RecordingSleeper(clock));

        executor.execute(ScriptedTransport.statuses(503, 200), REQUEST);
        assertThrows(RetriesExhaustedException.class, () -> executor.execute(ScriptedTransport.statuses(500), REQUEST));

        assertEquals(5.0, counter("backstop.requests.attempts"));
        assertEquals(3.0, counter("backstop.requests.retries"));
        assertEquals(1.0, counter("backstop.requests.succeeded"));
        assertEquals(1.0, counter("backstop.requests.failed"));
        assertEquals(2, registry.get("backstop.requests.duration").timer().count());
    }

    @Test
    void testCircuitBreakerGaugeAndTransitions() {
        CircuitBreaker breaker = new CircuitBreaker("ledger", CircuitBreakerConfig.of(1, Duration.ofSeconds(10)), clock);
        metrics.bindCircuitBreaker(breaker);
        metrics.bindCircuitBreaker(breaker);

        assertEquals(0.0, registry.get("backstop.circuit.state").tag("breaker", "ledger").gauge().value());

        breaker.recordFailure(new RuntimeException("down"));
        assertEquals(1.0, registry.get("backstop.circuit.state").tag("breaker", "ledger").gauge().value());
        assertEquals(1.0, registry.get("backstop.circuit.transitions")
            .tag("breaker", "ledger").tag("to", "OPEN").counter().count());

        breaker.reset();
        assertEquals(0.0, registry.get("backstop.circuit.state").tag("breaker", "ledger").gauge().value());
        assertEquals(1, registry.find("backstop.circuit.transitions").tag("to", "OPEN").counters().size());
    }

    @Test
    void testUnboundMetricsRejectUse() {
        BackstopMetrics unbound = new BackstopMetrics("unbound");

        assertThrows(IllegalStateException.class, unbound::callbacks);
        assertThrows(IllegalStateException.class,
            () -> unbound.bindCircuitBreaker(CircuitBreaker.of("x", 1, Duration.ofSeconds(1))));
    }
}
