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

import dev.mars.backstop.callback.FailureInfo;
import dev.mars.backstop.callback.RetryCallbacks;
import dev.mars.backstop.callback.SuccessInfo;
import dev.mars.backstop.circuit.CircuitBreaker;
import dev.mars.backstop.circuit.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer meters for retry executions and circuit breakers.
 *
 * <pre>{@code
 * BackstopMetrics metrics = new BackstopMetrics("orders-api");
 * metrics.bindTo(registry);
 * metrics.bindCircuitBreaker(breaker);
 * RetryExecutor executor = new RetryExecutor(policy, breaker, metrics.callbacks());
 * }</pre>
 *
 * <p>The circuit state gauge reports the {@link CircuitState} ordinal: 0 closed, 1 open, 2 half-open.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class BackstopMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(BackstopMetrics.class);

    private final String instanceId;
    private final Set<String> boundBreakers = ConcurrentHashMap.newKeySet();
    private MeterRegistry registry;

    // Counters
    private Counter attempts;
    private Counter retries;
    private Counter succeeded;
    private Counter failed;

    // Timers
    private Timer duration;

    public BackstopMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        attempts = Counter.builder("backstop.requests.attempts")
            .description("Total number of transport attempts")
            .tag("instance", instanceId)
            .register(registry);

        retries = Counter.builder("backstop.requests.retries")
            .description("Total number of scheduled retries")
            .tag("instance", instanceId)
            .register(registry);

        succeeded = Counter.builder("backstop.requests.succeeded")
            .description("Total number of calls that returned a successful response")
            .tag("instance", instanceId)
            .register(registry);

        failed = Counter.builder("backstop.requests.failed")
            .description("Total number of calls that ended in a resilience failure")
            .tag("instance", instanceId)
            .register(registry);

        duration = Timer.builder("backstop.requests.duration")
            .description("Total time per call, retries and backoff included")
            .tag("instance", instanceId)
            .register(registry);

        logger.debug("Backstop metrics bound for instance {}", instanceId);
    }

    /**
     * Registers a state gauge and a transition counter for {@code breaker}. Binding the same
     * breaker name twice is a no-op.
     */
    public void bindCircuitBreaker(CircuitBreaker breaker) {
        if (registry == null) {
            throw new IllegalStateException("bindTo(MeterRegistry) must be called before binding circuit breakers");
        }
        if (!boundBreakers.add(breaker.getName())) {
            return;
        }

        Gauge.builder("backstop.circuit.state", breaker, b -> b.getState().ordinal())
            .description("Circuit breaker state (0 closed, 1 open, 2 half-open)")
            .tag("instance", instanceId)
            .tag("breaker", breaker.getName())
            .strongReference(true)
            .register(registry);

        breaker.addListener((name, from, to) -> Counter.builder("backstop.circuit.transitions")
            .description("Circuit breaker state transitions")
            .tag("instance", instanceId)
            .tag("breaker", name)
            .tag("to", to.name())
            .register(registry)
            .increment());
    }

    /**
     * @return callbacks that feed the request meters; combine with others via {@link RetryCallbacks#andThen}
     */
    public RetryCallbacks callbacks() {
        if (registry == null) {
            throw new IllegalStateException("bindTo(MeterRegistry) must be called before creating callbacks");
        }
        return RetryCallbacks.builder()
            .onRequest(info -> attempts.increment())
            .onRetry(info -> retries.increment())
            .onSuccess(this::recordSuccess)
            .onFailure(this::recordFailure)
            .build();
    }

    private void recordSuccess(SuccessInfo info) {
        succeeded.increment();
        duration.record(info.totalTime());
    }

    private void recordFailure(FailureInfo info) {
        failed.increment();
        duration.record(info.totalTime());
    }

    public String getInstanceId() {
        return instanceId;
    }
}
