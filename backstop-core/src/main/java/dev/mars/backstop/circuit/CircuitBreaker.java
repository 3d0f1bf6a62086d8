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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Consecutive-failure circuit breaker shared by every call to one upstream.
 *
 * <p>State, failure counter and last-failure timestamp are read and written together under
 * a single {@link ReentrantLock}, so no caller ever sees a torn combination of the three.</p>
 *
 * <ul>
 *   <li>CLOSED: failures increment the counter; the {@code failureThreshold}-th consecutive
 *       failure opens the circuit. A success resets the counter.</li>
 *   <li>OPEN: {@link #check()} throws {@link CircuitOpenException} until
 *       {@code recoveryTimeout} has passed since the last failure, then moves to HALF_OPEN.</li>
 *   <li>HALF_OPEN: the next success closes the circuit, the next failure reopens it.</li>
 * </ul>
 *
 * <p>HALF_OPEN does not serialize trial calls: every caller arriving while the breaker is
 * HALF_OPEN is admitted, and the first outcome recorded decides the next state.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final List<CircuitStateListener> listeners;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private Instant stateTransitionTime;
    private long successfulCalls;
    private long failedCalls;
    private long ignoredFailures;
    private long rejectedCalls;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listeners = new CopyOnWriteArrayList<>(config.getListeners());
        this.stateTransitionTime = clock.instant();
    }

    public static CircuitBreaker of(String name, int failureThreshold, Duration recoveryTimeout) {
        return new CircuitBreaker(name, CircuitBreakerConfig.of(failureThreshold, recoveryTimeout));
    }

    /**
     * Gate called before each attempt.
     *
     * @throws CircuitOpenException if the circuit is OPEN and the recovery timeout has not elapsed
     */
    public void check() {
        lock.lock();
        try {
            if (state != CircuitState.OPEN) {
                return;
            }
            Duration elapsed = lastFailureTime == null
                ? config.getRecoveryTimeout()
                : Duration.between(lastFailureTime, clock.instant());
            if (elapsed.compareTo(config.getRecoveryTimeout()) < 0) {
                rejectedCalls++;
                Duration remaining = config.getRecoveryTimeout().minus(elapsed);
                logger.debug("Circuit breaker '{}' is OPEN, rejecting call ({} remaining)", name, remaining);
                throw new CircuitOpenException(name, failureCount, remaining);
            }
            transitionTo(CircuitState.HALF_OPEN);
            logger.info("Circuit breaker '{}' transitioning from OPEN to HALF_OPEN after {}", name, elapsed);
        } finally {
            lock.unlock();
        }
    }

    public void recordSuccess() {
        lock.lock();
        try {
            successfulCalls++;
            failureCount = 0;
            if (state == CircuitState.HALF_OPEN) {
                transitionTo(CircuitState.CLOSED);
                logger.info("Circuit breaker '{}' closed after successful trial call", name);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a failed call. Failures whose type is not accepted by the configured
     * exception filter are ignored.
     */
    public void recordFailure(Throwable failure) {
        if (!config.shouldRecord(failure)) {
            lock.lock();
            try {
                ignoredFailures++;
            } finally {
                lock.unlock();
            }
            logger.debug("Circuit breaker '{}' ignoring failure of type {}", name,
                failure == null ? "null" : failure.getClass().getName());
            return;
        }

        lock.lock();
        try {
            failedCalls++;
            failureCount++;
            lastFailureTime = clock.instant();
            logger.debug("Circuit breaker '{}' recorded failure ({}/{})",
                name, failureCount, config.getFailureThreshold());

            if (state == CircuitState.HALF_OPEN) {
                transitionTo(CircuitState.OPEN);
                logger.warn("Circuit breaker '{}' reopened after failed trial call ({} failures)", name, failureCount);
            } else if (state == CircuitState.CLOSED && failureCount >= config.getFailureThreshold()) {
                transitionTo(CircuitState.OPEN);
                logger.warn("Circuit breaker '{}' OPENED after {} consecutive failures", name, failureCount);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code operation} behind the breaker: checks the state, then records the outcome.
     *
     * @throws CircuitOpenException if the circuit rejects the call
     */
    public <T> T call(Supplier<T> operation) {
        check();
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException | Error e) {
            recordFailure(e);
            throw e;
        }
        recordSuccess();
        return result;
    }

    /**
     * Forces CLOSED with a zero counter. Safe to call repeatedly.
     */
    public void reset() {
        lock.lock();
        try {
            failureCount = 0;
            lastFailureTime = null;
            if (state != CircuitState.CLOSED) {
                transitionTo(CircuitState.CLOSED);
                logger.info("Circuit breaker '{}' manually reset to CLOSED", name);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Opens the circuit immediately, as if a failure had just been recorded.
     */
    public void forceOpen() {
        lock.lock();
        try {
            lastFailureTime = clock.instant();
            if (state != CircuitState.OPEN) {
                transitionTo(CircuitState.OPEN);
                logger.warn("Circuit breaker '{}' forced OPEN", name);
            }
        } finally {
            lock.unlock();
        }
    }

    public void addListener(CircuitStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastFailureTime() {
        lock.lock();
        try {
            return lastFailureTime;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(name, state, failureCount, lastFailureTime, stateTransitionTime,
                successfulCalls, failedCalls, ignoredFailures, rejectedCalls);
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    // Caller holds lock
    private void transitionTo(CircuitState newState) {
        CircuitState oldState = state;
        if (oldState == newState) {
            return;
        }
        state = newState;
        stateTransitionTime = clock.instant();
        for (CircuitStateListener listener : listeners) {
            try {
                listener.onStateChange(name, oldState, newState);
            } catch (Exception e) {
                logger.warn("Circuit breaker '{}' state listener failed on {} -> {}: {}",
                    name, oldState, newState, e.getMessage(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "CircuitBreaker{name='" + name + "', state=" + getState() + ", failureCount=" + getFailureCount() + "}";
    }
}
