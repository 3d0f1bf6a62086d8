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

import dev.mars.backstop.exception.ConfigurationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable settings for a {@link CircuitBreaker}.
 *
 * <p>Example:</p>
 * <pre>{@code
 * CircuitBreakerConfig config = CircuitBreakerConfig.builder()
 *     .failureThreshold(5)
 *     .recoveryTimeout(Duration.ofSeconds(60))
 *     .recordExceptions(TransportException.class, HttpStatusException.class)
 *     .listener((name, from, to) -> logger.info("{}: {} -> {}", name, from, to))
 *     .build();
 * }</pre>
 */
public final class CircuitBreakerConfig {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(60);

    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final List<Class<? extends Throwable>> recordExceptions;
    private final List<CircuitStateListener> listeners;

    private CircuitBreakerConfig(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.recoveryTimeout = builder.recoveryTimeout;
        this.recordExceptions = Collections.unmodifiableList(new ArrayList<>(builder.recordExceptions));
        this.listeners = Collections.unmodifiableList(new ArrayList<>(builder.listeners));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CircuitBreakerConfig defaults() {
        return builder().build();
    }

    public static CircuitBreakerConfig of(int failureThreshold, Duration recoveryTimeout) {
        return builder().failureThreshold(failureThreshold).recoveryTimeout(recoveryTimeout).build();
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }

    /**
     * @return exception types that count as failures; empty means every failure counts
     */
    public List<Class<? extends Throwable>> getRecordExceptions() {
        return recordExceptions;
    }

    public List<CircuitStateListener> getListeners() {
        return listeners;
    }

    /**
     * Whether {@code failure} should move the consecutive-failure counter.
     */
    public boolean shouldRecord(Throwable failure) {
        if (recordExceptions.isEmpty()) {
            return true;
        }
        for (Class<? extends Throwable> type : recordExceptions) {
            if (type.isInstance(failure)) {
                return true;
            }
        }
        return false;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .failureThreshold(failureThreshold)
            .recoveryTimeout(recoveryTimeout);
        builder.recordExceptions.addAll(recordExceptions);
        builder.listeners.addAll(listeners);
        return builder;
    }

    @Override
    public String toString() {
        return "CircuitBreakerConfig{" +
                "failureThreshold=" + failureThreshold +
                ", recoveryTimeout=" + recoveryTimeout +
                ", recordExceptions=" + recordExceptions +
                ", listeners=" + listeners.size() +
                '}';
    }

    public static final class Builder {
        private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
        private Duration recoveryTimeout = DEFAULT_RECOVERY_TIMEOUT;
        private final List<Class<? extends Throwable>> recordExceptions = new ArrayList<>();
        private final List<CircuitStateListener> listeners = new ArrayList<>();

        private Builder() {
        }

        public Builder failureThreshold(int failureThreshold) {
            if (failureThreshold <= 0) {
                throw new ConfigurationException("failureThreshold must be positive, got " + failureThreshold);
            }
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder recoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = ConfigurationException.requirePositive(recoveryTimeout, "recoveryTimeout");
            return this;
        }

        @SafeVarargs
        public final Builder recordExceptions(Class<? extends Throwable>... types) {
            for (Class<? extends Throwable> type : types) {
                recordExceptions.add(Objects.requireNonNull(type, "exception type must not be null"));
            }
            return this;
        }

        public Builder listener(CircuitStateListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        public CircuitBreakerConfig build() {
            return new CircuitBreakerConfig(this);
        }
    }
}
