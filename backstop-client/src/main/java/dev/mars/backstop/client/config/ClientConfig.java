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

package dev.mars.backstop.client.config;

import dev.mars.backstop.callback.RetryCallbacks;
import dev.mars.backstop.circuit.CircuitBreaker;
import dev.mars.backstop.config.BackstopConfiguration;
import dev.mars.backstop.exception.ConfigurationException;
import dev.mars.backstop.retry.RetryPolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration shared by {@code ResilientHttpClient} and {@code AsyncResilientHttpClient}.
 *
 * <p>Example usage:
 * <pre>{@code
 * ClientConfig config = ClientConfig.builder()
 *     .timeout(Duration.ofSeconds(5))
 *     .retryPolicy(RetryPolicy.builder().maxRetries(5).build())
 *     .circuitBreaker(registry.circuitBreaker("catalog"))
 *     .header("Accept", "application/json")
 *     .build();
 * }</pre>
 */
public final class ClientConfig {

    /** Default client name used for a breaker created from configuration */
    public static final String DEFAULT_BREAKER_NAME = "backstop-client";

    /** Default maximum HTTP/1 connections per host for the async client */
    public static final int DEFAULT_POOL_SIZE = 10;

    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final RetryCallbacks callbacks;
    private final CircuitBreaker circuitBreaker;
    private final Map<String, String> defaultHeaders;
    private final boolean followRedirects;
    private final int poolSize;

    private ClientConfig(Builder builder) {
        this.timeout = builder.timeout;
        this.retryPolicy = builder.retryPolicy;
        this.callbacks = builder.callbacks;
        this.circuitBreaker = builder.circuitBreaker;
        this.defaultHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultHeaders));
        this.followRedirects = builder.followRedirects;
        this.poolSize = builder.poolSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    /**
     * Builds a config from {@code backstop.client.*}, {@code backstop.retry.*} and
     * {@code backstop.circuit-breaker.*} properties.
     */
    public static ClientConfig fromConfiguration(BackstopConfiguration configuration) {
        BackstopConfiguration.ClientSettings client = configuration.getClientSettings();
        return builder()
            .timeout(client.getTimeout())
            .followRedirects(client.isFollowRedirects())
            .retryPolicy(configuration.createRetryPolicy())
            .circuitBreaker(configuration.createCircuitBreaker(DEFAULT_BREAKER_NAME).orElse(null))
            .build();
    }

    /** Returns the per-attempt request timeout */
    public Duration getTimeout() { return timeout; }

    public RetryPolicy getRetryPolicy() { return retryPolicy; }

    public RetryCallbacks getCallbacks() { return callbacks; }

    /** Returns the shared circuit breaker, or null if none is configured */
    public CircuitBreaker getCircuitBreaker() { return circuitBreaker; }

    public Map<String, String> getDefaultHeaders() { return defaultHeaders; }

    public boolean isFollowRedirects() { return followRedirects; }

    public int getPoolSize() { return poolSize; }

    public Builder toBuilder() {
        return builder()
            .timeout(timeout)
            .retryPolicy(retryPolicy)
            .callbacks(callbacks)
            .circuitBreaker(circuitBreaker)
            .headers(defaultHeaders)
            .followRedirects(followRedirects)
            .poolSize(poolSize);
    }

    @Override
    public String toString() {
        return "ClientConfig{" +
                "timeout=" + timeout +
                ", retryPolicy=" + retryPolicy +
                ", circuitBreaker=" + (circuitBreaker != null ? circuitBreaker.getName() : "none") +
                ", defaultHeaders=" + defaultHeaders.keySet() +
                ", followRedirects=" + followRedirects +
                ", poolSize=" + poolSize +
                '}';
    }

    public static final class Builder {
        private Duration timeout = BackstopConfiguration.ClientSettings.DEFAULT_TIMEOUT;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private RetryCallbacks callbacks = RetryCallbacks.none();
        private CircuitBreaker circuitBreaker;
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
        private boolean followRedirects = true;
        private int poolSize = DEFAULT_POOL_SIZE;

        private Builder() {
        }

        public Builder timeout(Duration timeout) {
            this.timeout = ConfigurationException.requirePositive(timeout, "timeout");
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
            return this;
        }

        public Builder callbacks(RetryCallbacks callbacks) {
            this.callbacks = callbacks != null ? callbacks : RetryCallbacks.none();
            return this;
        }

        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder header(String name, String value) {
            defaultHeaders.put(Objects.requireNonNull(name, "header name must not be null"),
                Objects.requireNonNull(value, "header value must not be null"));
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            headers.forEach(this::header);
            return this;
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public Builder poolSize(int poolSize) {
            if (poolSize < 1) {
                throw new ConfigurationException("poolSize must be at least 1, got " + poolSize);
            }
            this.poolSize = poolSize;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
