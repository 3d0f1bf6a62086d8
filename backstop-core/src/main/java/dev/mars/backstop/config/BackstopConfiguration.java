package dev.mars.backstop.config;

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

import dev.mars.backstop.backoff.BackoffStrategy;
import dev.mars.backstop.backoff.ConstantBackoff;
import dev.mars.backstop.backoff.ExponentialBackoff;
import dev.mars.backstop.backoff.FibonacciBackoff;
import dev.mars.backstop.backoff.LinearBackoff;
import dev.mars.backstop.circuit.CircuitBreaker;
import dev.mars.backstop.circuit.CircuitBreakerConfig;
import dev.mars.backstop.exception.ConfigurationException;
import dev.mars.backstop.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Property-driven configuration for Backstop.
 *
 * <p>Sources, later ones winning:</p>
 * <ol>
 *   <li>{@code /backstop-default.properties}</li>
 *   <li>{@code /backstop-{profile}.properties}</li>
 *   <li>{@code BACKSTOP_*} environment variables ({@code BACKSTOP_RETRY_MAX_RETRIES})</li>
 *   <li>{@code backstop.*} system properties</li>
 *   <li>explicit overrides passed to the constructor</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class BackstopConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(BackstopConfiguration.class);

    public static final String RETRY_MAX_RETRIES = "backstop.retry.max-retries";
    public static final String RETRY_BACKOFF_STRATEGY = "backstop.retry.backoff.strategy";
    public static final String RETRY_BACKOFF_BASE_DELAY = "backstop.retry.backoff.base-delay";
    public static final String RETRY_BACKOFF_INCREMENT = "backstop.retry.backoff.increment";
    public static final String RETRY_BACKOFF_MAX_DELAY = "backstop.retry.backoff.max-delay";
    public static final String RETRY_JITTER_FACTOR = "backstop.retry.jitter-factor";
    public static final String RETRY_STATUS_FORCELIST = "backstop.retry.status-forcelist";
    public static final String RETRY_MAX_TOTAL_TIME = "backstop.retry.max-total-time";
    public static final String RETRY_MAX_WAIT_TIME = "backstop.retry.max-wait-time";
    public static final String CIRCUIT_BREAKER_ENABLED = "backstop.circuit-breaker.enabled";
    public static final String CIRCUIT_BREAKER_FAILURE_THRESHOLD = "backstop.circuit-breaker.failure-threshold";
    public static final String CIRCUIT_BREAKER_RECOVERY_TIMEOUT = "backstop.circuit-breaker.recovery-timeout";
    public static final String CLIENT_TIMEOUT = "backstop.client.timeout";
    public static final String CLIENT_FOLLOW_REDIRECTS = "backstop.client.follow-redirects";

    private static final List<String> KNOWN_KEYS = List.of(
        RETRY_MAX_RETRIES, RETRY_BACKOFF_STRATEGY, RETRY_BACKOFF_BASE_DELAY, RETRY_BACKOFF_INCREMENT,
        RETRY_BACKOFF_MAX_DELAY, RETRY_JITTER_FACTOR, RETRY_STATUS_FORCELIST, RETRY_MAX_TOTAL_TIME,
        RETRY_MAX_WAIT_TIME, CIRCUIT_BREAKER_ENABLED, CIRCUIT_BREAKER_FAILURE_THRESHOLD,
        CIRCUIT_BREAKER_RECOVERY_TIMEOUT, CLIENT_TIMEOUT, CLIENT_FOLLOW_REDIRECTS);

    private static final Set<String> STRATEGIES = Set.of("exponential", "linear", "fibonacci", "constant");

    private final Properties properties;
    private final String profile;

    public BackstopConfiguration() {
        this(getActiveProfile());
    }

    public BackstopConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Loads {@code profile} and applies {@code overrides} on top, without touching system properties.
     */
    public BackstopConfiguration(String profile, Properties overrides) {
        this(profile, overrides, System.getenv());
    }

    /**
     * As {@link #BackstopConfiguration(String, Properties)}, reading {@code BACKSTOP_*} variables
     * from {@code environment} instead of the process environment.
     */
    public BackstopConfiguration(String profile, Properties overrides, Map<String, String> environment) {
        this.profile = profile;
        this.properties = loadProperties(profile, environment != null ? environment : Map.of());
        if (overrides != null) {
            overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        }
        validateConfiguration();
        logger.info("Loaded Backstop configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("backstop.profile",
               System.getenv("BACKSTOP_PROFILE") != null ? System.getenv("BACKSTOP_PROFILE") : "default");
    }

    private Properties loadProperties(String profile, Map<String, String> environment) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/backstop-default.properties");
        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/backstop-" + profile + ".properties");
        }

        environment.forEach((key, value) -> {
            if (key.startsWith("BACKSTOP_") && !"BACKSTOP_PROFILE".equals(key)) {
                props.setProperty(propertyKeyForEnv(key), value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("backstop.") && !"backstop.profile".equals(keyStr)) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    /**
     * Maps an environment variable name onto its property key, e.g.
     * {@code BACKSTOP_RETRY_MAX_RETRIES -> backstop.retry.max-retries}. Names that match no known
     * key keep the dotted form.
     */
    static String propertyKeyForEnv(String envName) {
        String dotted = envName.toLowerCase(Locale.ROOT).replace('_', '.');
        for (String key : KNOWN_KEYS) {
            if (key.replace('-', '.').equals(dotted)) {
                return key;
            }
        }
        return dotted;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateRetryConfig(errors);
        validateCircuitBreakerConfig(errors);
        validateClientConfig(errors);

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateRetryConfig(List<String> errors) {
        if (getInt(RETRY_MAX_RETRIES, RetryPolicy.DEFAULT_MAX_RETRIES) < 0) {
            errors.add("Max retries must be non-negative");
        }

        String strategy = getStrategyName();
        if (!STRATEGIES.contains(strategy)) {
            errors.add("Unknown backoff strategy '" + strategy + "', expected one of " + new TreeSet<>(STRATEGIES));
        }

        if (getDuration(RETRY_BACKOFF_BASE_DELAY, RetryPolicy.DEFAULT_BACKOFF_FACTOR).isNegative()) {
            errors.add("Backoff base delay must be non-negative");
        }
        Duration increment = getOptionalDuration(RETRY_BACKOFF_INCREMENT);
        if (increment != null && increment.isNegative()) {
            errors.add("Backoff increment must be non-negative");
        }
        requirePositiveIfSet(RETRY_BACKOFF_MAX_DELAY, "Backoff max delay", errors);

        double jitter = getDouble(RETRY_JITTER_FACTOR, 0.0);
        if (Double.isNaN(jitter) || Double.isInfinite(jitter) || jitter < 0.0) {
            errors.add("Jitter factor must be a non-negative number");
        }

        for (String token : getList(RETRY_STATUS_FORCELIST)) {
            try {
                int status = Integer.parseInt(token);
                if (status < 100 || status > 599) {
                    errors.add("Status " + status + " in status-forcelist is not an HTTP status");
                }
            } catch (NumberFormatException e) {
                errors.add("Status '" + token + "' in status-forcelist is not a number");
            }
        }

        requirePositiveIfSet(RETRY_MAX_TOTAL_TIME, "Max total time", errors);
        requirePositiveIfSet(RETRY_MAX_WAIT_TIME, "Max wait time", errors);
    }

    private void validateCircuitBreakerConfig(List<String> errors) {
        if (getBoolean(CIRCUIT_BREAKER_ENABLED, false)) {
            if (getInt(CIRCUIT_BREAKER_FAILURE_THRESHOLD, CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD) < 1) {
                errors.add("Circuit breaker failure threshold must be at least 1");
            }
            Duration recovery = getDuration(CIRCUIT_BREAKER_RECOVERY_TIMEOUT, CircuitBreakerConfig.DEFAULT_RECOVERY_TIMEOUT);
            if (recovery.isZero() || recovery.isNegative()) {
                errors.add("Circuit breaker recovery timeout must be positive");
            }
        }
    }

    private void validateClientConfig(List<String> errors) {
        Duration timeout = getDuration(CLIENT_TIMEOUT, ClientSettings.DEFAULT_TIMEOUT);
        if (timeout.isZero() || timeout.isNegative()) {
            errors.add("Client timeout must be positive");
        }
    }

    private void requirePositiveIfSet(String key, String label, List<String> errors) {
        Duration value = getOptionalDuration(key);
        if (value != null && (value.isZero() || value.isNegative())) {
            errors.add(label + " must be positive");
        }
    }

    private String lookup(String key) {
        return properties.getProperty(key);
    }

    // Configuration getters with defaults and validation
    public String getString(String key, String defaultValue) {
        String value = lookup(key);
        return value != null ? value : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        String value = lookup(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = lookup(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid double value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = lookup(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        Duration value = getOptionalDuration(key);
        return value != null ? value : defaultValue;
    }

    /**
     * @return the parsed duration, or {@code null} when the key is absent, blank or unparseable
     */
    public Duration getOptionalDuration(String key) {
        String value = lookup(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, ignoring", key, value);
            return null;
        }
    }

    public List<String> getList(String key) {
        String value = lookup(key);
        if (value == null || value.trim().isEmpty()) {
            return Collections.emptyList();
        }
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.trim().isEmpty()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    private String getStrategyName() {
        return getString(RETRY_BACKOFF_STRATEGY, "exponential").trim().toLowerCase(Locale.ROOT);
    }

    // Specific configuration builders
    public RetrySettings getRetrySettings() {
        Set<Integer> statuses = new TreeSet<>();
        for (String token : getList(RETRY_STATUS_FORCELIST)) {
            statuses.add(Integer.parseInt(token));
        }
        Duration baseDelay = getDuration(RETRY_BACKOFF_BASE_DELAY, RetryPolicy.DEFAULT_BACKOFF_FACTOR);
        Duration increment = getOptionalDuration(RETRY_BACKOFF_INCREMENT);
        return new RetrySettings(
            getInt(RETRY_MAX_RETRIES, RetryPolicy.DEFAULT_MAX_RETRIES),
            getStrategyName(),
            baseDelay,
            increment != null ? increment : baseDelay,
            getOptionalDuration(RETRY_BACKOFF_MAX_DELAY),
            getDouble(RETRY_JITTER_FACTOR, 0.0),
            statuses,
            getOptionalDuration(RETRY_MAX_TOTAL_TIME),
            getOptionalDuration(RETRY_MAX_WAIT_TIME)
        );
    }

    public CircuitBreakerSettings getCircuitBreakerSettings() {
        return new CircuitBreakerSettings(
            getBoolean(CIRCUIT_BREAKER_ENABLED, false),
            getInt(CIRCUIT_BREAKER_FAILURE_THRESHOLD, CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD),
            getDuration(CIRCUIT_BREAKER_RECOVERY_TIMEOUT, CircuitBreakerConfig.DEFAULT_RECOVERY_TIMEOUT)
        );
    }

    public ClientSettings getClientSettings() {
        return new ClientSettings(
            getDuration(CLIENT_TIMEOUT, ClientSettings.DEFAULT_TIMEOUT),
            getBoolean(CLIENT_FOLLOW_REDIRECTS, true)
        );
    }

    public BackoffStrategy createBackoffStrategy() {
        RetrySettings retry = getRetrySettings();
        Duration maxDelay = retry.getMaxDelay();
        switch (retry.getStrategy()) {
            case "linear":
                return maxDelay != null
                    ? new LinearBackoff(retry.getBaseDelay(), retry.getIncrement(), maxDelay)
                    : new LinearBackoff(retry.getBaseDelay(), retry.getIncrement());
            case "fibonacci":
                return maxDelay != null
                    ? new FibonacciBackoff(retry.getBaseDelay(), maxDelay)
                    : new FibonacciBackoff(retry.getBaseDelay());
            case "constant":
                return maxDelay != null
                    ? new ConstantBackoff(retry.getBaseDelay(), maxDelay)
                    : new ConstantBackoff(retry.getBaseDelay());
            case "exponential":
            default:
                return maxDelay != null
                    ? new ExponentialBackoff(retry.getBaseDelay(), maxDelay)
                    : new ExponentialBackoff(retry.getBaseDelay());
        }
    }

    public RetryPolicy createRetryPolicy() {
        RetrySettings retry = getRetrySettings();
        RetryPolicy.Builder builder = RetryPolicy.builder()
            .maxRetries(retry.getMaxRetries())
            .backoffStrategy(createBackoffStrategy())
            .jitterFactor(retry.getJitterFactor())
            .retryableStatuses(retry.getStatusForcelist());
        if (retry.getMaxTotalTime() != null) {
            builder.maxTotalTime(retry.getMaxTotalTime());
        }
        if (retry.getMaxWaitTime() != null) {
            builder.maxWaitTime(retry.getMaxWaitTime());
        }
        return builder.build();
    }

    /**
     * @return a new breaker named {@code name}, or empty when the circuit breaker is disabled
     */
    public Optional<CircuitBreaker> createCircuitBreaker(String name) {
        CircuitBreakerSettings settings = getCircuitBreakerSettings();
        if (!settings.isEnabled()) {
            return Optional.empty();
        }
        return Optional.of(new CircuitBreaker(name, settings.toConfig()));
    }

    public String getProfile() {
        return profile;
    }

    // Configuration data classes
    public static class RetrySettings {
        private final int maxRetries;
        private final String strategy;
        private final Duration baseDelay;
        private final Duration increment;
        private final Duration maxDelay;
        private final double jitterFactor;
        private final Set<Integer> statusForcelist;
        private final Duration maxTotalTime;
        private final Duration maxWaitTime;

        public RetrySettings(int maxRetries, String strategy, Duration baseDelay, Duration increment,
                             Duration maxDelay, double jitterFactor, Set<Integer> statusForcelist,
                             Duration maxTotalTime, Duration maxWaitTime) {
            this.maxRetries = maxRetries;
            this.strategy = strategy;
            this.baseDelay = baseDelay;
            this.increment = increment;
            this.maxDelay = maxDelay;
            this.jitterFactor = jitterFactor;
            this.statusForcelist = Collections.unmodifiableSet(new TreeSet<>(statusForcelist));
            this.maxTotalTime = maxTotalTime;
            this.maxWaitTime = maxWaitTime;
        }

        public int getMaxRetries() { return maxRetries; }
        public String getStrategy() { return strategy; }
        public Duration getBaseDelay() { return baseDelay; }
        public Duration getIncrement() { return increment; }
        public Duration getMaxDelay() { return maxDelay; }
        public double getJitterFactor() { return jitterFactor; }
        public Set<Integer> getStatusForcelist() { return statusForcelist; }
        public Duration getMaxTotalTime() { return maxTotalTime; }
        public Duration getMaxWaitTime() { return maxWaitTime; }
    }

    public static class CircuitBreakerSettings {
        private final boolean enabled;
        private final int failureThreshold;
        private final Duration recoveryTimeout;

        public CircuitBreakerSettings(boolean enabled, int failureThreshold, Duration recoveryTimeout) {
            this.enabled = enabled;
            this.failureThreshold = failureThreshold;
            this.recoveryTimeout = recoveryTimeout;
        }

        public CircuitBreakerConfig toConfig() {
            return CircuitBreakerConfig.of(failureThreshold, recoveryTimeout);
        }

        public boolean isEnabled() { return enabled; }
        public int getFailureThreshold() { return failureThreshold; }
        public Duration getRecoveryTimeout() { return recoveryTimeout; }
    }

    public static class ClientSettings {
        public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

        private final Duration timeout;
        private final boolean followRedirects;

        public ClientSettings(Duration timeout, boolean followRedirects) {
            this.timeout = timeout;
            this.followRedirects = followRedirects;
        }

        public Duration getTimeout() { return timeout; }
        public boolean isFollowRedirects() { return followRedirects; }
    }
}
