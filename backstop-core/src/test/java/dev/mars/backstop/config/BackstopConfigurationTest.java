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

import dev.mars.backstop.backoff.ConstantBackoff;
import dev.mars.backstop.backoff.ExponentialBackoff;
import dev.mars.backstop.backoff.FibonacciBackoff;
import dev.mars.backstop.backoff.LinearBackoff;
import dev.mars.backstop.circuit.CircuitBreaker;
import dev.mars.backstop.exception.ConfigurationException;
import dev.mars.backstop.retry.RetryPolicy;
import dev.mars.backstop.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BackstopConfiguration property loading, overrides and validation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
@Tag(TestCategories.CORE)
class BackstopConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("backstop.retry.max-retries");
    }

    private static Properties props(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Test
    void testDefaultProfile() {
        BackstopConfiguration config = new BackstopConfiguration("default");

        RetryPolicy policy = config.createRetryPolicy();
        assertEquals(3, policy.getMaxRetries());
        assertEquals(Set.of(429, 500, 502, 503, 504), policy.getRetryableStatuses());
        ExponentialBackoff backoff = assertInstanceOf(ExponentialBackoff.class, policy.getBackoffStrategy());
        assertEquals(Duration.ofMillis(300), backoff.getBaseDelay());
        assertTrue(policy.getTimeBudget().getMaxTotalTime().isEmpty());

        assertFalse(config.getCircuitBreakerSettings().isEnabled());
        assertTrue(config.createCircuitBreaker("orders").isEmpty());
        assertEquals(Duration.ofSeconds(10), config.getClientSettings().getTimeout());
        assertTrue(config.getClientSettings().isFollowRedirects());
    }

    @Test
    void testProfileOverridesDefaults() {
        BackstopConfiguration config = new BackstopConfiguration("test");

        assertEquals("test", config.getProfile());
        RetryPolicy policy = config.createRetryPolicy();
        assertEquals(5, policy.getMaxRetries());
        FibonacciBackoff backoff = assertInstanceOf(FibonacciBackoff.class, policy.getBackoffStrategy());
        assertEquals(Duration.ofMillis(200), backoff.getBaseDelay());
        assertEquals(Duration.ofSeconds(5), backoff.getMaxDelay());

        CircuitBreaker breaker = config.createCircuitBreaker("inventory").orElseThrow();
        assertEquals("inventory", breaker.getName());
        assertEquals(4, breaker.getConfig().getFailureThreshold());
        assertEquals(Duration.ofSeconds(30), breaker.getConfig().getRecoveryTimeout());
    }

    @Test
    void testSystemPropertiesOverrideProfile() {
        System.setProperty("backstop.retry.max-retries", "9");

        BackstopConfiguration config = new BackstopConfiguration("test");

        assertEquals(9, config.createRetryPolicy().getMaxRetries());
    }

    @Test
    void testExplicitOverridesBuildEveryStrategy() {
        LinearBackoff linear = assertInstanceOf(LinearBackoff.class, new BackstopConfiguration("default", props(
            "backstop.retry.backoff.strategy", "LINEAR",
            "backstop.retry.backoff.base-delay", "PT1S",
            "backstop.retry.backoff.increment", "PT0.5S")).createBackoffStrategy());
        assertEquals(Duration.ofSeconds(1), linear.getBaseDelay());
        assertEquals(Duration.ofMillis(500), linear.getIncrement());

        LinearBackoff defaultIncrement = assertInstanceOf(LinearBackoff.class, new BackstopConfiguration("default",
            props("backstop.retry.backoff.strategy", "linear")).createBackoffStrategy());
        assertEquals(defaultIncrement.getBaseDelay(), defaultIncrement.getIncrement());

        ConstantBackoff constant = assertInstanceOf(ConstantBackoff.class, new BackstopConfiguration("default", props(
            "backstop.retry.backoff.strategy", "constant",
            "backstop.retry.backoff.base-delay", "PT2S")).createBackoffStrategy());
        assertEquals(Duration.ofSeconds(2), constant.getDelay());
    }

    @Test
    void testTimeBudgetAndJitterSettings() {
        RetryPolicy policy = new BackstopConfiguration("default", props(
            "backstop.retry.jitter-factor", "0.25",
            "backstop.retry.status-forcelist", "503, 504",
            "backstop.retry.max-total-time", "PT30S",
            "backstop.retry.max-wait-time", "PT5S")).createRetryPolicy();

        assertEquals(0.25, policy.getJitterFactor());
        assertEquals(Set.of(503, 504), policy.getRetryableStatuses());
        assertEquals(Duration.ofSeconds(30), policy.getTimeBudget().getMaxTotalTime().orElseThrow());
        assertEquals(Duration.ofSeconds(5), policy.getTimeBudget().getMaxWaitTime().orElseThrow());
    }

    @Test
    void testUnparseableNumbersFallBackToDefaults() {
        BackstopConfiguration config = new BackstopConfiguration("default", props(
            "backstop.retry.max-retries", "lots",
            "backstop.retry.backoff.base-delay", "300ms"));

        assertEquals(3, config.createRetryPolicy().getMaxRetries());
        assertEquals(Duration.ofMillis(300), config.getRetrySettings().getBaseDelay());
    }

    @Test
    void testValidationCollectsAllErrors() {
        ConfigurationException failure = assertThrows(ConfigurationException.class,
            () -> new BackstopConfiguration("default", props(
                "backstop.retry.max-retries", "-1",
                "backstop.retry.backoff.strategy", "random",
                "backstop.retry.jitter-factor", "-0.5",
                "backstop.retry.status-forcelist", "503,abc,700",
                "backstop.retry.max-total-time", "PT0S",
                "backstop.circuit-breaker.enabled", "true",
                "backstop.circuit-breaker.failure-threshold", "0",
                "backstop.client.timeout", "PT-1S")));

        String message = failure.getMessage();
        assertTrue(message.startsWith("Configuration validation failed: "));
        assertTrue(message.contains("Max retries must be non-negative"));
        assertTrue(message.contains("Unknown backoff strategy 'random'"));
        assertTrue(message.contains("Jitter factor must be a non-negative number"));
        assertTrue(message.contains("'abc' in status-forcelist is not a number"));
        assertTrue(message.contains("Status 700 in status-forcelist is not an HTTP status"));
        assertTrue(message.contains("Max total time must be positive"));
        assertTrue(message.contains("Circuit breaker failure threshold must be at least 1"));
        assertTrue(message.contains("Client timeout must be positive"));
    }

    @Test
    void testTypedGetters() {
        BackstopConfiguration config = new BackstopConfiguration("default", props(
            "backstop.custom.flag", " true ",
            "backstop.custom.list", "a, ,b"));

        assertTrue(config.getBoolean("backstop.custom.flag", false));
        assertEquals(List.of("a", "b"), config.getList("backstop.custom.list"));
        assertEquals("fallback", config.getString("backstop.custom.missing", "fallback"));
        assertNull(config.getOptionalDuration("backstop.retry.max-wait-time"));
    }

    @Test
    void testEnvironmentOverridesDefaultsAndProfile() {
        Map<String, String> environment = Map.of(
            "BACKSTOP_RETRY_MAX_RETRIES", "7",
            "BACKSTOP_CIRCUIT_BREAKER_ENABLED", "true",
            "BACKSTOP_CIRCUIT_BREAKER_FAILURE_THRESHOLD", "2",
            "BACKSTOP_RETRY_BACKOFF_STRATEGY", "constant",
            "BACKSTOP_CLIENT_FOLLOW_REDIRECTS", "false",
            "PATH", "/usr/bin");

        BackstopConfiguration config = new BackstopConfiguration("test", new Properties(), environment);

        assertEquals(7, config.getRetrySettings().getMaxRetries());
        assertTrue(config.getCircuitBreakerSettings().isEnabled());
        assertEquals(2, config.getCircuitBreakerSettings().getFailureThreshold());
        assertInstanceOf(ConstantBackoff.class, config.createBackoffStrategy());
        assertFalse(config.getClientSettings().isFollowRedirects());
    }

    @Test
    void testSystemPropertiesOverrideEnvironment() {
        System.setProperty("backstop.retry.max-retries", "9");

        BackstopConfiguration config = new BackstopConfiguration("default", new Properties(),
            Map.of("BACKSTOP_RETRY_MAX_RETRIES", "7"));

        assertEquals(9, config.getRetrySettings().getMaxRetries());
    }

    @Test
    void testEnvironmentNamesMapToPropertyKeys() {
        assertEquals(BackstopConfiguration.RETRY_MAX_RETRIES,
            BackstopConfiguration.propertyKeyForEnv("BACKSTOP_RETRY_MAX_RETRIES"));
        assertEquals(BackstopConfiguration.CIRCUIT_BREAKER_RECOVERY_TIMEOUT,
            BackstopConfiguration.propertyKeyForEnv("BACKSTOP_CIRCUIT_BREAKER_RECOVERY_TIMEOUT"));
        assertEquals(BackstopConfiguration.RETRY_BACKOFF_STRATEGY,
            BackstopConfiguration.propertyKeyForEnv("BACKSTOP_RETRY_BACKOFF_STRATEGY"));
        assertEquals("backstop.custom.setting", BackstopConfiguration.propertyKeyForEnv("BACKSTOP_CUSTOM_SETTING"));
    }
}
