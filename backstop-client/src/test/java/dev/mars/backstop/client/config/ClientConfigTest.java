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

import dev.mars.backstop.backoff.FibonacciBackoff;
import dev.mars.backstop.circuit.CircuitBreaker;
import dev.mars.backstop.config.BackstopConfiguration;
import dev.mars.backstop.exception.ConfigurationException;
import dev.mars.backstop.retry.RetryPolicy;
import dev.mars.backstop.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class ClientConfigTest {

    @Test
    void testDefaults() {
        ClientConfig config = ClientConfig.defaults();

        assertEquals(Duration.ofSeconds(10), config.getTimeout());
        assertEquals(RetryPolicy.DEFAULT_MAX_RETRIES, config.getRetryPolicy().getMaxRetries());
        assertNull(config.getCircuitBreaker());
        assertTrue(config.getDefaultHeaders().isEmpty());
        assertTrue(config.isFollowRedirects());
        assertEquals(ClientConfig.DEFAULT_POOL_SIZE, config.getPoolSize());
        assertTrue(config.getCallbacks().isEmpty());
    }

    @Test
    void testRejectsNonPositiveTimeout() {
        assertThrows(ConfigurationException.class, () -> ClientConfig.builder().timeout(Duration.ZERO));
        assertThrows(ConfigurationException.class, () -> ClientConfig.builder().timeout(Duration.ofMillis(-1)));
        assertThrows(ConfigurationException.class, () -> ClientConfig.builder().poolSize(0));
    }

    @Test
    void testHeadersAreCopied() {
        ClientConfig config = ClientConfig.builder()
            .header("Accept", "application/json")
            .headers(Map.of("X-Client", "backstop"))
            .build();

        assertEquals("application/json", config.getDefaultHeaders().get("Accept"));
        assertEquals("backstop", config.getDefaultHeaders().get("X-Client"));
        assertThrows(UnsupportedOperationException.class, () -> config.getDefaultHeaders().put("X", "y"));
    }

    @Test
    void testToBuilderKeepsSettings() {
        CircuitBreaker breaker = CircuitBreaker.of("svc", 3, Duration.ofSeconds(5));
        ClientConfig original = ClientConfig.builder()
            .timeout(Duration.ofSeconds(2))
            .circuitBreaker(breaker)
            .followRedirects(false)
            .poolSize(4)
            .build();

        ClientConfig copy = original.toBuilder().header("X-Extra", "1").build();

        assertEquals(Duration.ofSeconds(2), copy.getTimeout());
        assertSame(breaker, copy.getCircuitBreaker());
        assertFalse(copy.isFollowRedirects());
        assertEquals(4, copy.getPoolSize());
        assertEquals("1", copy.getDefaultHeaders().get("X-Extra"));
        assertTrue(original.getDefaultHeaders().isEmpty());
    }

    @Test
    void testFromConfiguration() {
        Properties overrides = new Properties();
        overrides.setProperty("backstop.client.timeout", "PT3S");
        overrides.setProperty("backstop.client.follow-redirects", "false");
        overrides.setProperty("backstop.retry.max-retries", "6");
        overrides.setProperty("backstop.retry.backoff.strategy", "fibonacci");
        overrides.setProperty("backstop.circuit-breaker.enabled", "true");
        overrides.setProperty("backstop.circuit-breaker.failure-threshold", "2");

        ClientConfig config = ClientConfig.fromConfiguration(new BackstopConfiguration("default", overrides));

        assertEquals(Duration.ofSeconds(3), config.getTimeout());
        assertFalse(config.isFollowRedirects());
        assertEquals(6, config.getRetryPolicy().getMaxRetries());
        assertInstanceOf(FibonacciBackoff.class, config.getRetryPolicy().getBackoffStrategy());
        assertNotNull(config.getCircuitBreaker());
        assertEquals(ClientConfig.DEFAULT_BREAKER_NAME, config.getCircuitBreaker().getName());
        assertEquals(2, config.getCircuitBreaker().getConfig().getFailureThreshold());
    }

    @Test
    void testFromConfigurationWithoutBreaker() {
        ClientConfig config = ClientConfig.fromConfiguration(new BackstopConfiguration("default", new Properties()));

        assertNull(config.getCircuitBreaker());
        assertEquals(Duration.ofSeconds(10), config.getTimeout());
    }
}
