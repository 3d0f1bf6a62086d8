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

import dev.mars.backstop.test.categories.TestCategories;
import dev.mars.backstop.test.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class CircuitBreakerRegistryTest {

    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CircuitBreakerRegistry(CircuitBreakerConfig.of(3, Duration.ofSeconds(30)), new MutableClock());
    }

    @Test
    void testSameNameSharesOneBreaker() {
        CircuitBreaker first = registry.circuitBreaker("payments");
        CircuitBreaker second = registry.circuitBreaker("payments");

        assertSame(first, second);
        assertEquals(3, first.getConfig().getFailureThreshold());
        assertEquals(Set.of("payments"), registry.names());
    }

    @Test
    void testFindDoesNotCreate() {
        assertTrue(registry.find("missing").isEmpty());
        registry.circuitBreaker("present");
        assertTrue(registry.find("present").isPresent());
        assertFalse(registry.names().contains("missing"));
    }

    @Test
    void testCreationHookAppliesToExistingAndNewBreakers() {
        registry.circuitBreaker("existing");
        List<String> seen = new ArrayList<>();

        registry.onCreate(breaker -> seen.add(breaker.getName()));
        registry.circuitBreaker("created-later");

        assertEquals(List.of("existing", "created-later"), seen);
    }

    @Test
    void testManualControls() {
        registry.forceOpen("inventory");
        assertTrue(registry.find("inventory").isEmpty());

        CircuitBreaker inventory = registry.circuitBreaker("inventory");
        registry.forceOpen("inventory");
        assertEquals(CircuitState.OPEN, inventory.getState());

        registry.reset("inventory");
        assertEquals(CircuitState.CLOSED, inventory.getState());

        CircuitBreaker shipping = registry.circuitBreaker("shipping");
        shipping.forceOpen();
        inventory.forceOpen();
        registry.resetAll();
        assertEquals(CircuitState.CLOSED, shipping.getState());
        assertEquals(CircuitState.CLOSED, inventory.getState());
    }
}
