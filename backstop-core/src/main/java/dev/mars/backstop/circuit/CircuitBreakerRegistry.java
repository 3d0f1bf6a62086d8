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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * One named {@link CircuitBreaker} per upstream, created lazily from a shared template.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class CircuitBreakerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final CircuitBreakerConfig template;
    private final Clock clock;
    private final ConcurrentMap<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final List<Consumer<CircuitBreaker>> creationListeners = new CopyOnWriteArrayList<>();

    public CircuitBreakerRegistry(CircuitBreakerConfig template) {
        this(template, Clock.systemUTC());
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig template, Clock clock) {
        this.template = template;
        this.clock = clock;
        logger.info("Circuit breaker registry initialized with config: {}", template);
    }

    /**
     * Gets or creates the breaker for {@code name}.
     */
    public CircuitBreaker circuitBreaker(String name) {
        return circuitBreakers.computeIfAbsent(name, key -> {
            CircuitBreaker breaker = new CircuitBreaker(key, template, clock);
            breaker.addListener((breakerName, from, to) ->
                logger.info("Circuit breaker '{}' state transition: {} -> {}", breakerName, from, to));
            creationListeners.forEach(listener -> listener.accept(breaker));
            logger.info("Created circuit breaker: {}", key);
            return breaker;
        });
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(circuitBreakers.get(name));
    }

    /**
     * Registers a hook run for every breaker created from now on, and for existing ones.
     */
    public void onCreate(Consumer<CircuitBreaker> listener) {
        creationListeners.add(listener);
        circuitBreakers.values().forEach(listener);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(circuitBreakers.keySet());
    }

    public void reset(String name) {
        CircuitBreaker breaker = circuitBreakers.get(name);
        if (breaker != null) {
            breaker.reset();
            logger.info("Reset circuit breaker: {}", name);
        }
    }

    public void forceOpen(String name) {
        CircuitBreaker breaker = circuitBreakers.get(name);
        if (breaker != null) {
            breaker.forceOpen();
            logger.info("Forced circuit breaker to open: {}", name);
        }
    }

    public void resetAll() {
        circuitBreakers.values().forEach(CircuitBreaker::reset);
    }

    public CircuitBreakerConfig getTemplate() {
        return template;
    }
}
