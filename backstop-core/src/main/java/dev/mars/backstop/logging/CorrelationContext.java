package dev.mars.backstop.logging;

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

import org.slf4j.MDC;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Correlation id and MDC helpers.
 *
 * <p>The SLF4J MDC is thread-bound, so work resumed on a Vert.x timer or another thread
 * loses it. {@link #capture()} takes a copy on the calling thread and {@link #apply(Map)}
 * installs it around a continuation, restoring whatever was there before on close.</p>
 *
 * <pre>{@code
 * Map<String, String> captured = CorrelationContext.capture();
 * vertx.setTimer(100, id -> {
 *     try (CorrelationContext.Scope scope = CorrelationContext.apply(captured)) {
 *         logger.info("still correlated");
 *     }
 * });
 * }</pre>
 */
public final class CorrelationContext {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_REQUEST_METHOD = "httpMethod";
    public static final String MDC_REQUEST_URL = "httpUrl";

    private CorrelationContext() {
    }

    public static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public static void setCorrelationId(String correlationId) {
        if (correlationId != null && !correlationId.trim().isEmpty()) {
            MDC.put(MDC_CORRELATION_ID, correlationId);
        }
    }

    public static String getCorrelationId() {
        return MDC.get(MDC_CORRELATION_ID);
    }

    /**
     * Returns the current correlation id, generating and installing one if absent.
     */
    public static String ensureCorrelationId() {
        String current = getCorrelationId();
        if (current == null) {
            current = newCorrelationId();
            MDC.put(MDC_CORRELATION_ID, current);
        }
        return current;
    }

    public static void clear() {
        MDC.remove(MDC_CORRELATION_ID);
        MDC.remove(MDC_REQUEST_METHOD);
        MDC.remove(MDC_REQUEST_URL);
    }

    public static Map<String, String> capture() {
        Map<String, String> contextMap = MDC.getCopyOfContextMap();
        return contextMap != null ? contextMap : Collections.emptyMap();
    }

    /**
     * Installs {@code contextMap} as the whole MDC until the returned scope is closed.
     */
    public static Scope apply(Map<String, String> contextMap) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (contextMap == null || contextMap.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(new HashMap<>(contextMap));
        }
        return new Scope(previous);
    }

    /**
     * Adds a single MDC entry until the returned scope is closed.
     */
    public static Scope with(String key, String value) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (value != null) {
            MDC.put(key, value);
        }
        return new Scope(previous);
    }

    public static final class Scope implements AutoCloseable {
        private final Map<String, String> previous;

        private Scope(Map<String, String> previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null || previous.isEmpty()) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
