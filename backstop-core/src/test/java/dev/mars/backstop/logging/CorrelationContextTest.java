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

import dev.mars.backstop.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class CorrelationContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void testEnsureCorrelationIdGeneratesOnce() {
        assertNull(CorrelationContext.getCorrelationId());

        String first = CorrelationContext.ensureCorrelationId();
        String second = CorrelationContext.ensureCorrelationId();

        assertNotNull(first);
        assertEquals(first, second);
    }

    @Test
    void testBlankIdsIgnored() {
        CorrelationContext.setCorrelationId("  ");
        assertNull(CorrelationContext.getCorrelationId());
    }

    @Test
    void testCapturedContextAppliesOnAnotherThread() throws Exception {
        CorrelationContext.setCorrelationId("req-42");
        Map<String, String> captured = CorrelationContext.capture();

        String seen = CompletableFuture.supplyAsync(() -> {
            try (CorrelationContext.Scope scope = CorrelationContext.apply(captured)) {
                return CorrelationContext.getCorrelationId();
            }
        }).get();

        assertEquals("req-42", seen);
    }

    @Test
    void testScopeRestoresPreviousContext() {
        CorrelationContext.setCorrelationId("outer");

        try (CorrelationContext.Scope scope = CorrelationContext.with(CorrelationContext.MDC_REQUEST_URL, "https://x")) {
            assertEquals("https://x", MDC.get(CorrelationContext.MDC_REQUEST_URL));
            assertEquals("outer", CorrelationContext.getCorrelationId());
        }
        assertNull(MDC.get(CorrelationContext.MDC_REQUEST_URL));
        assertEquals("outer", CorrelationContext.getCorrelationId());

        try (CorrelationContext.Scope scope = CorrelationContext.apply(Map.of())) {
            assertNull(CorrelationContext.getCorrelationId());
        }
        assertEquals("outer", CorrelationContext.getCorrelationId());

        CorrelationContext.clear();
        assertTrue(CorrelationContext.capture().isEmpty());
    }
}
