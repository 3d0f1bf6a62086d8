package dev.mars.backstop.callback;

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
import dev.mars.backstop.transport.HttpResult;
import dev.mars.backstop.transport.RequestDescription;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class CallbackDispatcherTest {

    private static final RequestDescription REQUEST = RequestDescription.of("get", "https://api.example.com/items");

    @Test
    void testAttemptNumbersAreOneIndexed() {
        AtomicReference<RequestInfo> request = new AtomicReference<>();
        AtomicReference<RetryInfo> retry = new AtomicReference<>();
        AtomicReference<SuccessInfo> success = new AtomicReference<>();
        AtomicReference<FailureInfo> failure = new AtomicReference<>();
        CallbackDispatcher dispatcher = new CallbackDispatcher(RetryCallbacks.builder()
            .onRequest(request::set)
            .onRetry(retry::set)
            .onSuccess(success::set)
            .onFailure(failure::set)
            .build(), 3);

        dispatcher.onRequest(REQUEST, 0);
        dispatcher.onRetry(REQUEST, 0, Duration.ofMillis(300), null, 503);
        dispatcher.onSuccess(REQUEST, 1, HttpResult.of(200), Duration.ofSeconds(1));
        dispatcher.onFailure(REQUEST, 2, new RuntimeException("x"), 500, Duration.ofSeconds(2));

        assertEquals(1, request.get().attempt());
        assertEquals("GET", request.get().method());
        assertEquals("https://api.example.com/items", request.get().url());
        assertEquals(3, request.get().maxRetries());

        assertEquals(2, retry.get().attempt(), "on_retry previews the next attempt");
        assertEquals(Duration.ofMillis(300), retry.get().waitTime());
        assertEquals(503, retry.get().statusCode());

        assertEquals(2, success.get().attempt());
        assertEquals(200, success.get().response().statusCode());

        assertEquals(3, failure.get().attempt());
        assertEquals(500, failure.get().statusCode());
    }

    @Test
    void testMissingHooksAreSkipped() {
        CallbackDispatcher dispatcher = new CallbackDispatcher(RetryCallbacks.none(), 2);

        assertDoesNotThrow(() -> {
            dispatcher.onRequest(REQUEST, 0);
            dispatcher.onRetry(REQUEST, 0, Duration.ZERO, null, null);
            dispatcher.onSuccess(REQUEST, 0, HttpResult.of(200), Duration.ZERO);
            dispatcher.onFailure(REQUEST, 0, new RuntimeException(), null, Duration.ZERO);
        });
        assertTrue(RetryCallbacks.none().isEmpty());
    }

    @Test
    void testHookExceptionsPropagate() {
        CallbackDispatcher dispatcher = new CallbackDispatcher(RetryCallbacks.builder()
            .onRequest(info -> {
                throw new IllegalStateException("hook bug");
            })
            .build(), 1);

        assertThrows(IllegalStateException.class, () -> dispatcher.onRequest(REQUEST, 0));
    }

    @Test
    void testAndThenRunsBothInOrder() {
        List<String> calls = new ArrayList<>();
        RetryCallbacks first = RetryCallbacks.builder().onRequest(info -> calls.add("first")).build();
        RetryCallbacks second = RetryCallbacks.builder()
            .onRequest(info -> calls.add("second"))
            .onSuccess(info -> calls.add("success"))
            .build();

        CallbackDispatcher dispatcher = new CallbackDispatcher(first.andThen(second), 0);
        dispatcher.onRequest(REQUEST, 0);
        dispatcher.onSuccess(REQUEST, 0, HttpResult.of(204), Duration.ZERO);

        assertEquals(List.of("first", "second", "success"), calls);
    }
}
