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

import dev.mars.backstop.transport.RequestDescription;
import dev.mars.backstop.transport.TransportResponse;

import java.time.Duration;
import java.util.Objects;

/**
 * Translates the engine's zero-indexed attempt counter into the 1-indexed payloads seen by
 * {@link RetryCallbacks}. The retry hook previews the next attempt, so it reports
 * {@code attempt + 2}; every other hook reports {@code attempt + 1}.
 */
public class CallbackDispatcher {

    private final RetryCallbacks callbacks;
    private final int maxRetries;

    public CallbackDispatcher(RetryCallbacks callbacks, int maxRetries) {
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks must not be null");
        this.maxRetries = maxRetries;
    }

    public void onRequest(RequestDescription request, int attempt) {
        if (callbacks.getOnRequest() != null) {
            callbacks.getOnRequest().accept(new RequestInfo(request.url(), request.method(), attempt + 1, maxRetries));
        }
    }

    public void onRetry(RequestDescription request, int attempt, Duration waitTime, Throwable lastError,
                        Integer lastStatus) {
        if (callbacks.getOnRetry() != null) {
            callbacks.getOnRetry().accept(new RetryInfo(request.url(), request.method(), attempt + 2, maxRetries,
                waitTime, lastError, lastStatus));
        }
    }

    public void onSuccess(RequestDescription request, int attempt, TransportResponse response, Duration totalTime) {
        if (callbacks.getOnSuccess() != null) {
            callbacks.getOnSuccess().accept(new SuccessInfo(request.url(), request.method(), attempt + 1, maxRetries,
                response, totalTime));
        }
    }

    public void onFailure(RequestDescription request, int attempt, Throwable error, Integer statusCode,
                          Duration totalTime) {
        if (callbacks.getOnFailure() != null) {
            callbacks.getOnFailure().accept(new FailureInfo(request.url(), request.method(), attempt + 1, maxRetries,
                error, statusCode, totalTime));
        }
    }
}
