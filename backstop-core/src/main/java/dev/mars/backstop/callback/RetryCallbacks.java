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

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Immutable set of optional lifecycle hooks. Exceptions thrown by a hook propagate to the
 * caller and abort the call.
 *
 * <pre>{@code
 * RetryCallbacks callbacks = RetryCallbacks.builder()
 *     .onRetry(info -> logger.warn("Retrying {} (attempt {}) in {}", info.url(), info.attempt(), info.waitTime()))
 *     .onFailure(info -> alerts.raise(info.error()))
 *     .build();
 * }</pre>
 */
public final class RetryCallbacks {

    private static final RetryCallbacks NONE = builder().build();

    private final Consumer<RequestInfo> onRequest;
    private final Consumer<RetryInfo> onRetry;
    private final Consumer<SuccessInfo> onSuccess;
    private final Consumer<FailureInfo> onFailure;

    private RetryCallbacks(Builder builder) {
        this.onRequest = builder.onRequest;
        this.onRetry = builder.onRetry;
        this.onSuccess = builder.onSuccess;
        this.onFailure = builder.onFailure;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetryCallbacks none() {
        return NONE;
    }

    /**
     * @return a set that runs this set's hooks first, then {@code other}'s
     */
    public RetryCallbacks andThen(RetryCallbacks other) {
        Objects.requireNonNull(other, "other must not be null");
        return builder()
            .onRequest(chain(onRequest, other.onRequest))
            .onRetry(chain(onRetry, other.onRetry))
            .onSuccess(chain(onSuccess, other.onSuccess))
            .onFailure(chain(onFailure, other.onFailure))
            .build();
    }

    private static <T> Consumer<T> chain(Consumer<T> first, Consumer<T> second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return first.andThen(second);
    }

    Consumer<RequestInfo> getOnRequest() { return onRequest; }
    Consumer<RetryInfo> getOnRetry() { return onRetry; }
    Consumer<SuccessInfo> getOnSuccess() { return onSuccess; }
    Consumer<FailureInfo> getOnFailure() { return onFailure; }

    public boolean isEmpty() {
        return onRequest == null && onRetry == null && onSuccess == null && onFailure == null;
    }

    public static final class Builder {
        private Consumer<RequestInfo> onRequest;
        private Consumer<RetryInfo> onRetry;
        private Consumer<SuccessInfo> onSuccess;
        private Consumer<FailureInfo> onFailure;

        private Builder() {
        }

        public Builder onRequest(Consumer<RequestInfo> onRequest) {
            this.onRequest = onRequest;
            return this;
        }

        public Builder onRetry(Consumer<RetryInfo> onRetry) {
            this.onRetry = onRetry;
            return this;
        }

        public Builder onSuccess(Consumer<SuccessInfo> onSuccess) {
            this.onSuccess = onSuccess;
            return this;
        }

        public Builder onFailure(Consumer<FailureInfo> onFailure) {
            this.onFailure = onFailure;
            return this;
        }

        public RetryCallbacks build() {
            return new RetryCallbacks(this);
        }
    }
}
