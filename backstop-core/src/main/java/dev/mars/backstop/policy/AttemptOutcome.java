package dev.mars.backstop.policy;

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

import dev.mars.backstop.transport.TransportException;
import dev.mars.backstop.transport.TransportResponse;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a single attempt: either a response or an error, never both.
 *
 * <p>Instances are created through {@link #response(TransportResponse)} or
 * {@link #error(Throwable)}.</p>
 */
public final class AttemptOutcome {

    private final TransportResponse response;
    private final Throwable error;

    private AttemptOutcome(TransportResponse response, Throwable error) {
        this.response = response;
        this.error = error;
    }

    public static AttemptOutcome response(TransportResponse response) {
        return new AttemptOutcome(Objects.requireNonNull(response, "response must not be null"), null);
    }

    public static AttemptOutcome error(Throwable error) {
        return new AttemptOutcome(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean hasResponse() {
        return response != null;
    }

    public boolean hasError() {
        return error != null;
    }

    /**
     * @throws IllegalStateException if this outcome is an error
     */
    public TransportResponse getResponse() {
        if (response == null) {
            throw new IllegalStateException("Outcome is an error, not a response");
        }
        return response;
    }

    /**
     * @throws IllegalStateException if this outcome is a response
     */
    public Throwable getError() {
        if (error == null) {
            throw new IllegalStateException("Outcome is a response, not an error");
        }
        return error;
    }

    public Optional<Integer> statusCode() {
        return response != null ? Optional.of(response.statusCode()) : Optional.empty();
    }

    /**
     * @return true for a {@link TransportException} of kind TIMEOUT or NETWORK
     */
    public boolean isTransientError() {
        return error instanceof TransportException && ((TransportException) error).isTransient();
    }

    @Override
    public String toString() {
        return response != null
            ? "AttemptOutcome{status=" + response.statusCode() + "}"
            : "AttemptOutcome{error=" + error + "}";
    }
}
