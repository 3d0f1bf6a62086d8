package dev.mars.backstop.exception;

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
import java.util.Locale;

/**
 * Fail-fast rejection from an OPEN circuit breaker. The guarded operation was not invoked
 * for the rejected attempt.
 */
public class CircuitOpenException extends ResilienceException {

    private final String breakerName;
    private final int failureCount;
    private final Duration remaining;

    public CircuitOpenException(String breakerName, int failureCount, Duration remaining) {
        super(breakerMessage(breakerName, failureCount, remaining), null, 0, null, Duration.ZERO, null, null);
        this.breakerName = breakerName;
        this.failureCount = failureCount;
        this.remaining = remaining;
    }

    private CircuitOpenException(CircuitOpenException rejection, RequestDescription request, int attempts,
                                 Integer statusCode, Duration elapsed, TransportResponse lastResponse) {
        super(prefix(request) + " rejected: " + rejection.getMessage(),
            request, attempts, statusCode, elapsed, lastResponse, null);
        this.breakerName = rejection.breakerName;
        this.failureCount = rejection.failureCount;
        this.remaining = rejection.remaining;
    }

    /**
     * Re-issues a breaker rejection with the context of the call it interrupted.
     */
    public CircuitOpenException forRequest(RequestDescription request, int attempts, Integer lastStatus,
                                           Duration elapsed, TransportResponse lastResponse) {
        return new CircuitOpenException(this, request, attempts, lastStatus, elapsed, lastResponse);
    }

    public String getBreakerName() {
        return breakerName;
    }

    public int getFailureCount() {
        return failureCount;
    }

    /**
     * @return how long until the breaker will admit a trial call
     */
    public Duration getRemaining() {
        return remaining;
    }

    private static String breakerMessage(String name, int failureCount, Duration remaining) {
        return String.format(Locale.ROOT, "Circuit breaker '%s' is OPEN (failed %d times). Retry after %.1fs",
            name, failureCount, remaining.toNanos() / 1_000_000_000.0);
    }
}
