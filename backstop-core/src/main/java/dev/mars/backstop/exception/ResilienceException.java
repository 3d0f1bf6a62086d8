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

/**
 * Base class for every failure the retry engine raises once it gives up on a call.
 *
 * <p>Each subclass carries enough context to explain why retrying stopped: the request,
 * how many attempts were made, the last status code (if the last attempt produced a
 * response) and the total elapsed time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public abstract class ResilienceException extends RuntimeException {

    private final RequestDescription request;
    private final int attempts;
    private final Integer statusCode;
    private final Duration elapsed;
    private final transient TransportResponse lastResponse;

    protected ResilienceException(String message, RequestDescription request, int attempts,
                                  Integer statusCode, Duration elapsed, TransportResponse lastResponse,
                                  Throwable cause) {
        super(message, cause);
        this.request = request;
        this.attempts = attempts;
        this.statusCode = statusCode;
        this.elapsed = elapsed != null ? elapsed : Duration.ZERO;
        this.lastResponse = lastResponse;
    }

    /**
     * @return the request that failed, or {@code null} for a breaker rejection raised outside a retry loop
     */
    public RequestDescription getRequest() {
        return request;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * @return status code of the last response, or {@code null} if the last attempt raised an error
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public TransportResponse getLastResponse() {
        return lastResponse;
    }

    protected static String prefix(RequestDescription request) {
        return request.method() + " request to " + request.url();
    }

    protected static String plural(int attempts) {
        return attempts == 1 ? "1 attempt" : attempts + " attempts";
    }
}
