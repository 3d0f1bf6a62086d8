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

import dev.mars.backstop.transport.HttpStatusException;
import dev.mars.backstop.transport.RequestDescription;
import dev.mars.backstop.transport.TransportException;
import dev.mars.backstop.transport.TransportResponse;

import java.time.Duration;

/**
 * Every permitted attempt produced a retryable outcome. Carries the last status or the
 * last transport error as cause.
 */
public class RetriesExhaustedException extends ResilienceException {

    private RetriesExhaustedException(String message, RequestDescription request, int attempts, Integer statusCode,
                                      Duration elapsed, TransportResponse lastResponse, Throwable cause) {
        super(message, request, attempts, statusCode, elapsed, lastResponse, cause);
    }

    public static RetriesExhaustedException afterStatus(RequestDescription request, int attempts,
                                                        TransportResponse response, Duration elapsed) {
        return new RetriesExhaustedException(
            prefix(request) + " failed with status " + response.statusCode() + " after " + plural(attempts),
            request, attempts, response.statusCode(), elapsed, response,
            new HttpStatusException(request, response.statusCode()));
    }

    public static RetriesExhaustedException afterError(RequestDescription request, int attempts,
                                                       Throwable error, Duration elapsed) {
        String message;
        if (error instanceof TransportException && ((TransportException) error).isTimeout()) {
            message = prefix(request) + " timed out (" + plural(attempts) + ")";
        } else {
            message = prefix(request) + " failed after " + plural(attempts) + ": " + error.getMessage();
        }
        return new RetriesExhaustedException(message, request, attempts, null, elapsed, null, error);
    }
}
