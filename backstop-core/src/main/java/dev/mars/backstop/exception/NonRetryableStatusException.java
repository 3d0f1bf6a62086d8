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
import dev.mars.backstop.transport.TransportResponse;

import java.time.Duration;

/**
 * The response status is not retryable: it is outside the allow-list, or the retry
 * predicate rejected it. Raised immediately, regardless of remaining attempts.
 */
public class NonRetryableStatusException extends ResilienceException {

    public NonRetryableStatusException(RequestDescription request, int attempts, TransportResponse response,
                                       Duration elapsed) {
        super(prefix(request) + " failed with non-retryable status " + response.statusCode()
                + " after " + plural(attempts),
            request, attempts, response.statusCode(), elapsed, response,
            new HttpStatusException(request, response.statusCode()));
    }
}
