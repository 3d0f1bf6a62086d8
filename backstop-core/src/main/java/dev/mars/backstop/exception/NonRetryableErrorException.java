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

import java.time.Duration;

/**
 * A transient transport error (timeout or network failure) that the retry predicate
 * declined to retry. The original error is the cause.
 */
public class NonRetryableErrorException extends ResilienceException {

    public NonRetryableErrorException(RequestDescription request, int attempts, Throwable cause, Duration elapsed) {
        super(prefix(request) + " failed after " + plural(attempts) + ": " + cause.getMessage(),
            request, attempts, null, elapsed, null, cause);
    }
}
