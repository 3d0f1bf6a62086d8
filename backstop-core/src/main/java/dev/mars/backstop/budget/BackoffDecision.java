package dev.mars.backstop.budget;

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

import java.time.Duration;

/**
 * How the delay before one retry was computed.
 *
 * @param baseDelay value from the backoff strategy
 * @param retryAfter server-supplied override, or {@code null}
 * @param cappedDelay base or override after the max wait cap
 * @param finalDelay capped delay after jitter; this is what the executor sleeps
 */
public record BackoffDecision(Duration baseDelay, Duration retryAfter, Duration cappedDelay, Duration finalDelay) {

    public boolean hasRetryAfter() {
        return retryAfter != null;
    }
}
