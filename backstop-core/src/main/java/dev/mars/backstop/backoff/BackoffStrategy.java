package dev.mars.backstop.backoff;

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
 * Maps a zero-indexed attempt number to the base delay before the next retry.
 *
 * <p>Implementations must be deterministic and side-effect free. Jitter, Retry-After and
 * the wait cap are applied later by the retry engine, not here. Custom strategies can be
 * supplied as a lambda:</p>
 *
 * <pre>{@code
 * BackoffStrategy squares = attempt -> Duration.ofMillis(100L * (attempt + 1) * (attempt + 1));
 * }</pre>
 */
@FunctionalInterface
public interface BackoffStrategy {

    /**
     * @param attempt zero-indexed attempt that just failed
     * @return the delay before the next attempt, never negative
     */
    Duration calculate(int attempt);
}
