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

import dev.mars.backstop.exception.ConfigurationException;

import java.time.Duration;

/**
 * {@code baseDelay * 2^attempt}: 0.3s, 0.6s, 1.2s, 2.4s for a base of 300ms.
 */
public final class ExponentialBackoff extends AbstractBackoffStrategy {

    private final Duration baseDelay;

    public ExponentialBackoff(Duration baseDelay) {
        this(baseDelay, null);
    }

    public ExponentialBackoff(Duration baseDelay, Duration maxDelay) {
        super(maxDelay);
        this.baseDelay = ConfigurationException.requireNonNegative(baseDelay, "baseDelay");
    }

    @Override
    protected long delayNanos(int attempt) {
        if (attempt >= Long.SIZE - 1) {
            return baseDelay.isZero() ? 0 : Long.MAX_VALUE;
        }
        return saturatedMultiply(toNanos(baseDelay), 1L << attempt);
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    @Override
    public String toString() {
        return "ExponentialBackoff{baseDelay=" + baseDelay + ", maxDelay=" + getMaxDelay() + "}";
    }
}
