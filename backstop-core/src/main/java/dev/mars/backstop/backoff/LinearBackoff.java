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
 * {@code baseDelay + increment * attempt}. When only a base delay is given the increment
 * equals the base, so delays grow as 1x, 2x, 3x the base.
 */
public final class LinearBackoff extends AbstractBackoffStrategy {

    private final Duration baseDelay;
    private final Duration increment;

    public LinearBackoff(Duration baseDelay) {
        this(baseDelay, baseDelay, null);
    }

    public LinearBackoff(Duration baseDelay, Duration increment) {
        this(baseDelay, increment, null);
    }

    public LinearBackoff(Duration baseDelay, Duration increment, Duration maxDelay) {
        super(maxDelay);
        this.baseDelay = ConfigurationException.requireNonNegative(baseDelay, "baseDelay");
        this.increment = ConfigurationException.requireNonNegative(increment, "increment");
    }

    @Override
    protected long delayNanos(int attempt) {
        return saturatedAdd(toNanos(baseDelay), saturatedMultiply(toNanos(increment), attempt));
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getIncrement() {
        return increment;
    }

    @Override
    public String toString() {
        return "LinearBackoff{baseDelay=" + baseDelay + ", increment=" + increment + ", maxDelay=" + getMaxDelay() + "}";
    }
}
