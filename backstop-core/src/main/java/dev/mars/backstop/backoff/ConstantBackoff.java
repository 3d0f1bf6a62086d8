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
 * Same delay for every attempt.
 */
public final class ConstantBackoff extends AbstractBackoffStrategy {

    private final Duration delay;

    public ConstantBackoff(Duration delay) {
        this(delay, null);
    }

    public ConstantBackoff(Duration delay, Duration maxDelay) {
        super(maxDelay);
        this.delay = ConfigurationException.requireNonNegative(delay, "delay");
    }

    @Override
    protected long delayNanos(int attempt) {
        return toNanos(delay);
    }

    public Duration getDelay() {
        return delay;
    }

    @Override
    public String toString() {
        return "ConstantBackoff{delay=" + delay + ", maxDelay=" + getMaxDelay() + "}";
    }
}
