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
 * {@code baseDelay * fib(attempt + 1)} with fib(1) = fib(2) = 1, giving multipliers
 * 1, 1, 2, 3, 5, 8 for attempts 0 to 5.
 */
public final class FibonacciBackoff extends AbstractBackoffStrategy {

    private final Duration baseDelay;

    public FibonacciBackoff(Duration baseDelay) {
        this(baseDelay, null);
    }

    public FibonacciBackoff(Duration baseDelay, Duration maxDelay) {
        super(maxDelay);
        this.baseDelay = ConfigurationException.requireNonNegative(baseDelay, "baseDelay");
    }

    @Override
    protected long delayNanos(int attempt) {
        return saturatedMultiply(toNanos(baseDelay), fibonacci(attempt + 1));
    }

    /**
     * Iterative fib(n) for n >= 1, saturating instead of overflowing.
     */
    static long fibonacci(int n) {
        long previous = 0;
        long current = 1;
        for (int i = 1; i < n; i++) {
            long next = saturatedAdd(previous, current);
            previous = current;
            current = next;
            if (current == Long.MAX_VALUE) {
                break;
            }
        }
        return current;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    @Override
    public String toString() {
        return "FibonacciBackoff{baseDelay=" + baseDelay + ", maxDelay=" + getMaxDelay() + "}";
    }
}
