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
 * Shared plumbing for the built-in strategies: attempt validation, the optional per-strategy
 * {@code maxDelay} cap and overflow-safe nanosecond arithmetic.
 */
public abstract class AbstractBackoffStrategy implements BackoffStrategy {

    private final Duration maxDelay;

    protected AbstractBackoffStrategy(Duration maxDelay) {
        this.maxDelay = maxDelay == null ? null : ConfigurationException.requirePositive(maxDelay, "maxDelay");
    }

    @Override
    public final Duration calculate(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative, got " + attempt);
        }
        Duration delay = Duration.ofNanos(delayNanos(attempt));
        if (maxDelay != null && delay.compareTo(maxDelay) > 0) {
            return maxDelay;
        }
        return delay;
    }

    /**
     * @return the uncapped delay for {@code attempt} in nanoseconds, saturating at {@link Long#MAX_VALUE}
     */
    protected abstract long delayNanos(int attempt);

    public Duration getMaxDelay() {
        return maxDelay;
    }

    protected static long saturatedMultiply(long a, long b) {
        long high = Math.multiplyHigh(a, b);
        long low = a * b;
        if ((high == 0 && low >= 0) || (high == -1 && low < 0)) {
            return low;
        }
        return Long.MAX_VALUE;
    }

    protected static long saturatedAdd(long a, long b) {
        long sum = a + b;
        if (((a ^ sum) & (b ^ sum)) < 0) {
            return Long.MAX_VALUE;
        }
        return sum;
    }

    protected static long toNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
