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

import dev.mars.backstop.backoff.BackoffStrategy;
import dev.mars.backstop.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Computes the sleep before a retry: strategy delay, replaced by Retry-After when the last
 * response carried one, capped by the max wait time, then widened by
 * {@code delay * U(0, jitterFactor)}. Jitter never shortens a delay.
 */
public class DelayCalculator {
    private static final Logger logger = LoggerFactory.getLogger(DelayCalculator.class);

    private final BackoffStrategy strategy;
    private final TimeBudget budget;
    private final double jitterFactor;
    private final JitterSource jitterSource;

    public DelayCalculator(BackoffStrategy strategy, TimeBudget budget, double jitterFactor, JitterSource jitterSource) {
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.jitterFactor = jitterFactor;
        this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
    }

    public BackoffDecision compute(int attempt, TransportResponse lastResponse) {
        Duration base = strategy.calculate(attempt);
        if (base == null || base.isNegative()) {
            throw new IllegalStateException("Backoff strategy " + strategy + " returned invalid delay " + base);
        }
        Duration retryAfter = RetryAfter.from(lastResponse).orElse(null);
        Duration capped = budget.capDelay(retryAfter != null ? retryAfter : base);
        Duration jittered = applyJitter(capped);

        logger.debug("Backoff for attempt {}: base={}, retryAfter={}, capped={}, final={}",
            attempt + 1, base, retryAfter, capped, jittered);
        return new BackoffDecision(base, retryAfter, capped, jittered);
    }

    private Duration applyJitter(Duration delay) {
        if (jitterFactor <= 0.0 || delay.isZero()) {
            return delay;
        }
        double fraction = jitterSource.next(jitterFactor);
        if (fraction <= 0.0) {
            return delay;
        }
        long nanos = delay.toNanos();
        double extra = nanos * fraction;
        if (extra >= Long.MAX_VALUE - nanos) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(nanos + (long) extra);
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
