package dev.mars.backstop.retry;

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
import dev.mars.backstop.backoff.ExponentialBackoff;
import dev.mars.backstop.budget.DelayCalculator;
import dev.mars.backstop.budget.JitterSource;
import dev.mars.backstop.budget.TimeBudget;
import dev.mars.backstop.exception.ConfigurationException;
import dev.mars.backstop.policy.RetryDecisionPolicy;
import dev.mars.backstop.policy.RetryPredicate;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable retry configuration, shareable across any number of concurrent calls.
 *
 * <p>All parameters are validated when {@link Builder#build()} runs; an invalid value
 * raises {@link ConfigurationException} and never surfaces mid-call.</p>
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxRetries(5)
 *     .backoffStrategy(new FibonacciBackoff(Duration.ofMillis(200), Duration.ofSeconds(10)))
 *     .jitterFactor(0.2)
 *     .retryableStatuses(429, 503)
 *     .maxTotalTime(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BACKOFF_FACTOR = Duration.ofMillis(300);
    public static final Set<Integer> DEFAULT_RETRYABLE_STATUSES =
        Collections.unmodifiableSet(new TreeSet<>(Set.of(429, 500, 502, 503, 504)));

    private final int maxRetries;
    private final BackoffStrategy backoffStrategy;
    private final double jitterFactor;
    private final JitterSource jitterSource;
    private final Set<Integer> retryableStatuses;
    private final RetryPredicate retryPredicate;
    private final TimeBudget timeBudget;
    private final boolean countSuccessfulRetriesAsFailures;

    private RetryPolicy(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.backoffStrategy = builder.backoffStrategy;
        this.jitterFactor = builder.jitterFactor;
        this.jitterSource = builder.jitterSource;
        this.retryableStatuses = Collections.unmodifiableSet(new TreeSet<>(builder.retryableStatuses));
        this.retryPredicate = builder.retryPredicate;
        this.timeBudget = new TimeBudget(builder.maxTotalTime, builder.maxWaitTime);
        this.countSuccessfulRetriesAsFailures = builder.countSuccessfulRetriesAsFailures;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * @return the attempt ceiling, {@code maxRetries + 1}
     */
    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    public BackoffStrategy getBackoffStrategy() {
        return backoffStrategy;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    public Set<Integer> getRetryableStatuses() {
        return retryableStatuses;
    }

    public Optional<RetryPredicate> getRetryPredicate() {
        return Optional.ofNullable(retryPredicate);
    }

    public TimeBudget getTimeBudget() {
        return timeBudget;
    }

    /**
     * Whether a retry requested by the predicate for a successful (below 400) response is
     * recorded as a circuit breaker failure. When false such attempts record nothing.
     */
    public boolean isCountSuccessfulRetriesAsFailures() {
        return countSuccessfulRetriesAsFailures;
    }

    RetryDecisionPolicy newDecisionPolicy() {
        return new RetryDecisionPolicy(retryableStatuses, retryPredicate);
    }

    DelayCalculator newDelayCalculator() {
        return new DelayCalculator(backoffStrategy, timeBudget, jitterFactor, jitterSource);
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .maxRetries(maxRetries)
            .backoffStrategy(backoffStrategy)
            .jitterFactor(jitterFactor)
            .jitterSource(jitterSource)
            .retryableStatuses(retryableStatuses)
            .retryPredicate(retryPredicate)
            .countSuccessfulRetriesAsFailures(countSuccessfulRetriesAsFailures);
        timeBudget.getMaxTotalTime().ifPresent(builder::maxTotalTime);
        timeBudget.getMaxWaitTime().ifPresent(builder::maxWaitTime);
        return builder;
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxRetries=" + maxRetries +
                ", backoffStrategy=" + backoffStrategy +
                ", jitterFactor=" + jitterFactor +
                ", retryableStatuses=" + retryableStatuses +
                ", retryPredicate=" + (retryPredicate != null) +
                ", timeBudget=" + timeBudget +
                ", countSuccessfulRetriesAsFailures=" + countSuccessfulRetriesAsFailures +
                '}';
    }

    public static final class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private BackoffStrategy backoffStrategy = new ExponentialBackoff(DEFAULT_BACKOFF_FACTOR);
        private double jitterFactor = 0.0;
        private JitterSource jitterSource = JitterSource.random();
        private Set<Integer> retryableStatuses = new TreeSet<>(DEFAULT_RETRYABLE_STATUSES);
        private RetryPredicate retryPredicate;
        private Duration maxTotalTime;
        private Duration maxWaitTime;
        private boolean countSuccessfulRetriesAsFailures;

        private Builder() {
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new ConfigurationException("maxRetries must be non-negative, got " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoffStrategy(BackoffStrategy backoffStrategy) {
            if (backoffStrategy == null) {
                throw new ConfigurationException("backoffStrategy must not be null");
            }
            this.backoffStrategy = backoffStrategy;
            return this;
        }

        /**
         * Shorthand for {@code backoffStrategy(new ExponentialBackoff(backoffFactor))}.
         */
        public Builder backoffFactor(Duration backoffFactor) {
            return backoffStrategy(new ExponentialBackoff(backoffFactor));
        }

        public Builder jitterFactor(double jitterFactor) {
            if (Double.isNaN(jitterFactor) || Double.isInfinite(jitterFactor) || jitterFactor < 0.0) {
                throw new ConfigurationException("jitterFactor must be a non-negative number, got " + jitterFactor);
            }
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder jitterSource(JitterSource jitterSource) {
            if (jitterSource == null) {
                throw new ConfigurationException("jitterSource must not be null");
            }
            this.jitterSource = jitterSource;
            return this;
        }

        public Builder retryableStatuses(Integer... statuses) {
            return retryableStatuses(Arrays.asList(statuses));
        }

        public Builder retryableStatuses(Collection<Integer> statuses) {
            if (statuses == null) {
                throw new ConfigurationException("retryableStatuses must not be null");
            }
            Set<Integer> copy = new TreeSet<>();
            for (Integer status : statuses) {
                if (status == null || status < 100 || status > 599) {
                    throw new ConfigurationException("Invalid HTTP status in retryableStatuses: " + status);
                }
                copy.add(status);
            }
            this.retryableStatuses = copy;
            return this;
        }

        /**
         * Replaces the status allow-list with a caller decision. Pass {@code null} to clear.
         */
        public Builder retryPredicate(RetryPredicate retryPredicate) {
            this.retryPredicate = retryPredicate;
            return this;
        }

        public Builder maxTotalTime(Duration maxTotalTime) {
            this.maxTotalTime = ConfigurationException.requirePositive(maxTotalTime, "maxTotalTime");
            return this;
        }

        public Builder maxWaitTime(Duration maxWaitTime) {
            this.maxWaitTime = ConfigurationException.requirePositive(maxWaitTime, "maxWaitTime");
            return this;
        }

        public Builder countSuccessfulRetriesAsFailures(boolean countSuccessfulRetriesAsFailures) {
            this.countSuccessfulRetriesAsFailures = countSuccessfulRetriesAsFailures;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
