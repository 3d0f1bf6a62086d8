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

import dev.mars.backstop.exception.ConfigurationException;

import java.time.Duration;
import java.util.Optional;

/**
 * The two independent time caps of a retry policy.
 *
 * <ul>
 *   <li>{@code maxTotalTime} is checked before each backoff sleep; once the elapsed time
 *       reaches it no further attempt is made.</li>
 *   <li>{@code maxWaitTime} bounds each individual delay, after any Retry-After override
 *       and before jitter.</li>
 * </ul>
 * Either may be absent.
 */
public final class TimeBudget {

    private static final TimeBudget UNBOUNDED = new TimeBudget(null, null);

    private final Duration maxTotalTime;
    private final Duration maxWaitTime;

    public TimeBudget(Duration maxTotalTime, Duration maxWaitTime) {
        this.maxTotalTime = maxTotalTime == null ? null : ConfigurationException.requirePositive(maxTotalTime, "maxTotalTime");
        this.maxWaitTime = maxWaitTime == null ? null : ConfigurationException.requirePositive(maxWaitTime, "maxWaitTime");
    }

    public static TimeBudget unbounded() {
        return UNBOUNDED;
    }

    /**
     * Pre-sleep check.
     *
     * @return true if {@code elapsed >= maxTotalTime}
     */
    public boolean isExhausted(Duration elapsed) {
        return maxTotalTime != null && elapsed.compareTo(maxTotalTime) >= 0;
    }

    public Duration capDelay(Duration delay) {
        if (maxWaitTime != null && delay.compareTo(maxWaitTime) > 0) {
            return maxWaitTime;
        }
        return delay;
    }

    public Optional<Duration> getMaxTotalTime() {
        return Optional.ofNullable(maxTotalTime);
    }

    public Optional<Duration> getMaxWaitTime() {
        return Optional.ofNullable(maxWaitTime);
    }

    @Override
    public String toString() {
        return "TimeBudget{maxTotalTime=" + maxTotalTime + ", maxWaitTime=" + maxWaitTime + "}";
    }
}
