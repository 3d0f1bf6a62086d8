package dev.mars.backstop.circuit;

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

import java.time.Instant;

/**
 * Point-in-time view of a circuit breaker, taken under its lock.
 */
public class CircuitBreakerSnapshot {
    private final String name;
    private final CircuitState state;
    private final int failureCount;
    private final Instant lastFailureTime;
    private final Instant stateTransitionTime;
    private final long successfulCalls;
    private final long failedCalls;
    private final long ignoredFailures;
    private final long rejectedCalls;

    public CircuitBreakerSnapshot(String name, CircuitState state, int failureCount, Instant lastFailureTime,
                                  Instant stateTransitionTime, long successfulCalls, long failedCalls,
                                  long ignoredFailures, long rejectedCalls) {
        this.name = name;
        this.state = state;
        this.failureCount = failureCount;
        this.lastFailureTime = lastFailureTime;
        this.stateTransitionTime = stateTransitionTime;
        this.successfulCalls = successfulCalls;
        this.failedCalls = failedCalls;
        this.ignoredFailures = ignoredFailures;
        this.rejectedCalls = rejectedCalls;
    }

    public String getName() { return name; }
    public CircuitState getState() { return state; }
    public int getFailureCount() { return failureCount; }
    public Instant getLastFailureTime() { return lastFailureTime; }
    public Instant getStateTransitionTime() { return stateTransitionTime; }
    public long getSuccessfulCalls() { return successfulCalls; }
    public long getFailedCalls() { return failedCalls; }
    public long getIgnoredFailures() { return ignoredFailures; }
    public long getRejectedCalls() { return rejectedCalls; }

    public double getFailureRate() {
        long total = successfulCalls + failedCalls;
        return total > 0 ? (double) failedCalls / total : 0.0;
    }

    @Override
    public String toString() {
        return String.format("CircuitBreakerSnapshot{name='%s', state=%s, failures=%d, successful=%d, failed=%d, " +
                "ignored=%d, rejected=%d, failureRate=%.2f%%}",
            name, state, failureCount, successfulCalls, failedCalls, ignoredFailures, rejectedCalls,
            getFailureRate() * 100);
    }
}
