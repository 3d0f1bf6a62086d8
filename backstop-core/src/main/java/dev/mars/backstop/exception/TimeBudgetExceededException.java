package dev.mars.backstop.exception;

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

import dev.mars.backstop.transport.HttpStatusException;
import dev.mars.backstop.transport.RequestDescription;
import dev.mars.backstop.transport.TransportResponse;

import java.time.Duration;
import java.util.Locale;

/**
 * The total time budget ran out before the next retry could be scheduled. The last
 * observed outcome (status or error) is preserved even though no further attempt was made.
 */
public class TimeBudgetExceededException extends ResilienceException {

    private final Duration maxTotalTime;

    public TimeBudgetExceededException(RequestDescription request, int attempts, Duration elapsed,
                                       Duration maxTotalTime, TransportResponse lastResponse, Throwable lastError) {
        super(prefix(request) + " exceeded max_total_time of " + seconds(maxTotalTime)
                + "s after " + plural(attempts) + describe(lastResponse, lastError),
            request, attempts, lastResponse != null ? lastResponse.statusCode() : null, elapsed, lastResponse,
            lastError != null ? lastError
                : lastResponse != null ? new HttpStatusException(request, lastResponse.statusCode()) : null);
        this.maxTotalTime = maxTotalTime;
    }

    public Duration getMaxTotalTime() {
        return maxTotalTime;
    }

    private static String describe(TransportResponse lastResponse, Throwable lastError) {
        if (lastResponse != null) {
            return " (last status " + lastResponse.statusCode() + ")";
        }
        if (lastError != null) {
            return " (last error: " + lastError.getMessage() + ")";
        }
        return "";
    }

    private static String seconds(Duration duration) {
        return String.format(Locale.ROOT, "%.1f", duration.toNanos() / 1_000_000_000.0);
    }
}
