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

import dev.mars.backstop.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * Parses the {@code Retry-After} response header in its delay-seconds form.
 * Missing, negative or non-numeric values (including HTTP dates) are ignored.
 */
public final class RetryAfter {
    private static final Logger logger = LoggerFactory.getLogger(RetryAfter.class);

    public static final String HEADER = "Retry-After";

    /** Longest delay representable in nanoseconds; larger values saturate to it. */
    public static final Duration MAX_DELAY = Duration.ofNanos(Long.MAX_VALUE);

    private static final BigDecimal MAX_NANOS = BigDecimal.valueOf(Long.MAX_VALUE);

    private RetryAfter() {
    }

    public static Optional<Duration> from(TransportResponse response) {
        if (response == null) {
            return Optional.empty();
        }
        return response.header(HEADER).flatMap(RetryAfter::parse);
    }

    public static Optional<Duration> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        try {
            BigDecimal seconds = new BigDecimal(trimmed);
            if (seconds.signum() < 0) {
                logger.debug("Ignoring negative Retry-After value '{}'", trimmed);
                return Optional.empty();
            }
            BigDecimal nanos = seconds.movePointRight(9);
            if (nanos.compareTo(MAX_NANOS) > 0) {
                logger.debug("Retry-After value '{}' exceeds {}, saturating", trimmed, MAX_DELAY);
                return Optional.of(MAX_DELAY);
            }
            return Optional.of(Duration.ofNanos(nanos.longValue()));
        } catch (NumberFormatException | ArithmeticException e) {
            logger.debug("Ignoring unparseable Retry-After value '{}'", trimmed);
            return Optional.empty();
        }
    }
}
