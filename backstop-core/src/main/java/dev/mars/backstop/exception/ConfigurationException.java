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

import java.time.Duration;

/**
 * Raised eagerly when a policy, strategy or breaker is built with invalid parameters.
 * Never raised while a call is in progress.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static Duration requireNonNegative(Duration value, String name) {
        if (value == null) {
            throw new ConfigurationException(name + " must not be null");
        }
        if (value.isNegative()) {
            throw new ConfigurationException(name + " must be non-negative, got " + value);
        }
        return value;
    }

    public static Duration requirePositive(Duration value, String name) {
        if (value == null) {
            throw new ConfigurationException(name + " must not be null");
        }
        if (value.isNegative() || value.isZero()) {
            throw new ConfigurationException(name + " must be positive, got " + value);
        }
        return value;
    }
}
