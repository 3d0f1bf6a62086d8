package dev.mars.backstop.callback;

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
 * Payload of the on-failure hook, fired exactly once when a call gives up, including
 * time budget aborts and circuit breaker rejections.
 *
 * @param url target URL
 * @param method HTTP method
 * @param attempt 1-indexed number of the final attempt
 * @param maxRetries configured retry limit
 * @param error the exception the caller will receive
 * @param statusCode last status code, or {@code null}
 * @param totalTime time since the call started
 */
public record FailureInfo(String url, String method, int attempt, int maxRetries, Throwable error,
                          Integer statusCode, Duration totalTime) {
}
