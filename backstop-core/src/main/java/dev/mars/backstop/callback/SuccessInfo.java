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

import dev.mars.backstop.transport.TransportResponse;

import java.time.Duration;

/**
 * Payload of the on-success hook, fired exactly once when a call succeeds.
 *
 * @param url target URL
 * @param method HTTP method
 * @param attempt 1-indexed number of the succeeding attempt
 * @param maxRetries configured retry limit
 * @param response the successful response
 * @param totalTime time since the call started
 */
public record SuccessInfo(String url, String method, int attempt, int maxRetries, TransportResponse response,
                          Duration totalTime) {
}
