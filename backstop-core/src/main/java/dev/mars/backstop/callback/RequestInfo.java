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

/**
 * Payload of the on-request hook, fired before every attempt including the first.
 *
 * @param url target URL
 * @param method HTTP method
 * @param attempt 1-indexed number of the attempt about to start
 * @param maxRetries configured retry limit
 */
public record RequestInfo(String url, String method, int attempt, int maxRetries) {
}
