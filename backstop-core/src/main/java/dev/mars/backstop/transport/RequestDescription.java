package dev.mars.backstop.transport;

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

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies the call being retried. Used in callbacks, log lines and exception messages.
 *
 * @param method upper-case HTTP method name
 * @param url target URL
 */
public record RequestDescription(String method, String url) {

    public RequestDescription {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(url, "url must not be null");
        method = method.toUpperCase(Locale.ROOT);
    }

    public static RequestDescription of(String method, String url) {
        return new RequestDescription(method, url);
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}
