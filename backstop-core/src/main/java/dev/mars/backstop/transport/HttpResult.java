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

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable HTTP response snapshot returned by the Backstop clients.
 *
 * <p>Headers are stored in a case-insensitive map; when a header repeats, only the first
 * value is kept.</p>
 */
public final class HttpResult implements TransportResponse {

    private final int statusCode;
    private final Map<String, String> headers;
    private final String body;

    public HttpResult(int statusCode, Map<String, String> headers, String body) {
        this.statusCode = statusCode;
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach(copy::putIfAbsent);
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body != null ? body : "";
    }

    public static HttpResult of(int statusCode) {
        return new HttpResult(statusCode, Map.of(), "");
    }

    public static HttpResult of(int statusCode, Map<String, String> headers) {
        return new HttpResult(statusCode, headers, "");
    }

    @Override
    public int statusCode() {
        return statusCode;
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    public String toString() {
        return "HttpResult{status=" + statusCode + ", headers=" + headers.size() + ", bodyLength=" + body.length() + "}";
    }
}
