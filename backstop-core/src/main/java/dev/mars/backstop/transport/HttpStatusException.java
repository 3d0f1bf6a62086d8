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

/**
 * Describes an attempt that completed with an unwanted status code. It is never thrown by
 * the engine; it is the failure handed to the circuit breaker and attached as cause to the
 * final exception when the last attempt ended with a status rather than an error.
 */
public class HttpStatusException extends RuntimeException {

    private final int statusCode;
    private final RequestDescription request;

    public HttpStatusException(RequestDescription request, int statusCode) {
        super(request.method() + " request to " + request.url() + " failed with status " + statusCode);
        this.request = request;
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public RequestDescription getRequest() {
        return request;
    }
}
