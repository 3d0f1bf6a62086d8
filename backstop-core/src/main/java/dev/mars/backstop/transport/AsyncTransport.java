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

import io.vertx.core.Future;

/**
 * Non-blocking counterpart of {@link Transport}. A failed future carries the error; a
 * {@link TransportException} of kind TIMEOUT or NETWORK marks it as transient.
 *
 * @param <R> the response type
 */
@FunctionalInterface
public interface AsyncTransport<R extends TransportResponse> {

    Future<R> send(RequestDescription request);
}
