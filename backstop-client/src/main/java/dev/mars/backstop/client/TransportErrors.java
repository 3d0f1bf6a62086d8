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

package dev.mars.backstop.client;

import dev.mars.backstop.transport.TransportException;
import io.vertx.core.http.HttpClosedException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures raised by the JDK {@code HttpClient} and the Vert.x {@code WebClient} onto
 * {@link TransportException} kinds, so the retry engine can tell transient failures from bugs.
 *
 * <ul>
 *   <li>TIMEOUT: {@link HttpTimeoutException}, {@link SocketTimeoutException}, {@link TimeoutException},
 *       or any failure whose message mentions a timeout</li>
 *   <li>NETWORK: refused or dropped connections, unknown hosts, other {@link IOException}s</li>
 *   <li>OTHER: everything else</li>
 * </ul>
 */
public final class TransportErrors {

    private TransportErrors() {
    }

    public static TransportException classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TransportException) {
            return (TransportException) cause;
        }
        String message = describe(cause);

        if (isTimeout(cause)) {
            return new TransportException(TransportException.Kind.TIMEOUT, message, cause);
        }
        if (cause instanceof ConnectException
                || cause instanceof UnknownHostException
                || cause instanceof ClosedChannelException
                || cause instanceof HttpClosedException
                || cause instanceof IOException) {
            return new TransportException(TransportException.Kind.NETWORK, message, cause);
        }
        return new TransportException(TransportException.Kind.OTHER, message, cause);
    }

    private static boolean isTimeout(Throwable cause) {
        if (cause instanceof HttpTimeoutException
                || cause instanceof SocketTimeoutException
                || cause instanceof TimeoutException) {
            return true;
        }
        String message = cause.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("timeout") || lower.contains("timed out");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
