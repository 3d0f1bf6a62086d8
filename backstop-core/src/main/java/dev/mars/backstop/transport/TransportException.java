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
 * Failure raised by a transport before a response was obtained.
 *
 * <p>The {@link Kind} is the only thing the retry engine looks at: TIMEOUT and NETWORK are
 * transient and may be retried, OTHER never is.</p>
 */
public class TransportException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        NETWORK,
        OTHER;

        public boolean isTransient() {
            return this == TIMEOUT || this == NETWORK;
        }
    }

    private final Kind kind;

    public TransportException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TransportException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static TransportException timeout(String message, Throwable cause) {
        return new TransportException(Kind.TIMEOUT, message, cause);
    }

    public static TransportException network(String message, Throwable cause) {
        return new TransportException(Kind.NETWORK, message, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTimeout() {
        return kind == Kind.TIMEOUT;
    }

    public boolean isTransient() {
        return kind.isTransient();
    }
}
