package dev.mars.backstop.retry;

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

import dev.mars.backstop.policy.AttemptOutcome;
import dev.mars.backstop.transport.RequestDescription;
import dev.mars.backstop.transport.TransportResponse;

import java.time.Instant;

/**
 * Per-call state of the retry loop. Owned by a single execution and never shared, so it
 * needs no synchronization; the async executor only touches it from one continuation at a time.
 *
 * <p>The last error and last status are tracked independently: a response does not clear an
 * earlier error and vice versa.</p>
 */
public final class AttemptContext {

    private final RequestDescription request;
    private final Instant startTime;
    private int attempt;
    private LoopState state = LoopState.ATTEMPTING;
    private AttemptOutcome lastOutcome;
    private Throwable lastError;
    private Integer lastStatus;
    private TransportResponse lastResponse;

    AttemptContext(RequestDescription request, Instant startTime) {
        this.request = request;
        this.startTime = startTime;
    }

    void record(AttemptOutcome outcome) {
        this.lastOutcome = outcome;
        if (outcome.hasResponse()) {
            this.lastResponse = outcome.getResponse();
            this.lastStatus = lastResponse.statusCode();
        } else {
            this.lastError = outcome.getError();
        }
    }

    void nextAttempt() {
        attempt++;
    }

    void setState(LoopState state) {
        this.state = state;
    }

    public RequestDescription getRequest() {
        return request;
    }

    public Instant getStartTime() {
        return startTime;
    }

    /**
     * @return zero-indexed number of the current attempt
     */
    public int getAttempt() {
        return attempt;
    }

    public LoopState getState() {
        return state;
    }

    public AttemptOutcome getLastOutcome() {
        return lastOutcome;
    }

    public Throwable getLastError() {
        return lastError;
    }

    public Integer getLastStatus() {
        return lastStatus;
    }

    public TransportResponse getLastResponse() {
        return lastResponse;
    }
}
