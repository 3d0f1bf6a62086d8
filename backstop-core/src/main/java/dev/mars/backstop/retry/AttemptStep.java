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

import dev.mars.backstop.budget.BackoffDecision;

import java.time.Duration;

/**
 * What an executor must do next: make the transport call, sleep, or stop with a result or
 * a failure.
 *
 * @param <R> the response type
 */
public final class AttemptStep<R> {

    private final LoopState state;
    private final BackoffDecision backoff;
    private final R result;
    private final Throwable failure;

    private AttemptStep(LoopState state, BackoffDecision backoff, R result, Throwable failure) {
        this.state = state;
        this.backoff = backoff;
        this.result = result;
        this.failure = failure;
    }

    static <R> AttemptStep<R> attempt() {
        return new AttemptStep<>(LoopState.ATTEMPTING, null, null, null);
    }

    static <R> AttemptStep<R> backOff(BackoffDecision backoff) {
        return new AttemptStep<>(LoopState.BACKING_OFF, backoff, null, null);
    }

    static <R> AttemptStep<R> succeeded(R result) {
        return new AttemptStep<>(LoopState.DONE, null, result, null);
    }

    static <R> AttemptStep<R> failed(Throwable failure) {
        return new AttemptStep<>(LoopState.DONE, null, null, failure);
    }

    public LoopState getState() {
        return state;
    }

    public boolean isDone() {
        return state == LoopState.DONE;
    }

    public boolean isFailure() {
        return failure != null;
    }

    public Duration getDelay() {
        return backoff != null ? backoff.finalDelay() : Duration.ZERO;
    }

    public BackoffDecision getBackoff() {
        return backoff;
    }

    public R getResult() {
        return result;
    }

    public Throwable getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return "AttemptStep{state=" + state + ", delay=" + getDelay() + ", failure=" + failure + "}";
    }
}
