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

import dev.mars.backstop.callback.RetryCallbacks;
import dev.mars.backstop.circuit.CircuitBreaker;
import dev.mars.backstop.logging.CorrelationContext;
import dev.mars.backstop.transport.AsyncTransport;
import dev.mars.backstop.transport.RequestDescription;
import dev.mars.backstop.transport.TransportResponse;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an {@link AsyncTransport} under a {@link RetryPolicy} without blocking. Backoff
 * sleeps are Vert.x timers, so this is safe to call from an event loop.
 *
 * <p>Shares {@link RetryOrchestrator} with {@link RetryExecutor}; only the suspension
 * differs. The caller's MDC is captured on entry and re-applied around every continuation.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class AsyncRetryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(AsyncRetryExecutor.class);

    private final RetryOrchestrator orchestrator;
    private final AsyncSleeper sleeper;

    public AsyncRetryExecutor(Vertx vertx, RetryPolicy policy) {
        this(vertx, policy, null, RetryCallbacks.none());
    }

    /**
     * @param circuitBreaker shared breaker, may be {@code null}
     */
    public AsyncRetryExecutor(Vertx vertx, RetryPolicy policy, CircuitBreaker circuitBreaker, RetryCallbacks callbacks) {
        this(new RetryOrchestrator(policy, circuitBreaker, callbacks, Clock.systemUTC()), new VertxTimerSleeper(vertx));
    }

    public AsyncRetryExecutor(RetryOrchestrator orchestrator, AsyncSleeper sleeper) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * @return a future completed with the successful response, or failed with the
     *         {@link dev.mars.backstop.exception.ResilienceException} that stopped retrying
     */
    public <R extends TransportResponse> Future<R> execute(AsyncTransport<R> transport, RequestDescription request) {
        Objects.requireNonNull(transport, "transport must not be null");
        Map<String, String> mdc = CorrelationContext.capture();
        Promise<R> promise = Promise.promise();
        AttemptContext ctx;
        try {
            ctx = orchestrator.start(request);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
        attempt(transport, ctx, mdc, promise);
        return promise.future();
    }

    private static final int RUNNING = 0;
    private static final int RESUME_INLINE = 1;
    private static final int DETACHED = 2;

    /**
     * Runs attempts until one of them has to wait on a future that is not yet complete.
     * Attempts whose transport call and backoff both complete synchronously continue in
     * this loop instead of recursing, so the stack stays flat however many retries run.
     */
    private <R extends TransportResponse> void attempt(AsyncTransport<R> transport, AttemptContext ctx,
                                                       Map<String, String> mdc, Promise<R> promise) {
        while (true) {
            AtomicInteger handoff = new AtomicInteger(RUNNING);
            runAttempt(transport, ctx, mdc, promise, () -> {
                if (!handoff.compareAndSet(RUNNING, RESUME_INLINE)) {
                    attempt(transport, ctx, mdc, promise);
                }
            });
            if (handoff.compareAndSet(RUNNING, DETACHED)) {
                // Finished, or the next attempt will be started by a later continuation
                return;
            }
        }
    }

    private <R extends TransportResponse> void runAttempt(AsyncTransport<R> transport, AttemptContext ctx,
                                                          Map<String, String> mdc, Promise<R> promise,
                                                          Runnable next) {
        AttemptStep<R> step;
        try {
            step = orchestrator.beforeAttempt(ctx);
        } catch (RuntimeException e) {
            promise.tryFail(e);
            return;
        }
        if (step.isDone()) {
            complete(step, promise);
            return;
        }

        Future<R> call;
        try {
            call = transport.send(ctx.getRequest());
        } catch (RuntimeException e) {
            call = Future.failedFuture(e);
        }
        if (call == null) {
            call = Future.failedFuture(new IllegalStateException("Transport returned a null future"));
        }

        call.onComplete(ar -> {
            try (CorrelationContext.Scope scope = CorrelationContext.apply(mdc)) {
                AttemptStep<R> outcome;
                try {
                    outcome = ar.succeeded()
                        ? orchestrator.onResponse(ctx, ar.result())
                        : orchestrator.onError(ctx, ar.cause());
                } catch (RuntimeException e) {
                    promise.tryFail(e);
                    return;
                }
                if (outcome.isDone()) {
                    complete(outcome, promise);
                    return;
                }
                sleeper.sleep(outcome.getDelay()).onComplete(slept -> {
                    try (CorrelationContext.Scope resumed = CorrelationContext.apply(mdc)) {
                        if (slept.failed()) {
                            logger.debug("{} backoff timer failed: {}", ctx.getRequest(), slept.cause().getMessage());
                            promise.tryFail(slept.cause());
                            return;
                        }
                        orchestrator.advance(ctx);
                        next.run();
                    }
                });
            }
        });
    }

    private static <R> void complete(AttemptStep<R> step, Promise<R> promise) {
        if (step.isFailure()) {
            promise.tryFail(step.getFailure());
        } else {
            promise.tryComplete(step.getResult());
        }
    }

    public RetryOrchestrator getOrchestrator() {
        return orchestrator;
    }
}
