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
import dev.mars.backstop.transport.RequestDescription;
import dev.mars.backstop.transport.Transport;
import dev.mars.backstop.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Runs a blocking {@link Transport} under a {@link RetryPolicy} on the calling thread.
 * The only suspension point is {@link Sleeper#sleep} between attempts.
 *
 * <pre>{@code
 * RetryExecutor executor = new RetryExecutor(RetryPolicy.defaults(), breaker, RetryCallbacks.none());
 * HttpResult result = executor.execute(transport, RequestDescription.of("GET", "https://api.example.com/items"));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class RetryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryOrchestrator orchestrator;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, null, RetryCallbacks.none());
    }

    /**
     * @param circuitBreaker shared breaker, may be {@code null}
     */
    public RetryExecutor(RetryPolicy policy, CircuitBreaker circuitBreaker, RetryCallbacks callbacks) {
        this(new RetryOrchestrator(policy, circuitBreaker, callbacks, Clock.systemUTC()), DefaultSleeper.INSTANCE);
    }

    public RetryExecutor(RetryOrchestrator orchestrator, Sleeper sleeper) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Executes {@code transport} until it succeeds or the policy gives up.
     *
     * @return the successful response
     * @throws dev.mars.backstop.exception.ResilienceException when retrying stops
     * @throws InterruptedException if interrupted while sleeping between attempts
     */
    public <R extends TransportResponse> R execute(Transport<R> transport, RequestDescription request)
            throws InterruptedException {
        Objects.requireNonNull(transport, "transport must not be null");
        AttemptContext ctx = orchestrator.start(request);

        while (true) {
            AttemptStep<R> step = orchestrator.beforeAttempt(ctx);
            if (step.isDone()) {
                return complete(step);
            }

            R response = null;
            RuntimeException error = null;
            try {
                response = transport.send(request);
            } catch (RuntimeException e) {
                error = e;
            }

            step = error != null ? orchestrator.onError(ctx, error) : orchestrator.onResponse(ctx, response);
            if (step.isDone()) {
                return complete(step);
            }

            try {
                sleeper.sleep(step.getDelay());
            } catch (InterruptedException e) {
                logger.debug("{} interrupted while backing off before attempt {}", request, ctx.getAttempt() + 2);
                throw e;
            }
            orchestrator.advance(ctx);
        }
    }

    private static <R> R complete(AttemptStep<R> step) {
        if (!step.isFailure()) {
            return step.getResult();
        }
        Throwable failure = step.getFailure();
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        throw new IllegalStateException("Unexpected checked failure", failure);
    }

    public RetryOrchestrator getOrchestrator() {
        return orchestrator;
    }
}
