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
import dev.mars.backstop.budget.DelayCalculator;
import dev.mars.backstop.budget.TimeBudget;
import dev.mars.backstop.callback.CallbackDispatcher;
import dev.mars.backstop.callback.RetryCallbacks;
import dev.mars.backstop.circuit.CircuitBreaker;
import dev.mars.backstop.exception.CircuitOpenException;
import dev.mars.backstop.exception.NonRetryableErrorException;
import dev.mars.backstop.exception.NonRetryableStatusException;
import dev.mars.backstop.exception.ResilienceException;
import dev.mars.backstop.exception.RetriesExhaustedException;
import dev.mars.backstop.exception.TimeBudgetExceededException;
import dev.mars.backstop.policy.AttemptOutcome;
import dev.mars.backstop.policy.RetryDecision;
import dev.mars.backstop.policy.RetryDecisionPolicy;
import dev.mars.backstop.transport.HttpStatusException;
import dev.mars.backstop.transport.RequestDescription;
import dev.mars.backstop.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * The retry loop without its suspension primitive.
 *
 * <p>Executors drive it: {@link #start}, then for each attempt {@link #beforeAttempt},
 * the transport call, {@link #onResponse} or {@link #onError}, and, when the returned step
 * is BACKING_OFF, a sleep followed by {@link #advance}. Everything except the transport
 * call and the sleep lives here, so the blocking and the Vert.x executors behave identically.</p>
 *
 * <p>Holds no per-call state; one instance may serve many concurrent executions. The only
 * shared mutable collaborator is the optional {@link CircuitBreaker}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class RetryOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(RetryOrchestrator.class);

    private final RetryPolicy policy;
    private final CircuitBreaker circuitBreaker;
    private final RetryDecisionPolicy decisionPolicy;
    private final DelayCalculator delayCalculator;
    private final TimeBudget timeBudget;
    private final CallbackDispatcher callbacks;
    private final Clock clock;

    public RetryOrchestrator(RetryPolicy policy, CircuitBreaker circuitBreaker, RetryCallbacks callbacks, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.circuitBreaker = circuitBreaker;
        this.decisionPolicy = policy.newDecisionPolicy();
        this.delayCalculator = policy.newDelayCalculator();
        this.timeBudget = policy.getTimeBudget();
        this.callbacks = new CallbackDispatcher(
            callbacks != null ? callbacks : RetryCallbacks.none(), policy.getMaxRetries());
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public AttemptContext start(RequestDescription request) {
        return new AttemptContext(Objects.requireNonNull(request, "request must not be null"), clock.instant());
    }

    /**
     * ATTEMPTING: breaker gate and on-request hook. Returns DONE with a
     * {@link CircuitOpenException} when the breaker rejects the attempt.
     */
    public <R extends TransportResponse> AttemptStep<R> beforeAttempt(AttemptContext ctx) {
        ctx.setState(LoopState.ATTEMPTING);
        if (circuitBreaker != null) {
            try {
                circuitBreaker.check();
            } catch (CircuitOpenException rejection) {
                CircuitOpenException failure = rejection.forRequest(ctx.getRequest(), ctx.getAttempt(),
                    ctx.getLastStatus(), elapsed(ctx), ctx.getLastResponse());
                logger.debug("{} rejected by circuit breaker '{}' before attempt {}",
                    ctx.getRequest(), rejection.getBreakerName(), ctx.getAttempt() + 1);
                return fail(ctx, failure);
            }
        }
        callbacks.onRequest(ctx.getRequest(), ctx.getAttempt());
        return AttemptStep.attempt();
    }

    public <R extends TransportResponse> AttemptStep<R> onResponse(AttemptContext ctx, R response) {
        return evaluate(ctx, AttemptOutcome.response(response), response);
    }

    public <R extends TransportResponse> AttemptStep<R> onError(AttemptContext ctx, Throwable error) {
        return evaluate(ctx, AttemptOutcome.error(error), null);
    }

    /**
     * Moves the context to the next attempt once the backoff sleep has completed.
     */
    public void advance(AttemptContext ctx) {
        ctx.nextAttempt();
    }

    private <R extends TransportResponse> AttemptStep<R> evaluate(AttemptContext ctx, AttemptOutcome outcome,
                                                                  R response) {
        ctx.record(outcome);
        int attempt = ctx.getAttempt();
        RequestDescription request = ctx.getRequest();

        RetryDecision decision = decisionPolicy.decide(outcome, attempt, policy.getMaxRetries());
        logger.debug("{} attempt {}/{} -> {} ({})", request, attempt + 1, policy.getMaxAttempts(), decision, outcome);

        switch (decision) {
            case SUCCEED:
                if (circuitBreaker != null) {
                    circuitBreaker.recordSuccess();
                }
                ctx.setState(LoopState.DONE);
                callbacks.onSuccess(request, attempt, response, elapsed(ctx));
                return AttemptStep.succeeded(response);

            case FAIL:
                if (outcome.hasError() && !outcome.isTransientError()) {
                    // Programming and usage errors are not resilience targets: no breaker, no callbacks.
                    ctx.setState(LoopState.DONE);
                    return AttemptStep.failed(outcome.getError());
                }
                recordBreakerFailure(ctx, outcome);
                return fail(ctx, finalFailure(ctx, outcome));

            case RETRY:
            default:
                return retry(ctx, outcome);
        }
    }

    private <R extends TransportResponse> AttemptStep<R> retry(AttemptContext ctx, AttemptOutcome outcome) {
        int attempt = ctx.getAttempt();
        RequestDescription request = ctx.getRequest();

        boolean successfulResponse = outcome.hasResponse() && outcome.getResponse().statusCode() < 400;
        if (!successfulResponse || policy.isCountSuccessfulRetriesAsFailures()) {
            recordBreakerFailure(ctx, outcome);
        }

        if (attempt >= policy.getMaxRetries()) {
            ResilienceException exhausted = outcome.hasResponse()
                ? RetriesExhaustedException.afterStatus(request, attempt + 1, outcome.getResponse(), elapsed(ctx))
                : RetriesExhaustedException.afterError(request, attempt + 1, outcome.getError(), elapsed(ctx));
            return fail(ctx, exhausted);
        }

        Duration elapsed = elapsed(ctx);
        if (timeBudget.isExhausted(elapsed)) {
            AttemptOutcome last = ctx.getLastOutcome();
            TimeBudgetExceededException exceeded = new TimeBudgetExceededException(request, attempt + 1, elapsed,
                timeBudget.getMaxTotalTime().orElse(Duration.ZERO),
                last.hasResponse() ? last.getResponse() : null,
                last.hasError() ? last.getError() : null);
            logger.debug("{} out of time budget after {} ({} attempts)", request, elapsed, attempt + 1);
            return fail(ctx, exceeded);
        }

        BackoffDecision backoff = delayCalculator.compute(attempt, outcome.hasResponse() ? outcome.getResponse() : null);
        ctx.setState(LoopState.BACKING_OFF);
        callbacks.onRetry(request, attempt, backoff.finalDelay(), ctx.getLastError(), ctx.getLastStatus());
        logger.debug("{} retrying in {} (attempt {}/{})",
            request, backoff.finalDelay(), attempt + 2, policy.getMaxAttempts());
        return AttemptStep.backOff(backoff);
    }

    private ResilienceException finalFailure(AttemptContext ctx, AttemptOutcome outcome) {
        int attempts = ctx.getAttempt() + 1;
        if (outcome.hasResponse()) {
            return new NonRetryableStatusException(ctx.getRequest(), attempts, outcome.getResponse(), elapsed(ctx));
        }
        if (decisionPolicy.hasPredicate()) {
            return new NonRetryableErrorException(ctx.getRequest(), attempts, outcome.getError(), elapsed(ctx));
        }
        return RetriesExhaustedException.afterError(ctx.getRequest(), attempts, outcome.getError(), elapsed(ctx));
    }

    private <R extends TransportResponse> AttemptStep<R> fail(AttemptContext ctx, ResilienceException failure) {
        ctx.setState(LoopState.DONE);
        callbacks.onFailure(ctx.getRequest(), ctx.getAttempt(), failure, failure.getStatusCode(), elapsed(ctx));
        logger.debug("{} failed: {}", ctx.getRequest(), failure.getMessage());
        return AttemptStep.failed(failure);
    }

    private void recordBreakerFailure(AttemptContext ctx, AttemptOutcome outcome) {
        if (circuitBreaker == null) {
            return;
        }
        Throwable cause = outcome.hasError()
            ? outcome.getError()
            : new HttpStatusException(ctx.getRequest(), outcome.getResponse().statusCode());
        circuitBreaker.recordFailure(cause);
    }

    private Duration elapsed(AttemptContext ctx) {
        return Duration.between(ctx.getStartTime(), clock.instant());
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
