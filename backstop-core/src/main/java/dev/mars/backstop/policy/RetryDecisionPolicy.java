package dev.mars.backstop.policy;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides whether a completed attempt succeeded, should be retried or has failed for good.
 *
 * <p>Rules, in order:</p>
 * <ul>
 *   <li>Status below 400: SUCCEED, unless the predicate returns true (RETRY).</li>
 *   <li>Status 400 or above: the predicate's answer if one is configured, otherwise RETRY
 *       only for statuses in the allow-list. A non-listed status is never retried.</li>
 *   <li>Transient transport error: the predicate's answer if configured, otherwise RETRY
 *       while {@code attempt < maxRetries}.</li>
 *   <li>Any other error: FAIL. The executors propagate such errors unchanged.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class RetryDecisionPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RetryDecisionPolicy.class);

    private final Set<Integer> retryableStatuses;
    private final RetryPredicate predicate;

    public RetryDecisionPolicy(Set<Integer> retryableStatuses, RetryPredicate predicate) {
        this.retryableStatuses = retryableStatuses == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new TreeSet<>(retryableStatuses));
        this.predicate = predicate;
    }

    public RetryDecision decide(AttemptOutcome outcome, int attempt, int maxRetries) {
        if (outcome.hasResponse()) {
            return decideResponse(outcome, outcome.getResponse().statusCode());
        }
        if (outcome.isTransientError()) {
            return decideTransientError(outcome, attempt, maxRetries);
        }
        logger.debug("Attempt {} raised non-transient error {}, not retrying",
            attempt + 1, outcome.getError().getClass().getSimpleName());
        return RetryDecision.FAIL;
    }

    private RetryDecision decideResponse(AttemptOutcome outcome, int status) {
        if (status < 400) {
            if (predicate != null && predicate.shouldRetry(outcome)) {
                logger.debug("Retry predicate requested retry for successful status {}", status);
                return RetryDecision.RETRY;
            }
            return RetryDecision.SUCCEED;
        }
        if (predicate != null) {
            return predicate.shouldRetry(outcome) ? RetryDecision.RETRY : RetryDecision.FAIL;
        }
        return retryableStatuses.contains(status) ? RetryDecision.RETRY : RetryDecision.FAIL;
    }

    private RetryDecision decideTransientError(AttemptOutcome outcome, int attempt, int maxRetries) {
        if (predicate != null) {
            return predicate.shouldRetry(outcome) ? RetryDecision.RETRY : RetryDecision.FAIL;
        }
        return attempt < maxRetries ? RetryDecision.RETRY : RetryDecision.FAIL;
    }

    public Set<Integer> getRetryableStatuses() {
        return retryableStatuses;
    }

    public boolean hasPredicate() {
        return predicate != null;
    }
}
