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

import dev.mars.backstop.test.categories.TestCategories;
import dev.mars.backstop.transport.HttpResult;
import dev.mars.backstop.transport.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RetryDecisionPolicy: allow-list, predicate override and error classification.
 */
@Tag(TestCategories.CORE)
class RetryDecisionPolicyTest {

    private RetryDecisionPolicy allowList;

    @BeforeEach
    void setUp() {
        allowList = new RetryDecisionPolicy(Set.of(429, 500, 502, 503, 504), null);
    }

    @Test
    void testSuccessfulStatusSucceeds() {
        assertEquals(RetryDecision.SUCCEED, allowList.decide(AttemptOutcome.response(HttpResult.of(200)), 0, 3));
        assertEquals(RetryDecision.SUCCEED, allowList.decide(AttemptOutcome.response(HttpResult.of(304)), 0, 3));
    }

    @Test
    void testAllowListedStatusRetries() {
        assertEquals(RetryDecision.RETRY, allowList.decide(AttemptOutcome.response(HttpResult.of(503)), 0, 3));
        assertEquals(RetryDecision.RETRY, allowList.decide(AttemptOutcome.response(HttpResult.of(429)), 3, 3));
    }

    @Test
    void testOtherErrorStatusFails() {
        assertEquals(RetryDecision.FAIL, allowList.decide(AttemptOutcome.response(HttpResult.of(404)), 0, 3));
        assertEquals(RetryDecision.FAIL, allowList.decide(AttemptOutcome.response(HttpResult.of(501)), 0, 3));
    }

    @Test
    void testTransientErrorsRetryUntilLastAttempt() {
        AttemptOutcome timeout = AttemptOutcome.error(TransportException.timeout("read timed out", null));
        AttemptOutcome network = AttemptOutcome.error(TransportException.network("connection refused", null));

        assertEquals(RetryDecision.RETRY, allowList.decide(timeout, 0, 2));
        assertEquals(RetryDecision.RETRY, allowList.decide(network, 1, 2));
        assertEquals(RetryDecision.FAIL, allowList.decide(network, 2, 2));
    }

    @Test
    void testNonTransientErrorsFailImmediately() {
        AttemptOutcome bug = AttemptOutcome.error(new IllegalArgumentException("bad url"));
        AttemptOutcome other = AttemptOutcome.error(
            new TransportException(TransportException.Kind.OTHER, "TLS handshake rejected"));

        assertEquals(RetryDecision.FAIL, allowList.decide(bug, 0, 3));
        assertEquals(RetryDecision.FAIL, allowList.decide(other, 0, 3));
    }

    @Test
    void testPredicateReplacesAllowList() {
        RetryDecisionPolicy policy = new RetryDecisionPolicy(Set.of(503),
            outcome -> outcome.statusCode().map(status -> status == 404).orElse(false));

        assertEquals(RetryDecision.RETRY, policy.decide(AttemptOutcome.response(HttpResult.of(404)), 0, 3));
        assertEquals(RetryDecision.FAIL, policy.decide(AttemptOutcome.response(HttpResult.of(503)), 0, 3));
        assertTrue(policy.hasPredicate());
    }

    @Test
    void testPredicateCanRetrySuccessfulResponse() {
        RetryDecisionPolicy policy = new RetryDecisionPolicy(Set.of(),
            outcome -> outcome.hasResponse()
                && "pending".equals(((HttpResult) outcome.getResponse()).getBody()));

        HttpResult pending = new HttpResult(200, Map.of(), "pending");
        HttpResult done = new HttpResult(200, Map.of(), "done");

        assertEquals(RetryDecision.RETRY, policy.decide(AttemptOutcome.response(pending), 0, 3));
        assertEquals(RetryDecision.SUCCEED, policy.decide(AttemptOutcome.response(done), 0, 3));
    }

    @Test
    void testPredicateDecidesTransientErrorsButNotProgrammingErrors() {
        RetryDecisionPolicy never = new RetryDecisionPolicy(Set.of(), outcome -> false);
        RetryDecisionPolicy always = new RetryDecisionPolicy(Set.of(), outcome -> true);

        AttemptOutcome timeout = AttemptOutcome.error(TransportException.timeout("timeout", null));
        assertEquals(RetryDecision.FAIL, never.decide(timeout, 0, 3));
        assertEquals(RetryDecision.RETRY, always.decide(timeout, 0, 3));
        assertEquals(RetryDecision.FAIL, always.decide(AttemptOutcome.error(new NullPointerException()), 0, 3));
    }

    @Test
    void testOutcomeAccessors() {
        AttemptOutcome response = AttemptOutcome.response(HttpResult.of(201));
        AttemptOutcome error = AttemptOutcome.error(TransportException.network("reset", null));

        assertTrue(response.hasResponse());
        assertEquals(201, response.statusCode().orElseThrow());
        assertThrows(IllegalStateException.class, response::getError);
        assertTrue(error.hasError());
        assertTrue(error.isTransientError());
        assertTrue(error.statusCode().isEmpty());
        assertThrows(IllegalStateException.class, error::getResponse);
    }
}
