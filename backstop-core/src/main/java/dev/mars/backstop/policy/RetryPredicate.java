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

/**
 * Caller-supplied retry rule. When configured it replaces the status allow-list:
 * its answer is final for error statuses and transient errors, and returning true for a
 * successful response asks for another attempt.
 */
@FunctionalInterface
public interface RetryPredicate {

    boolean shouldRetry(AttemptOutcome outcome);
}
