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

import io.vertx.core.Future;

import java.time.Duration;

/**
 * Non-blocking suspension used by {@link AsyncRetryExecutor}: the returned future completes
 * once the delay has passed, and no thread is held meanwhile.
 */
@FunctionalInterface
public interface AsyncSleeper {

    Future<Void> sleep(Duration delay);
}
