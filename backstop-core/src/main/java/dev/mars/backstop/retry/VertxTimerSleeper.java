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
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link AsyncSleeper} backed by {@code vertx.setTimer}. Timers have millisecond
 * resolution, so sub-millisecond remainders round up; a zero delay completes immediately.
 */
public class VertxTimerSleeper implements AsyncSleeper {

    private final Vertx vertx;

    public VertxTimerSleeper(Vertx vertx) {
        this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
    }

    @Override
    public Future<Void> sleep(Duration delay) {
        if (delay.isNegative() || delay.isZero()) {
            return Future.succeededFuture();
        }
        long millis = delay.toMillis();
        if (delay.minusMillis(millis).toNanos() > 0) {
            millis++;
        }
        Promise<Void> promise = Promise.promise();
        vertx.setTimer(millis, id -> promise.complete());
        return promise.future();
    }
}
