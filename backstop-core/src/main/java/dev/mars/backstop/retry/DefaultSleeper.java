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

import java.time.Duration;

public final class DefaultSleeper implements Sleeper {

    public static final DefaultSleeper INSTANCE = new DefaultSleeper();

    @Override
    public void sleep(Duration delay) throws InterruptedException {
        if (delay.isNegative() || delay.isZero()) {
            return;
        }
        long millis = delay.toMillis();
        int nanos = (int) (delay.minusMillis(millis).toNanos());
        Thread.sleep(millis, nanos);
    }
}
