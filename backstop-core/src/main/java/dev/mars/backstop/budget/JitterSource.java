package dev.mars.backstop.budget;

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

import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of the uniform random fraction used to widen backoff delays.
 */
@FunctionalInterface
public interface JitterSource {

    /**
     * @param jitterFactor upper bound, {@code > 0}
     * @return a value in {@code [0, jitterFactor)}
     */
    double next(double jitterFactor);

    static JitterSource random() {
        return jitterFactor -> ThreadLocalRandom.current().nextDouble() * jitterFactor;
    }
}
