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

/**
 * Phases of one execution of the retry loop. Classifying an outcome is the transition
 * out of ATTEMPTING, not a phase of its own.
 */
public enum LoopState {
    ATTEMPTING,   // Breaker gate passed, transport call in flight
    BACKING_OFF,  // Sleeping before the next attempt
    DONE          // Success or failure already reported
}
