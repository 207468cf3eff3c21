/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.fallback.resiliency;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

/**
 * Externally visible state of a stage circuit breaker.
 */
public enum CircuitBreakerState {

    CLOSED,
    OPEN,
    HALF_OPEN;

    /**
     * Maps a Resilience4j state onto the three states reported by the engine.
     * Forced-open counts as open; disabled and metrics-only breakers never block calls.
     *
     * @param state the Resilience4j state
     * @return the reported state
     */
    public static CircuitBreakerState from(CircuitBreaker.State state) {
        switch (state) {
            case OPEN:
            case FORCED_OPEN:
                return OPEN;
            case HALF_OPEN:
                return HALF_OPEN;
            default:
                return CLOSED;
        }
    }
}
