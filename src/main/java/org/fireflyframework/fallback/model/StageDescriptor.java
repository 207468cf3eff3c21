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

package org.fireflyframework.fallback.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Optional;

/**
 * Static description of one stage in the fallback cascade.
 *
 * <p>Stages run in ascending {@link #getPriority() priority}. A {@code timeoutMs}
 * of zero or less disables the per-try timeout, and a
 * {@code circuitBreakerThreshold} of zero or less means the stage has no circuit
 * breaker. The single terminal stage always has both disabled and
 * {@code retryCount == 0}.</p>
 */
@Value
@Builder(toBuilder = true)
public class StageDescriptor {

    String name;
    int priority;
    long timeoutMs;
    int retryCount;
    int circuitBreakerThreshold;

    /**
     * Confidence reported to metrics when this stage answers, in [0, 1].
     */
    @Builder.Default
    double trustScore = 1.0;

    boolean terminal;

    public Optional<Duration> timeout() {
        return timeoutMs > 0 ? Optional.of(Duration.ofMillis(timeoutMs)) : Optional.empty();
    }

    public boolean hasCircuitBreaker() {
        return circuitBreakerThreshold > 0;
    }
}
