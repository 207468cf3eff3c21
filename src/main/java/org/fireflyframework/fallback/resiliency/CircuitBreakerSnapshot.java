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

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of one stage circuit breaker.
 */
@Value
@Builder
@Schema(description = "State of a stage circuit breaker")
public class CircuitBreakerSnapshot {

    @Schema(description = "Stage guarded by the breaker", example = "primary-api")
    String stageName;

    @Schema(description = "Current breaker state", example = "CLOSED")
    CircuitBreakerState state;

    @Schema(description = "Failures recorded since the last success or half-open transition", example = "0")
    int consecutiveFailures;

    @Schema(description = "When the last failure was recorded, null if none")
    Instant lastFailureTime;

    @Schema(description = "When the breaker last changed state")
    Instant lastStateChange;
}
