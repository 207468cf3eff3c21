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

package org.fireflyframework.fallback.metrics;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@Schema(description = "An anomaly detected in stage evaluations")
public class AnomalyEvent {

    Instant timestamp;
    AnomalyType type;
    AnomalySeverity severity;
    String description;

    @Schema(description = "Stage the anomaly relates to", example = "primary-api")
    String ruleId;

    @Schema(description = "Observed value")
    double value;

    @Schema(description = "Threshold the value was compared against")
    double threshold;
}
