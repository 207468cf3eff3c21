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

/**
 * Outcome of one try of one stage.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Outcome of a single stage try")
public class EvaluationMetric {

    @Schema(description = "Correlation id of the cascade")
    String requestId;

    @Schema(description = "Stage that was tried", example = "primary-api")
    String ruleId;

    @Schema(description = "Duration of the try in milliseconds", example = "42.0")
    double processingTime;

    @Schema(description = "Whether the try produced data")
    boolean matched;

    @Schema(description = "Confidence in the produced data, 0 on failure", example = "1.0")
    double score;

    /**
     * When the try finished. Left unset by callers, it is stamped by
     * {@link MetricsCollector} from its clock.
     */
    Instant timestamp;
}
