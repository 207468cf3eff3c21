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
 * Change of a metric between the most recent window of evaluations and the one before it.
 */
@Value
@Builder
@Schema(description = "Trend of a metric across two consecutive windows")
public class TrendData {

    @Schema(description = "Metric name", example = "processing_time")
    String metric;

    @Schema(description = "Window the trend covers", example = "last 50 evaluations")
    String period;

    TrendDirection direction;

    @Schema(description = "Relative change, (recent - prior) / prior", example = "0.12")
    double changeRate;

    @Schema(description = "Projected value for the next window")
    double prediction;

    Instant timestamp;
}
