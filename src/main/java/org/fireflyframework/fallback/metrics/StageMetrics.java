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

import java.util.List;

@Value
@Builder
@Schema(description = "Aggregated evaluations of one stage")
public class StageMetrics {

    String stageName;
    long evaluationCount;
    long matchCount;

    @Schema(description = "Mean processing time in milliseconds")
    double averageTime;

    @Schema(description = "Mean confidence over all evaluations")
    double averageScore;

    @Schema(description = "Most recent scores, oldest first")
    List<Double> recentScores;

    double successRate;
}
