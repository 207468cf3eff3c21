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
import java.util.Map;

/**
 * Immutable snapshot of everything the {@link MetricsCollector} aggregates.
 */
@Value
@Builder
@Schema(description = "Snapshot of fallback engine metrics")
public class SystemMetrics {

    long totalEvaluations;

    @Schema(description = "Mean processing time of all tries in milliseconds")
    double averageProcessingTime;

    @Schema(description = "Share of tries that produced data")
    double matchRate;

    double averageConfidence;

    Map<String, StageMetrics> stageMetrics;
    List<AnomalyEvent> anomalies;
    List<TrendData> trends;
}
