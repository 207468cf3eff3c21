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
import java.util.List;
import java.util.Map;

/**
 * Document backing the monitoring dashboard.
 */
@Value
@Builder
@Schema(description = "Dashboard summary of fallback engine activity")
public class DashboardSummary {

    Decisions decisions;
    List<ComponentPerformance> components;
    AnomalySummary anomalies;
    List<TrendData> trends;
    Predictions predictions;
    Instant generatedAt;

    @Value
    @Builder
    public static class Decisions {
        long total;
        double matchRate;
        double averageConfidence;
        List<EvaluationMetric> recent;
        List<StageRanking> topStages;
    }

    @Value
    @Builder
    public static class StageRanking {
        String stageName;
        long evaluations;
        double successRate;
        double averageTime;

        @Schema(description = "successRate * (1000 / averageTime); higher is better")
        double performance;
    }

    @Value
    @Builder
    public static class ComponentPerformance {
        String stageName;
        long evaluations;
        double successRate;
        double averageTime;
        double averageConfidence;
    }

    @Value
    @Builder
    public static class AnomalySummary {
        long total;
        List<AnomalyEvent> recent;
        Map<AnomalyType, Long> byType;
        Map<AnomalySeverity, Long> bySeverity;
    }

    @Value
    @Builder
    public static class Predictions {
        @Schema(description = "Expected evaluations over the next hour, from the last hour")
        long nextHourLoad;

        PerformanceOutlook performanceTrend;

        @Schema(description = "Probability of at least one anomaly in the next hour", example = "0.3")
        double anomalyProbability;
    }

    public enum PerformanceOutlook {
        IMPROVING,
        DEGRADING,
        STABLE
    }
}
