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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Bounds and thresholds of the {@link MetricsCollector}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSettings {

    /**
     * Evaluations kept in the rolling history.
     */
    @Builder.Default
    private int historySize = 1000;

    /**
     * Recent scores and processing times kept per stage.
     */
    @Builder.Default
    private int scoreHistorySize = 100;

    @Builder.Default
    private int maxAnomalies = 100;

    @Builder.Default
    private Duration anomalyRetention = Duration.ofHours(24);

    @Builder.Default
    private int maxTrends = 50;

    /**
     * Evaluations per trend window.
     */
    @Builder.Default
    private int trendWindow = 50;

    /**
     * Static performance baseline used until a stage has enough samples.
     */
    @Builder.Default
    private double baselineMeanMs = 100;

    @Builder.Default
    private double baselineStdDevMs = 50;

    @Builder.Default
    private int minBaselineSamples = 10;

    @Builder.Default
    private double mediumZScore = 2.0;

    @Builder.Default
    private double highZScore = 3.0;

    @Builder.Default
    private double minConfidence = 0.4;

    @Builder.Default
    private int failureStreakThreshold = 5;

    /**
     * Relative change within which a trend is reported as stable.
     */
    @Builder.Default
    private double stableBand = 0.05;

    public static MetricsSettings defaults() {
        return MetricsSettings.builder().build();
    }
}
