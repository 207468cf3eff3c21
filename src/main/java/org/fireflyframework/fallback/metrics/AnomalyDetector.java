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

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Stateless anomaly rules applied to each recorded evaluation.
 *
 * <ul>
 *   <li>performance: z-score of the processing time against the stage baseline</li>
 *   <li>accuracy: a produced answer whose confidence is below the minimum</li>
 *   <li>pattern: a run of consecutive failures of one stage</li>
 * </ul>
 */
class AnomalyDetector {

    private static final double MIN_STD_DEV = 1.0;

    private final MetricsSettings settings;

    AnomalyDetector(MetricsSettings settings) {
        this.settings = settings;
    }

    /**
     * @param metric        the new evaluation
     * @param recentTimes   the stage's previous processing times, excluding {@code metric}
     * @param now           detection time
     */
    Optional<AnomalyEvent> detectPerformance(EvaluationMetric metric, Collection<Double> recentTimes, Instant now) {
        double mean = settings.getBaselineMeanMs();
        double stdDev = settings.getBaselineStdDevMs();

        if (recentTimes.size() >= settings.getMinBaselineSamples()) {
            mean = recentTimes.stream().mapToDouble(Double::doubleValue).average().orElse(mean);
            double m = mean;
            double variance = recentTimes.stream()
                    .mapToDouble(t -> (t - m) * (t - m))
                    .average()
                    .orElse(0);
            stdDev = Math.sqrt(variance);
        }
        stdDev = Math.max(stdDev, MIN_STD_DEV);

        double zScore = (metric.getProcessingTime() - mean) / stdDev;
        if (zScore < settings.getMediumZScore()) {
            return Optional.empty();
        }

        AnomalySeverity severity = zScore >= settings.getHighZScore() ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM;
        double threshold = mean + settings.getMediumZScore() * stdDev;
        return Optional.of(AnomalyEvent.builder()
                .timestamp(now)
                .type(AnomalyType.PERFORMANCE)
                .severity(severity)
                .description(String.format("Stage %s took %.1f ms, %.1f standard deviations above its baseline of %.1f ms",
                        metric.getRuleId(), metric.getProcessingTime(), zScore, mean))
                .ruleId(metric.getRuleId())
                .value(metric.getProcessingTime())
                .threshold(threshold)
                .build());
    }

    Optional<AnomalyEvent> detectAccuracy(EvaluationMetric metric, Instant now) {
        double minConfidence = settings.getMinConfidence();
        if (!metric.isMatched() || metric.getScore() >= minConfidence || minConfidence <= 0) {
            return Optional.empty();
        }

        double deficit = (minConfidence - metric.getScore()) / minConfidence;
        AnomalySeverity severity;
        if (deficit >= 0.75) {
            severity = AnomalySeverity.HIGH;
        } else if (deficit >= 0.5) {
            severity = AnomalySeverity.MEDIUM;
        } else {
            severity = AnomalySeverity.LOW;
        }

        return Optional.of(AnomalyEvent.builder()
                .timestamp(now)
                .type(AnomalyType.ACCURACY)
                .severity(severity)
                .description(String.format("Stage %s answered with confidence %.2f, below %.2f",
                        metric.getRuleId(), metric.getScore(), minConfidence))
                .ruleId(metric.getRuleId())
                .value(metric.getScore())
                .threshold(minConfidence)
                .build());
    }

    /**
     * Fires once when the streak reaches the threshold and once more, as HIGH, at twice the threshold.
     */
    Optional<AnomalyEvent> detectFailureStreak(String stageName, int failureStreak, Instant now) {
        int threshold = settings.getFailureStreakThreshold();
        if (threshold <= 0 || (failureStreak != threshold && failureStreak != 2 * threshold)) {
            return Optional.empty();
        }

        AnomalySeverity severity = failureStreak == threshold ? AnomalySeverity.MEDIUM : AnomalySeverity.HIGH;
        return Optional.of(AnomalyEvent.builder()
                .timestamp(now)
                .type(AnomalyType.PATTERN)
                .severity(severity)
                .description("Stage " + stageName + " failed " + failureStreak + " times in a row")
                .ruleId(stageName)
                .value(failureStreak)
                .threshold(threshold)
                .build());
    }
}
