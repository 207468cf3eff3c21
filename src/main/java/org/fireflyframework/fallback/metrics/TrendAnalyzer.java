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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Compares the most recent window of evaluations against the window before it.
 */
class TrendAnalyzer {

    static final String PROCESSING_TIME = "processing_time";
    static final String SUCCESS_RATE = "success_rate";

    private final MetricsSettings settings;

    TrendAnalyzer(MetricsSettings settings) {
        this.settings = settings;
    }

    List<TrendData> analyze(List<EvaluationMetric> history, Instant now) {
        List<TrendData> trends = new ArrayList<>();
        trend(PROCESSING_TIME, history, EvaluationMetric::getProcessingTime, now).ifPresent(trends::add);
        trend(SUCCESS_RATE, history, metric -> metric.isMatched() ? 1.0 : 0.0, now).ifPresent(trends::add);

        Set<String> stages = history.stream()
                .map(EvaluationMetric::getRuleId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        for (String stage : stages) {
            List<EvaluationMetric> stageHistory = history.stream()
                    .filter(metric -> stage.equals(metric.getRuleId()))
                    .collect(Collectors.toList());
            trend("stage:" + stage + ":" + PROCESSING_TIME, stageHistory, EvaluationMetric::getProcessingTime, now)
                    .ifPresent(trends::add);
        }
        return trends;
    }

    private Optional<TrendData> trend(String metric, List<EvaluationMetric> history,
                                      ToDoubleFunction<EvaluationMetric> extractor, Instant now) {
        int window = Math.min(settings.getTrendWindow(), history.size() / 2);
        if (window < 1) {
            return Optional.empty();
        }

        int size = history.size();
        double recent = average(history.subList(size - window, size), extractor);
        double prior = average(history.subList(size - 2 * window, size - window), extractor);

        double changeRate;
        if (prior == 0) {
            changeRate = recent == 0 ? 0 : 1;
        } else {
            changeRate = (recent - prior) / prior;
        }

        TrendDirection direction;
        if (Math.abs(changeRate) <= settings.getStableBand()) {
            direction = TrendDirection.STABLE;
        } else {
            direction = changeRate > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        }

        return Optional.of(TrendData.builder()
                .metric(metric)
                .period("last " + window + " evaluations")
                .direction(direction)
                .changeRate(changeRate)
                .prediction(recent * (1 + changeRate))
                .timestamp(now)
                .build());
    }

    private static double average(List<EvaluationMetric> window, ToDoubleFunction<EvaluationMetric> extractor) {
        return window.stream().mapToDouble(extractor).average().orElse(0);
    }
}
