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

import java.util.EnumMap;
import java.util.Map;

/**
 * Renders a {@link SystemMetrics} snapshot in the Prometheus text exposition format.
 */
final class MetricsExpositionRenderer {

    private static final String PREFIX = "firefly_fallback_";

    private MetricsExpositionRenderer() {
    }

    static String render(SystemMetrics metrics) {
        StringBuilder out = new StringBuilder();

        family(out, "evaluations_total", "counter", "Total stage tries recorded.");
        sample(out, "evaluations_total", null, metrics.getTotalEvaluations());

        family(out, "avg_processing_time_ms", "gauge", "Mean processing time of a stage try in milliseconds.");
        sample(out, "avg_processing_time_ms", null, metrics.getAverageProcessingTime());

        family(out, "match_rate", "gauge", "Share of stage tries that produced data.");
        sample(out, "match_rate", null, metrics.getMatchRate());

        family(out, "average_confidence", "gauge", "Mean confidence of stage tries.");
        sample(out, "average_confidence", null, metrics.getAverageConfidence());

        if (!metrics.getStageMetrics().isEmpty()) {
            family(out, "stage_evaluations_total", "counter", "Tries recorded per stage.");
            metrics.getStageMetrics().forEach((stage, stats) ->
                    sample(out, "stage_evaluations_total", "stage=\"" + escape(stage) + "\"", stats.getEvaluationCount()));

            family(out, "stage_success_rate", "gauge", "Share of tries that produced data, per stage.");
            metrics.getStageMetrics().forEach((stage, stats) ->
                    sample(out, "stage_success_rate", "stage=\"" + escape(stage) + "\"", stats.getSuccessRate()));

            family(out, "stage_avg_processing_time_ms", "gauge", "Mean processing time per stage in milliseconds.");
            metrics.getStageMetrics().forEach((stage, stats) ->
                    sample(out, "stage_avg_processing_time_ms", "stage=\"" + escape(stage) + "\"", stats.getAverageTime()));
        }

        if (!metrics.getAnomalies().isEmpty()) {
            Map<AnomalyType, Map<AnomalySeverity, Long>> counts = new EnumMap<>(AnomalyType.class);
            metrics.getAnomalies().forEach(anomaly -> counts
                    .computeIfAbsent(anomaly.getType(), type -> new EnumMap<>(AnomalySeverity.class))
                    .merge(anomaly.getSeverity(), 1L, Long::sum));

            family(out, "anomalies", "gauge", "Retained anomalies by type and severity.");
            counts.forEach((type, bySeverity) -> bySeverity.forEach((severity, count) ->
                    sample(out, "anomalies", "type=\"" + type.name().toLowerCase() + "\",severity=\""
                            + severity.name().toLowerCase() + "\"", count)));
        }

        return out.toString();
    }

    static String escape(String labelValue) {
        return labelValue
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n");
    }

    private static void family(StringBuilder out, String name, String type, String help) {
        out.append("# HELP ").append(PREFIX).append(name).append(' ').append(help).append('\n');
        out.append("# TYPE ").append(PREFIX).append(name).append(' ').append(type).append('\n');
    }

    private static void sample(StringBuilder out, String name, String labels, long value) {
        sampleLine(out, name, labels).append(value).append('\n');
    }

    private static void sample(StringBuilder out, String name, String labels, double value) {
        sampleLine(out, name, labels).append(value).append('\n');
    }

    private static StringBuilder sampleLine(StringBuilder out, String name, String labels) {
        out.append(PREFIX).append(name);
        if (labels != null) {
            out.append('{').append(labels).append('}');
        }
        return out.append(' ');
    }
}
