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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.fallback.event.AnomalyDetectedEvent;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Aggregates stage evaluations into rolling statistics, anomalies and trends.
 *
 * <p>All aggregates are guarded by a single lock. Events and Micrometer
 * recordings happen outside of it. Histories are bounded and evict their oldest
 * entries first.</p>
 */
@Slf4j
public class MetricsCollector implements AutoCloseable {

    private static final int RECENT_DECISIONS = 20;
    private static final int RECENT_ANOMALIES = 10;
    private static final int TOP_STAGES = 5;
    private static final double OUTLOOK_CHANGE = 0.1;
    private static final String TIMER_NAME = "firefly.fallback.stage.duration";

    private final MetricsSettings settings;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final AnomalyDetector anomalyDetector;
    private final TrendAnalyzer trendAnalyzer;

    private final Object lock = new Object();
    private final Map<String, StageAccumulator> stages = new LinkedHashMap<>();
    private final Deque<EvaluationMetric> history = new ArrayDeque<>();
    private final Deque<AnomalyEvent> anomalies = new ArrayDeque<>();
    private final Deque<TrendData> trends = new ArrayDeque<>();
    private long totalEvaluations;
    private long matchCount;
    private double averageProcessingTime;
    private double averageConfidence;

    private volatile Disposable periodicAnalysis;

    public MetricsCollector(MetricsSettings settings) {
        this(settings, null, null);
    }

    public MetricsCollector(MetricsSettings settings,
                            ApplicationEventPublisher eventPublisher,
                            MeterRegistry meterRegistry) {
        this(settings, eventPublisher, meterRegistry, Clock.systemUTC());
    }

    MetricsCollector(MetricsSettings settings,
                     ApplicationEventPublisher eventPublisher,
                     MeterRegistry meterRegistry,
                     Clock clock) {
        this.settings = settings;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.anomalyDetector = new AnomalyDetector(settings);
        this.trendAnalyzer = new TrendAnalyzer(settings);
    }

    /**
     * Records the outcome of one stage try and runs anomaly detection on it.
     *
     * @param evaluation the evaluation
     */
    public void recordEvaluation(EvaluationMetric evaluation) {
        Instant now = clock.instant();
        EvaluationMetric metric = evaluation.getTimestamp() != null
                ? evaluation
                : evaluation.toBuilder().timestamp(now).build();
        List<AnomalyEvent> detected = new ArrayList<>();

        synchronized (lock) {
            totalEvaluations++;
            if (metric.isMatched()) {
                matchCount++;
            }
            averageProcessingTime += (metric.getProcessingTime() - averageProcessingTime) / totalEvaluations;
            averageConfidence += (metric.getScore() - averageConfidence) / totalEvaluations;

            StageAccumulator stage = stages.computeIfAbsent(metric.getRuleId(), StageAccumulator::new);
            anomalyDetector.detectPerformance(metric, stage.recentTimes, now).ifPresent(detected::add);
            stage.record(metric, settings.getScoreHistorySize());
            anomalyDetector.detectAccuracy(metric, now).ifPresent(detected::add);
            if (!metric.isMatched()) {
                anomalyDetector.detectFailureStreak(stage.name, stage.failureStreak, now).ifPresent(detected::add);
            }

            append(history, metric, settings.getHistorySize());
            detected.forEach(anomaly -> append(anomalies, anomaly, settings.getMaxAnomalies()));
            pruneAnomalies(now);
        }

        detected.forEach(this::publish);
        recordTimer(metric);
    }

    /**
     * Computes trends over the current history and appends them to the bounded trend list.
     *
     * @return the trends computed by this call
     */
    public List<TrendData> analyzeTrends() {
        Instant now = clock.instant();
        synchronized (lock) {
            List<TrendData> computed = trendAnalyzer.analyze(new ArrayList<>(history), now);
            computed.forEach(trend -> append(trends, trend, settings.getMaxTrends()));
            pruneAnomalies(now);
            log.debug("Computed {} trends over {} evaluations", computed.size(), history.size());
            return computed;
        }
    }

    public SystemMetrics getMetrics() {
        synchronized (lock) {
            Map<String, StageMetrics> stageMetrics = new LinkedHashMap<>();
            stages.forEach((name, stage) -> stageMetrics.put(name, stage.snapshot()));
            return SystemMetrics.builder()
                    .totalEvaluations(totalEvaluations)
                    .averageProcessingTime(averageProcessingTime)
                    .matchRate(totalEvaluations == 0 ? 0 : (double) matchCount / totalEvaluations)
                    .averageConfidence(averageConfidence)
                    .stageMetrics(Collections.unmodifiableMap(stageMetrics))
                    .anomalies(List.copyOf(anomalies))
                    .trends(List.copyOf(trends))
                    .build();
        }
    }

    /**
     * Renders the current metrics in the Prometheus text exposition format.
     *
     * @return the exposition text
     */
    public String getMonitoringExposition() {
        return MetricsExpositionRenderer.render(getMetrics());
    }

    public DashboardSummary getDashboardSummary() {
        Instant now = clock.instant();
        Instant hourAgo = now.minus(Duration.ofHours(1));
        SystemMetrics metrics = getMetrics();

        List<EvaluationMetric> recent;
        long lastHourLoad;
        synchronized (lock) {
            List<EvaluationMetric> all = new ArrayList<>(history);
            recent = List.copyOf(all.subList(Math.max(0, all.size() - RECENT_DECISIONS), all.size()));
            lastHourLoad = all.stream().filter(metric -> !metric.getTimestamp().isBefore(hourAgo)).count();
        }

        List<DashboardSummary.StageRanking> topStages = metrics.getStageMetrics().values().stream()
                .map(stage -> DashboardSummary.StageRanking.builder()
                        .stageName(stage.getStageName())
                        .evaluations(stage.getEvaluationCount())
                        .successRate(stage.getSuccessRate())
                        .averageTime(stage.getAverageTime())
                        .performance(stage.getSuccessRate() * (1000.0 / Math.max(stage.getAverageTime(), 1.0)))
                        .build())
                .sorted(Comparator.comparingDouble(DashboardSummary.StageRanking::getPerformance).reversed())
                .limit(TOP_STAGES)
                .collect(Collectors.toList());

        List<DashboardSummary.ComponentPerformance> components = metrics.getStageMetrics().values().stream()
                .map(stage -> DashboardSummary.ComponentPerformance.builder()
                        .stageName(stage.getStageName())
                        .evaluations(stage.getEvaluationCount())
                        .successRate(stage.getSuccessRate())
                        .averageTime(stage.getAverageTime())
                        .averageConfidence(stage.getAverageScore())
                        .build())
                .collect(Collectors.toList());

        List<AnomalyEvent> allAnomalies = metrics.getAnomalies();
        Map<AnomalyType, Long> byType = new EnumMap<>(AnomalyType.class);
        Map<AnomalySeverity, Long> bySeverity = new EnumMap<>(AnomalySeverity.class);
        allAnomalies.forEach(anomaly -> {
            byType.merge(anomaly.getType(), 1L, Long::sum);
            bySeverity.merge(anomaly.getSeverity(), 1L, Long::sum);
        });
        long lastHourAnomalies = allAnomalies.stream()
                .filter(anomaly -> !anomaly.getTimestamp().isBefore(hourAgo))
                .count();

        return DashboardSummary.builder()
                .decisions(DashboardSummary.Decisions.builder()
                        .total(metrics.getTotalEvaluations())
                        .matchRate(metrics.getMatchRate())
                        .averageConfidence(metrics.getAverageConfidence())
                        .recent(recent)
                        .topStages(topStages)
                        .build())
                .components(components)
                .anomalies(DashboardSummary.AnomalySummary.builder()
                        .total(allAnomalies.size())
                        .recent(List.copyOf(allAnomalies.subList(
                                Math.max(0, allAnomalies.size() - RECENT_ANOMALIES), allAnomalies.size())))
                        .byType(byType)
                        .bySeverity(bySeverity)
                        .build())
                .trends(metrics.getTrends())
                .predictions(DashboardSummary.Predictions.builder()
                        .nextHourLoad(lastHourLoad)
                        .performanceTrend(performanceOutlook(metrics.getTrends()))
                        .anomalyProbability(Math.min(lastHourAnomalies / 10.0, 1.0))
                        .build())
                .generatedAt(now)
                .build();
    }

    /**
     * Runs {@link #analyzeTrends()} on a fixed interval until {@link #close()} is called.
     * Replaces any analysis started earlier.
     *
     * @param interval time between two analyses
     */
    public void startPeriodicAnalysis(Duration interval) {
        stopPeriodicAnalysis();
        periodicAnalysis = Flux.interval(interval)
                .subscribe(tick -> analyzeTrends(),
                        error -> log.error("Periodic trend analysis stopped", error));
        log.info("Started periodic trend analysis every {}", interval);
    }

    @Override
    public void close() {
        stopPeriodicAnalysis();
    }

    private void stopPeriodicAnalysis() {
        Disposable current = periodicAnalysis;
        if (current != null && !current.isDisposed()) {
            current.dispose();
        }
        periodicAnalysis = null;
    }

    // Processing time rising means performance is degrading
    private DashboardSummary.PerformanceOutlook performanceOutlook(List<TrendData> trendList) {
        for (int i = trendList.size() - 1; i >= 0; i--) {
            TrendData trend = trendList.get(i);
            if (TrendAnalyzer.PROCESSING_TIME.equals(trend.getMetric())) {
                if (trend.getChangeRate() > OUTLOOK_CHANGE) {
                    return DashboardSummary.PerformanceOutlook.DEGRADING;
                }
                if (trend.getChangeRate() < -OUTLOOK_CHANGE) {
                    return DashboardSummary.PerformanceOutlook.IMPROVING;
                }
                return DashboardSummary.PerformanceOutlook.STABLE;
            }
        }
        return DashboardSummary.PerformanceOutlook.STABLE;
    }

    private void pruneAnomalies(Instant now) {
        Instant cutoff = now.minus(settings.getAnomalyRetention());
        while (!anomalies.isEmpty() && anomalies.peekFirst().getTimestamp().isBefore(cutoff)) {
            anomalies.pollFirst();
        }
    }

    private void publishEvent(AnomalyDetectedEvent event) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(event);
        }
    }

    private void publish(AnomalyEvent anomaly) {
        log.warn("{} anomaly ({}) on stage '{}': {}", anomaly.getType(), anomaly.getSeverity(),
                anomaly.getRuleId(), anomaly.getDescription());
        publishEvent(new AnomalyDetectedEvent(anomaly));
    }

    private void recordTimer(EvaluationMetric metric) {
        if (meterRegistry == null) {
            return;
        }
        Timer.builder(TIMER_NAME)
                .description("Duration of a single fallback stage try")
                .tag("stage", metric.getRuleId())
                .tag("outcome", metric.isMatched() ? "success" : "failure")
                .register(meterRegistry)
                .record((long) (metric.getProcessingTime() * 1_000_000), TimeUnit.NANOSECONDS);
    }

    private static <T> void append(Deque<T> deque, T value, int capacity) {
        deque.addLast(value);
        while (deque.size() > Math.max(capacity, 0)) {
            deque.pollFirst();
        }
    }

    private static final class StageAccumulator {

        private final String name;
        private final Deque<Double> recentTimes = new ArrayDeque<>();
        private final Deque<Double> recentScores = new ArrayDeque<>();
        private long evaluationCount;
        private long matchCount;
        private double averageTime;
        private double averageScore;
        private int failureStreak;

        StageAccumulator(String name) {
            this.name = name;
        }

        void record(EvaluationMetric metric, int capacity) {
            evaluationCount++;
            averageTime += (metric.getProcessingTime() - averageTime) / evaluationCount;
            averageScore += (metric.getScore() - averageScore) / evaluationCount;
            if (metric.isMatched()) {
                matchCount++;
                failureStreak = 0;
            } else {
                failureStreak++;
            }
            append(recentTimes, metric.getProcessingTime(), capacity);
            append(recentScores, metric.getScore(), capacity);
        }

        StageMetrics snapshot() {
            return StageMetrics.builder()
                    .stageName(name)
                    .evaluationCount(evaluationCount)
                    .matchCount(matchCount)
                    .averageTime(averageTime)
                    .averageScore(averageScore)
                    .recentScores(List.copyOf(recentScores))
                    .successRate(evaluationCount == 0 ? 0 : (double) matchCount / evaluationCount)
                    .build();
        }
    }
}
