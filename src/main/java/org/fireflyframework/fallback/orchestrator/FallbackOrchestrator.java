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

package org.fireflyframework.fallback.orchestrator;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.fallback.event.FallbackExecutedEvent;
import org.fireflyframework.fallback.exception.StageExecutionException;
import org.fireflyframework.fallback.metrics.DashboardSummary;
import org.fireflyframework.fallback.metrics.EvaluationMetric;
import org.fireflyframework.fallback.metrics.MetricsCollector;
import org.fireflyframework.fallback.metrics.SystemMetrics;
import org.fireflyframework.fallback.model.CacheWriteMode;
import org.fireflyframework.fallback.model.FallbackConfiguration;
import org.fireflyframework.fallback.model.FallbackRequest;
import org.fireflyframework.fallback.model.FallbackRequestParser;
import org.fireflyframework.fallback.model.FallbackResult;
import org.fireflyframework.fallback.model.StageAttempt;
import org.fireflyframework.fallback.model.StageDescriptor;
import org.fireflyframework.fallback.model.StageMetadata;
import org.fireflyframework.fallback.model.StageResult;
import org.fireflyframework.fallback.resiliency.CircuitBreakerSnapshot;
import org.fireflyframework.fallback.resiliency.StageResiliencyRegistry;
import org.fireflyframework.fallback.stage.CacheWriter;
import org.fireflyframework.fallback.stage.FallbackStage;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Drives a request through the fallback cascade until one stage answers.
 *
 * <p>Stages are tried strictly in ascending priority. Each stage try is bounded by
 * the stage timeout, retried with exponential backoff for retryable failures, and
 * guarded by the stage circuit breaker; an open breaker skips the stage without
 * any I/O. Every try is reported to the {@link MetricsCollector}. Stage failures
 * never reach the caller: the terminal stage always answers, and a failure of the
 * terminal stage is reported as an {@link IllegalStateException}.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * FallbackOrchestrator orchestrator = FallbackOrchestrator.builder()
 *     .stages(List.of(primary, secondary, memoryCache, redisCache, staticDefault))
 *     .metricsCollector(new MetricsCollector(MetricsSettings.defaults()))
 *     .build();
 * Mono<FallbackResult> result = orchestrator.execute("/users/42");
 * }</pre>
 */
@Slf4j
public class FallbackOrchestrator {

    private static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(30);
    private static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(100);
    private static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    private final List<StageBinding> bindings;
    private final StageResiliencyRegistry resiliencyRegistry;
    private final MetricsCollector metricsCollector;
    private final ApplicationEventPublisher eventPublisher;
    private final CacheWriteMode cacheWriteMode;
    private final long overallTimeoutMs;

    /**
     * Creates an orchestrator.
     *
     * <p>Stages are ordered by the priority of their descriptors. The optional
     * {@code timeouts}, {@code retryAttempts} and {@code circuitBreakerThresholds}
     * lists override the descriptor values positionally, in that order.</p>
     *
     * @throws org.fireflyframework.fallback.exception.FallbackConfigurationException if the resolved stages are invalid
     */
    @Builder
    public FallbackOrchestrator(List<FallbackStage> stages,
                                List<Integer> timeouts,
                                List<Integer> retryAttempts,
                                List<Integer> circuitBreakerThresholds,
                                Duration circuitBreakerCooldown,
                                Duration initialBackoff,
                                Double backoffMultiplier,
                                MetricsCollector metricsCollector,
                                ApplicationEventPublisher eventPublisher,
                                CacheWriteMode cacheWriteMode,
                                long overallTimeoutMs) {
        List<FallbackStage> ordered = stages == null ? List.of() : stages.stream()
                .sorted(Comparator.comparingInt(stage -> stage.descriptor().getPriority()))
                .collect(Collectors.toList());

        List<StageDescriptor> resolved = FallbackConfiguration.builder()
                .stages(ordered.stream().map(FallbackStage::descriptor).collect(Collectors.toList()))
                .timeouts(timeouts != null ? timeouts : List.of())
                .retryAttempts(retryAttempts != null ? retryAttempts : List.of())
                .circuitBreakerThresholds(circuitBreakerThresholds != null ? circuitBreakerThresholds : List.of())
                .build()
                .resolveStages();

        List<StageBinding> bound = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            bound.add(new StageBinding(ordered.get(i), resolved.get(i)));
        }
        this.bindings = List.copyOf(bound);

        this.resiliencyRegistry = new StageResiliencyRegistry(resolved,
                circuitBreakerCooldown != null ? circuitBreakerCooldown : DEFAULT_COOLDOWN,
                initialBackoff != null ? initialBackoff : DEFAULT_INITIAL_BACKOFF,
                backoffMultiplier != null ? backoffMultiplier : DEFAULT_BACKOFF_MULTIPLIER);
        this.metricsCollector = metricsCollector;
        this.eventPublisher = eventPublisher;
        this.cacheWriteMode = cacheWriteMode != null ? cacheWriteMode : CacheWriteMode.ASYNC;
        this.overallTimeoutMs = overallTimeoutMs;

        log.info("Initialized FallbackOrchestrator with stages {} (cacheWriteMode={}, overallTimeoutMs={})",
                resolved.stream().map(StageDescriptor::getName).collect(Collectors.toList()),
                this.cacheWriteMode, overallTimeoutMs);
    }

    /**
     * Executes a request given as an endpoint string, a structured map or a
     * {@link FallbackRequest}.
     *
     * @param rawRequest the request
     * @return the result; fails only with
     *         {@link org.fireflyframework.fallback.exception.InvalidFallbackRequestException}
     *         for malformed input
     */
    public Mono<FallbackResult> execute(Object rawRequest) {
        return Mono.defer(() -> execute(FallbackRequestParser.parse(rawRequest)));
    }

    public Mono<FallbackResult> execute(FallbackRequest request) {
        return Mono.defer(() -> {
            Cascade cascade = new Cascade(UUID.randomUUID().toString(), request, System.currentTimeMillis());
            log.debug("Starting fallback cascade {} for {} {}", cascade.requestId, request.getMethod(), request.getEndpoint());

            return attemptStage(cascade, 0)
                    .flatMap(winner -> writeThrough(cascade, winner).thenReturn(toResult(cascade, winner)))
                    .doOnNext(result -> publishExecuted(request, result));
        });
    }

    /**
     * Checks every stage's data source directly. Breakers and metrics are left untouched.
     *
     * @return stage name to health, in stage order
     */
    public Mono<Map<String, Boolean>> healthCheck() {
        return Flux.fromIterable(bindings)
                .concatMap(binding -> Mono.defer(() -> binding.stage().healthCheck())
                        .defaultIfEmpty(false)
                        .onErrorReturn(false)
                        .map(healthy -> Map.entry(binding.descriptor().getName(), healthy)))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue, LinkedHashMap::new);
    }

    public List<CircuitBreakerSnapshot> getCircuitBreakerSnapshots() {
        return resiliencyRegistry.getSnapshots();
    }

    /**
     * Returns the effective stage descriptors, in execution order.
     *
     * @return the stage descriptors
     */
    public List<StageDescriptor> getStages() {
        return bindings.stream().map(StageBinding::descriptor).collect(Collectors.toList());
    }

    public SystemMetrics getMetrics() {
        return metricsCollector.getMetrics();
    }

    public String getMonitoringExposition() {
        return metricsCollector.getMonitoringExposition();
    }

    public DashboardSummary getDashboardSummary() {
        return metricsCollector.getDashboardSummary();
    }

    private Mono<Winner> attemptStage(Cascade cascade, int index) {
        if (index >= bindings.size()) {
            return Mono.error(new IllegalStateException("Every fallback stage failed for "
                    + cascade.request.getEndpoint() + ", including the terminal stage: " + cascade.failedAttempts));
        }

        StageBinding binding = bindings.get(index);
        StageDescriptor descriptor = binding.descriptor();
        String name = descriptor.getName();

        if (!descriptor.isTerminal() && cascade.deadlineExceeded(overallTimeoutMs)) {
            log.warn("Skipping stage '{}' for {}: overall deadline of {} ms exceeded",
                    name, cascade.request.getEndpoint(), overallTimeoutMs);
            cascade.skip(name, "overall deadline exceeded");
            return attemptStage(cascade, index + 1);
        }

        AtomicInteger tries = new AtomicInteger();
        long stageStart = System.currentTimeMillis();

        Mono<StageResult> singleTry = Mono.defer(() -> {
            tries.incrementAndGet();
            long tryStart = System.nanoTime();
            Mono<StageResult> call = Mono.defer(() -> binding.stage().execute(cascade.request))
                    .switchIfEmpty(Mono.error(() -> new StageExecutionException(name,
                            "Stage completed without a result", false)))
                    .flatMap(result -> result.isSuccess()
                            ? Mono.just(result)
                            : Mono.<StageResult>error(new StageExecutionException(name, result.getError(), false)));
            return resiliencyRegistry.withTimeout(name, call)
                    .doOnSuccess(result -> recordTry(cascade, descriptor, tryStart, true))
                    .doOnError(error -> recordTry(cascade, descriptor, tryStart, false));
        });

        return resiliencyRegistry.decorate(name, singleTry)
                .map(result -> new Winner(binding, index, result))
                .onErrorResume(error -> {
                    if (error instanceof CallNotPermittedException) {
                        log.debug("Skipping stage '{}': circuit breaker open", name);
                        cascade.skip(name, "circuit breaker open");
                    } else {
                        String reason = describe(error, descriptor);
                        log.warn("Stage '{}' failed for {} after {} tries: {}",
                                name, cascade.request.getEndpoint(), tries.get(), reason);
                        cascade.failed(name, reason, System.currentTimeMillis() - stageStart, tries.get());
                    }
                    return attemptStage(cascade, index + 1);
                });
    }

    private void recordTry(Cascade cascade, StageDescriptor descriptor, long tryStartNanos, boolean success) {
        if (metricsCollector == null) {
            return;
        }
        double elapsedMs = (System.nanoTime() - tryStartNanos) / (double) TimeUnit.MILLISECONDS.toNanos(1);
        metricsCollector.recordEvaluation(EvaluationMetric.builder()
                .requestId(cascade.requestId)
                .ruleId(descriptor.getName())
                .processingTime(elapsedMs)
                .matched(success)
                .score(success ? descriptor.getTrustScore() : 0.0)
                .build());
    }

    private FallbackResult toResult(Cascade cascade, Winner winner) {
        String source = winner.binding().descriptor().getName();
        StageMetadata metadata = winner.result().getMetadata() != null
                ? winner.result().getMetadata()
                : StageMetadata.builder().source(source).build();
        boolean degraded = winner.index() > 0;

        FallbackResult result = FallbackResult.builder()
                .requestId(cascade.requestId)
                .success(true)
                .data(winner.result().getData())
                .source(source)
                .totalDurationMs(System.currentTimeMillis() - cascade.startMillis)
                .failedAttempts(List.copyOf(cascade.failedAttempts))
                .metadata(metadata)
                .degraded(degraded)
                .build();

        if (degraded) {
            log.info("Request {} for {} served by fallback stage '{}' after {} failed attempts",
                    cascade.requestId, cascade.request.getEndpoint(), source, cascade.failedAttempts.size());
        }
        return result;
    }

    private Mono<Void> writeThrough(Cascade cascade, Winner winner) {
        FallbackStage winnerStage = winner.binding().stage();
        Object data = winner.result().getData();
        if (data == null || winnerStage instanceof CacheWriter || winner.binding().descriptor().isTerminal()) {
            return Mono.empty();
        }

        List<FallbackStage> writers = bindings.stream()
                .map(StageBinding::stage)
                .filter(stage -> stage instanceof CacheWriter)
                .collect(Collectors.toList());
        if (writers.isEmpty()) {
            return Mono.empty();
        }

        Mono<Void> writes = Flux.fromIterable(writers)
                .concatMap(stage -> Mono.defer(() -> ((CacheWriter) stage).write(cascade.request, data))
                        .onErrorResume(e -> {
                            log.warn("Cache write to stage '{}' failed for {}: {}",
                                    stage.getName(), cascade.request.getEndpoint(), e.getMessage());
                            return Mono.empty();
                        }))
                .then();

        if (cacheWriteMode == CacheWriteMode.SYNC) {
            return writes;
        }
        writes.subscribe();
        return Mono.empty();
    }

    private void publishExecuted(FallbackRequest request, FallbackResult result) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(new FallbackExecutedEvent(request.getEndpoint(), result));
        }
    }

    private static String describe(Throwable error, StageDescriptor descriptor) {
        if (error instanceof TimeoutException) {
            return "Timed out after " + descriptor.getTimeoutMs() + " ms";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private record StageBinding(FallbackStage stage, StageDescriptor descriptor) {}

    private record Winner(StageBinding binding, int index, StageResult result) {}

    /**
     * Mutable state of one cascade. Stages run sequentially, so it is never shared between threads concurrently.
     */
    private static final class Cascade {

        private final String requestId;
        private final FallbackRequest request;
        private final long startMillis;
        private final List<StageAttempt> failedAttempts = new ArrayList<>();

        Cascade(String requestId, FallbackRequest request, long startMillis) {
            this.requestId = requestId;
            this.request = request;
            this.startMillis = startMillis;
        }

        boolean deadlineExceeded(long overallTimeoutMs) {
            return overallTimeoutMs > 0 && System.currentTimeMillis() - startMillis >= overallTimeoutMs;
        }

        void skip(String stageName, String reason) {
            failedAttempts.add(StageAttempt.builder()
                    .stageName(stageName)
                    .skipped(true)
                    .reason(reason)
                    .build());
        }

        void failed(String stageName, String reason, long durationMs, int tries) {
            failedAttempts.add(StageAttempt.builder()
                    .stageName(stageName)
                    .reason(reason)
                    .durationMs(durationMs)
                    .tries(tries)
                    .build());
        }
    }
}
