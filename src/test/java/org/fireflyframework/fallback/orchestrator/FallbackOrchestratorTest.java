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

import org.fireflyframework.fallback.event.FallbackExecutedEvent;
import org.fireflyframework.fallback.exception.FallbackConfigurationException;
import org.fireflyframework.fallback.exception.InvalidFallbackRequestException;
import org.fireflyframework.fallback.exception.TransportException;
import org.fireflyframework.fallback.metrics.MetricsCollector;
import org.fireflyframework.fallback.metrics.MetricsSettings;
import org.fireflyframework.fallback.model.CacheWriteMode;
import org.fireflyframework.fallback.model.FallbackRequest;
import org.fireflyframework.fallback.model.StageAttempt;
import org.fireflyframework.fallback.model.StageDescriptor;
import org.fireflyframework.fallback.model.StageMetadata;
import org.fireflyframework.fallback.model.StageResult;
import org.fireflyframework.fallback.resiliency.CircuitBreakerSnapshot;
import org.fireflyframework.fallback.resiliency.CircuitBreakerState;
import org.fireflyframework.fallback.stage.FallbackStage;
import org.fireflyframework.fallback.stage.MemoryCacheStage;
import org.fireflyframework.fallback.stage.StaticDefaultStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link FallbackOrchestrator}.
 */
@ExtendWith(MockitoExtension.class)
class FallbackOrchestratorTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private ScriptedStage primary;
    private ScriptedStage secondary;
    private MemoryCacheStage memoryCache;
    private StaticDefaultStage staticDefault;
    private MetricsCollector metricsCollector;

    @BeforeEach
    void setUp() {
        primary = new ScriptedStage(descriptor("primary-api", 1, 0.95));
        secondary = new ScriptedStage(descriptor("secondary-api", 2, 0.85));
        memoryCache = new MemoryCacheStage(MemoryCacheStage.defaultDescriptor(), 100, Duration.ofMinutes(5));
        staticDefault = StaticDefaultStage.builder().build();
        metricsCollector = new MetricsCollector(MetricsSettings.defaults());
    }

    private static StageDescriptor descriptor(String name, int priority, double trust) {
        return StageDescriptor.builder()
                .name(name)
                .priority(priority)
                .timeoutMs(1000)
                .retryCount(0)
                .circuitBreakerThreshold(2)
                .trustScore(trust)
                .build();
    }

    private FallbackOrchestrator.FallbackOrchestratorBuilder orchestrator() {
        return FallbackOrchestrator.builder()
                // unordered on purpose, stages are sorted by priority
                .stages(List.of(staticDefault, memoryCache, secondary, primary))
                .initialBackoff(Duration.ofMillis(1))
                .metricsCollector(metricsCollector)
                .eventPublisher(eventPublisher)
                .cacheWriteMode(CacheWriteMode.SYNC);
    }

    private static Mono<StageResult> ok(String stage, Object data) {
        return Mono.just(StageResult.success(stage, data, StageMetadata.builder().source(stage).build()));
    }

    private static Mono<StageResult> down(String stage) {
        return Mono.error(new TransportException(stage, "Connection refused"));
    }

    @Test
    void execute_shouldServeFromPrimary_andSkipLaterStages() {
        // Given
        primary.respond(() -> ok("primary-api", Map.of("id", 42, "name", "John")));
        FallbackOrchestrator orchestrator = orchestrator().build();

        // When & Then
        StepVerifier.create(orchestrator.execute("/users/42"))
                .assertNext(result -> {
                    assertThat(result.isSuccess()).isTrue();
                    assertThat(result.getSource()).isEqualTo("primary-api");
                    assertThat(result.getData()).isEqualTo(Map.of("id", 42, "name", "John"));
                    assertThat(result.isDegraded()).isFalse();
                    assertThat(result.getFailedAttempts()).isEmpty();
                    assertThat(result.getRequestId()).isNotBlank();
                })
                .verifyComplete();

        assertThat(primary.calls.get()).isEqualTo(1);
        assertThat(secondary.calls.get()).isZero();
        assertThat(metricsCollector.getMetrics().getTotalEvaluations()).isEqualTo(1);
        assertThat(metricsCollector.getMetrics().getAverageConfidence()).isEqualTo(0.95);
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_shouldServeStaticDefault_whenEveryUpstreamStageFails() {
        // Given
        primary.respond(() -> down("primary-api"));
        secondary.respond(() -> down("secondary-api"));
        FallbackOrchestrator orchestrator = orchestrator().build();

        // When & Then
        StepVerifier.create(orchestrator.execute("/users/42"))
                .assertNext(result -> {
                    assertThat(result.isSuccess()).isTrue();
                    assertThat(result.getSource()).isEqualTo("static-default");
                    assertThat(result.isDegraded()).isTrue();
                    assertThat((Map<String, Object>) result.getData())
                            .containsEntry("id", "42")
                            .containsEntry("status", "fallback");
                    assertThat(result.getFailedAttempts()).extracting(StageAttempt::getStageName)
                            .containsExactly("primary-api", "secondary-api", "memory-cache");
                    assertThat(result.getFailedAttempts().get(0).getReason()).contains("Connection refused");
                    assertThat(result.getFailedAttempts().get(0).getTries()).isEqualTo(1);
                    assertThat(result.getFailedAttempts().get(2).getReason()).contains("No cached entry");
                })
                .verifyComplete();

        assertThat(metricsCollector.getMetrics().getTotalEvaluations()).isEqualTo(4);
        assertThat(metricsCollector.getMetrics().getMatchRate()).isEqualTo(0.25);
    }

    @Test
    void execute_shouldWriteThroughToCaches_andServeFromCacheLater() {
        // Given - primary succeeds once, then goes down
        FallbackOrchestrator orchestrator = orchestrator().build();
        primary.respond(() -> ok("primary-api", Map.of("id", 7)));
        StepVerifier.create(orchestrator.execute("/orders/7")).expectNextCount(1).verifyComplete();

        primary.respond(() -> down("primary-api"));
        secondary.respond(() -> down("secondary-api"));

        // When & Then
        StepVerifier.create(orchestrator.execute("/orders/7"))
                .assertNext(result -> {
                    assertThat(result.getSource()).isEqualTo("memory-cache");
                    assertThat(result.getData()).isEqualTo(Map.of("id", 7));
                    assertThat(result.getMetadata().isCached()).isTrue();
                    assertThat(result.isDegraded()).isTrue();
                })
                .verifyComplete();
        assertThat(memoryCache.size()).isEqualTo(1);
    }

    @Test
    void execute_shouldNotCacheStaticDefaults() {
        primary.respond(() -> down("primary-api"));
        secondary.respond(() -> down("secondary-api"));
        FallbackOrchestrator orchestrator = orchestrator().build();

        StepVerifier.create(orchestrator.execute("/users/1")).expectNextCount(1).verifyComplete();

        assertThat(memoryCache.size()).isZero();
    }

    @Test
    void execute_shouldRetryRetryableFailures_andReportTries() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        primary.respond(() -> attempts.incrementAndGet() < 3 ? down("primary-api") : ok("primary-api", "third time"));
        FallbackOrchestrator orchestrator = orchestrator()
                .retryAttempts(List.of(2, 0, 0, 0))
                .build();

        // When & Then
        StepVerifier.create(orchestrator.execute("/users"))
                .assertNext(result -> {
                    assertThat(result.getSource()).isEqualTo("primary-api");
                    assertThat(result.getData()).isEqualTo("third time");
                })
                .verifyComplete();
        assertThat(primary.calls.get()).isEqualTo(3);
        assertThat(metricsCollector.getMetrics().getStageMetrics().get("primary-api").getEvaluationCount())
                .isEqualTo(3);
    }

    @Test
    void execute_shouldTimeOutSlowStage_usingPositionalOverride() {
        // Given
        primary.respond(Mono::never);
        secondary.respond(() -> ok("secondary-api", "from secondary"));
        FallbackOrchestrator orchestrator = orchestrator()
                .timeouts(List.of(50, 1000, 100, 0))
                .build();

        // When & Then
        StepVerifier.create(orchestrator.execute("/users"))
                .assertNext(result -> {
                    assertThat(result.getSource()).isEqualTo("secondary-api");
                    assertThat(result.getFailedAttempts()).hasSize(1);
                    assertThat(result.getFailedAttempts().get(0).getReason()).isEqualTo("Timed out after 50 ms");
                })
                .verifyComplete();
        assertThat(orchestrator.getStages().get(0).getTimeoutMs()).isEqualTo(50);
    }

    @Test
    void execute_shouldSkipStage_whileCircuitBreakerIsOpen() {
        // Given - two failures open the primary breaker
        primary.respond(() -> down("primary-api"));
        secondary.respond(() -> ok("secondary-api", "from secondary"));
        FallbackOrchestrator orchestrator = orchestrator().build();
        for (int i = 0; i < 2; i++) {
            StepVerifier.create(orchestrator.execute("/users")).expectNextCount(1).verifyComplete();
        }

        // When & Then
        StepVerifier.create(orchestrator.execute("/users"))
                .assertNext(result -> {
                    assertThat(result.getSource()).isEqualTo("secondary-api");
                    StageAttempt skipped = result.getFailedAttempts().get(0);
                    assertThat(skipped.getStageName()).isEqualTo("primary-api");
                    assertThat(skipped.isSkipped()).isTrue();
                    assertThat(skipped.getReason()).isEqualTo("circuit breaker open");
                })
                .verifyComplete();
        assertThat(primary.calls.get()).isEqualTo(2);

        CircuitBreakerSnapshot snapshot = orchestrator.getCircuitBreakerSnapshots().get(0);
        assertThat(snapshot.getStageName()).isEqualTo("primary-api");
        assertThat(snapshot.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void execute_shouldSkipRemainingStages_onceOverallDeadlinePasses() {
        // Given
        primary.respond(() -> Mono.delay(Duration.ofMillis(150)).then(down("primary-api")));
        secondary.respond(() -> ok("secondary-api", "never reached"));
        FallbackOrchestrator orchestrator = orchestrator().overallTimeoutMs(100).build();

        // When & Then
        StepVerifier.create(orchestrator.execute("/users/5"))
                .assertNext(result -> {
                    assertThat(result.getSource()).isEqualTo("static-default");
                    assertThat(result.getFailedAttempts()).extracting(StageAttempt::getReason)
                            .containsExactly("Connection refused", "overall deadline exceeded", "overall deadline exceeded");
                })
                .verifyComplete();
        assertThat(secondary.calls.get()).isZero();
    }

    @Test
    void execute_shouldFail_whenTerminalStageFails() {
        // Given
        primary.respond(() -> down("primary-api"));
        ScriptedStage brokenTerminal = new ScriptedStage(StaticDefaultStage.defaultDescriptor());
        brokenTerminal.respond(() -> Mono.error(new IllegalStateException("disk on fire")));
        FallbackOrchestrator orchestrator = FallbackOrchestrator.builder()
                .stages(List.of(primary, brokenTerminal))
                .build();

        // When & Then
        StepVerifier.create(orchestrator.execute("/users"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(IllegalStateException.class);
                    assertThat(error.getMessage()).contains("Every fallback stage failed").contains("/users");
                })
                .verify();
    }

    @Test
    void execute_shouldRejectInvalidRequests() {
        FallbackOrchestrator orchestrator = orchestrator().build();

        StepVerifier.create(orchestrator.execute((Object) null))
                .expectError(InvalidFallbackRequestException.class)
                .verify();
        StepVerifier.create(orchestrator.execute(Map.of("method", "GET")))
                .expectError(InvalidFallbackRequestException.class)
                .verify();
        StepVerifier.create(orchestrator.execute("   "))
                .expectError(InvalidFallbackRequestException.class)
                .verify();
    }

    @Test
    void execute_shouldAcceptStructuredRequests() {
        primary.respond(() -> ok("primary-api", "created"));
        FallbackOrchestrator orchestrator = orchestrator().build();

        StepVerifier.create(orchestrator.execute(Map.of("endpoint", "/orders", "method", "post", "data", Map.of("total", 3))))
                .assertNext(result -> assertThat(result.getData()).isEqualTo("created"))
                .verifyComplete();

        FallbackRequest seen = primary.lastRequest;
        assertThat(seen.getMethod()).isEqualTo("POST");
        assertThat(seen.getData()).isEqualTo(Map.of("total", 3));
    }

    @Test
    void execute_shouldPublishExecutedEvent() {
        primary.respond(() -> ok("primary-api", "data"));
        FallbackOrchestrator orchestrator = orchestrator().build();

        StepVerifier.create(orchestrator.execute("/users")).expectNextCount(1).verifyComplete();

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue()).isInstanceOf(FallbackExecutedEvent.class);
        FallbackExecutedEvent executed = (FallbackExecutedEvent) event.getValue();
        assertThat(executed.getEndpoint()).isEqualTo("/users");
        assertThat(executed.getResult().getSource()).isEqualTo("primary-api");
    }

    @Test
    void healthCheck_shouldReportEveryStage_withoutTouchingBreakersOrMetrics() {
        // Given
        primary.healthy = false;
        FallbackOrchestrator orchestrator = orchestrator().build();

        // When & Then
        StepVerifier.create(orchestrator.healthCheck())
                .assertNext(health -> assertThat(health).containsExactly(
                        Map.entry("primary-api", false),
                        Map.entry("secondary-api", true),
                        Map.entry("memory-cache", true),
                        Map.entry("static-default", true)))
                .verifyComplete();

        assertThat(primary.calls.get()).isZero();
        assertThat(metricsCollector.getMetrics().getTotalEvaluations()).isZero();
        assertThat(orchestrator.getCircuitBreakerSnapshots())
                .allSatisfy(snapshot -> {
                    assertThat(snapshot.getState()).isEqualTo(CircuitBreakerState.CLOSED);
                    assertThat(snapshot.getConsecutiveFailures()).isZero();
                });
    }

    @Test
    void healthCheck_shouldReportFalse_whenProbeErrors() {
        primary.healthError = true;
        FallbackOrchestrator orchestrator = orchestrator().build();

        StepVerifier.create(orchestrator.healthCheck())
                .assertNext(health -> assertThat(health).containsEntry("primary-api", false))
                .verifyComplete();
    }

    @Test
    void builder_shouldRejectMisalignedOverrides() {
        assertThatThrownBy(() -> orchestrator().timeouts(List.of(100, 200)).build())
                .isInstanceOf(FallbackConfigurationException.class)
                .hasMessageContaining("timeouts has 2 entries but 4 stages are configured");
    }

    @Test
    void builder_shouldRejectCascadeWithoutTerminalStage() {
        assertThatThrownBy(() -> FallbackOrchestrator.builder().stages(List.of(primary, secondary)).build())
                .isInstanceOf(FallbackConfigurationException.class)
                .hasMessageContaining("Exactly one terminal stage is required");
    }

    /**
     * Stage whose outcome is swapped in by each test.
     */
    private static final class ScriptedStage implements FallbackStage {

        private final StageDescriptor descriptor;
        private final AtomicInteger calls = new AtomicInteger();
        private volatile Supplier<Mono<StageResult>> behaviour = () -> Mono.error(new IllegalStateException("unscripted"));
        private volatile FallbackRequest lastRequest;
        private volatile boolean healthy = true;
        private volatile boolean healthError;

        ScriptedStage(StageDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        void respond(Supplier<Mono<StageResult>> behaviour) {
            this.behaviour = behaviour;
        }

        @Override
        public StageDescriptor descriptor() {
            return descriptor;
        }

        @Override
        public Mono<StageResult> execute(FallbackRequest request) {
            calls.incrementAndGet();
            lastRequest = request;
            return behaviour.get();
        }

        @Override
        public Mono<Boolean> healthCheck() {
            return healthError ? Mono.error(new IllegalStateException("probe failed")) : Mono.just(healthy);
        }
    }
}
