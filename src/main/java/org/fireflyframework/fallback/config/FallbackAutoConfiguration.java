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

package org.fireflyframework.fallback.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.fallback.controller.FallbackController;
import org.fireflyframework.fallback.controller.advice.FallbackExceptionHandler;
import org.fireflyframework.fallback.metrics.MetricsCollector;
import org.fireflyframework.fallback.orchestrator.FallbackOrchestrator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.function.client.WebClientAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Auto-configuration for the fallback engine.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>{@link MetricsCollector}, mirrored to Micrometer when a {@link MeterRegistry} is available</li>
 *   <li>{@link FallbackStageFactory} building the stages from {@link FallbackProperties}</li>
 *   <li>{@link FallbackOrchestrator} over those stages</li>
 *   <li>{@link FallbackController} and {@link FallbackExceptionHandler} in reactive web applications</li>
 * </ul>
 *
 * <p>The configuration is activated unless {@code firefly.fallback.enabled} is false.</p>
 */
@Slf4j
@AutoConfiguration(after = {
        JacksonAutoConfiguration.class,
        WebClientAutoConfiguration.class,
        RedisReactiveAutoConfiguration.class
})
@ConditionalOnProperty(
    prefix = "firefly.fallback",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
@EnableConfigurationProperties(FallbackProperties.class)
public class FallbackAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MetricsCollector fallbackMetricsCollector(
            FallbackProperties properties,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher,
            @Autowired(required = false) MeterRegistry meterRegistry) {
        MetricsCollector collector = new MetricsCollector(properties.getMetrics(), eventPublisher, meterRegistry);
        Duration interval = properties.getTrendAnalysisInterval();
        if (interval != null && !interval.isZero() && !interval.isNegative()) {
            collector.startPeriodicAnalysis(interval);
        }
        return collector;
    }

    @Bean
    @ConditionalOnMissingBean
    public FallbackStageFactory fallbackStageFactory(
            FallbackProperties properties,
            @Autowired(required = false) WebClient.Builder webClientBuilder,
            @Autowired(required = false) ObjectMapper objectMapper,
            @Autowired(required = false) ReactiveStringRedisTemplate redisTemplate) {
        return new FallbackStageFactory(properties,
                webClientBuilder != null ? webClientBuilder : WebClient.builder(),
                objectMapper != null ? objectMapper : new ObjectMapper(),
                redisTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public FallbackOrchestrator fallbackOrchestrator(
            FallbackProperties properties,
            FallbackStageFactory stageFactory,
            MetricsCollector metricsCollector,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        log.info("Configuring fallback orchestrator (cooldown {} ms, initial backoff {} ms)",
                properties.getCircuitBreaker().getCooldownMs(), properties.getRetry().getInitialBackoffMs());
        return FallbackOrchestrator.builder()
                .stages(stageFactory.createStages())
                .timeouts(properties.getTimeouts())
                .retryAttempts(properties.getRetryAttempts())
                .circuitBreakerThresholds(properties.getCircuitBreakerThresholds())
                .circuitBreakerCooldown(Duration.ofMillis(properties.getCircuitBreaker().getCooldownMs()))
                .initialBackoff(Duration.ofMillis(properties.getRetry().getInitialBackoffMs()))
                .backoffMultiplier(properties.getRetry().getMultiplier())
                .metricsCollector(metricsCollector)
                .eventPublisher(eventPublisher)
                .cacheWriteMode(properties.getCacheWriteMode())
                .overallTimeoutMs(properties.getOverallTimeoutMs())
                .build();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    static class FallbackWebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public FallbackController fallbackController(FallbackOrchestrator orchestrator) {
            return new FallbackController(orchestrator);
        }

        @Bean
        @ConditionalOnMissingBean
        public FallbackExceptionHandler fallbackExceptionHandler() {
            return new FallbackExceptionHandler();
        }
    }
}
