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
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.fallback.model.StageDescriptor;
import org.fireflyframework.fallback.stage.FallbackStage;
import org.fireflyframework.fallback.stage.MemoryCacheStage;
import org.fireflyframework.fallback.stage.PrimaryApiStage;
import org.fireflyframework.fallback.stage.RedisCacheStage;
import org.fireflyframework.fallback.stage.SecondaryApiStage;
import org.fireflyframework.fallback.stage.StaticDefaultStage;
import org.fireflyframework.fallback.transform.MappingTable;
import org.fireflyframework.fallback.transport.WebClientApiTransport;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the configured stages from {@link FallbackProperties}.
 */
@Slf4j
public class FallbackStageFactory {

    private final FallbackProperties properties;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final ReactiveRedisTemplate<String, String> redisTemplate;

    /**
     * @param properties       the engine properties
     * @param webClientBuilder template for the API stage clients
     * @param objectMapper     JSON mapper for the Redis and static default stages
     * @param redisTemplate    Redis template, or {@code null} to leave out the Redis stage
     */
    public FallbackStageFactory(FallbackProperties properties,
                                WebClient.Builder webClientBuilder,
                                ObjectMapper objectMapper,
                                ReactiveRedisTemplate<String, String> redisTemplate) {
        this.properties = properties;
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;
        this.redisTemplate = redisTemplate;
    }

    public List<FallbackStage> createStages() {
        List<FallbackStage> stages = new ArrayList<>();

        FallbackProperties.PrimaryApi primary = properties.getPrimaryApi();
        if (primary.isEnabled() && hasText(primary.getBaseUrl())) {
            StageDescriptor descriptor = primary.applyTo(PrimaryApiStage.defaultDescriptor());
            stages.add(new PrimaryApiStage(descriptor, transport(descriptor, primary.getBaseUrl()), primary.getHealthPath()));
        }

        FallbackProperties.SecondaryApi secondary = properties.getSecondaryApi();
        if (secondary.isEnabled() && hasText(secondary.getBaseUrl())) {
            StageDescriptor descriptor = secondary.applyTo(SecondaryApiStage.defaultDescriptor());
            stages.add(SecondaryApiStage.builder()
                    .descriptor(descriptor)
                    .transport(transport(descriptor, secondary.getBaseUrl()))
                    .healthPath(secondary.getHealthPath())
                    .endpointMappings(MappingTable.of("endpoint-mappings", secondary.getEndpointMappings()))
                    .fieldMappings(MappingTable.of("field-mappings", secondary.getFieldMappings()))
                    .responseFieldMappings(MappingTable.of("response-field-mappings", secondary.getResponseFieldMappings()))
                    .build());
        }

        FallbackProperties.MemoryCache memory = properties.getMemoryCache();
        if (memory.isEnabled()) {
            stages.add(new MemoryCacheStage(memory.applyTo(MemoryCacheStage.defaultDescriptor()),
                    memory.getMaxEntries(), memory.getTtl()));
        }

        FallbackProperties.RedisCache redis = properties.getRedisCache();
        if (redis.isEnabled() && redisTemplate != null) {
            stages.add(new RedisCacheStage(redis.applyTo(RedisCacheStage.defaultDescriptor()),
                    redisTemplate, objectMapper, redis.getKeyPrefix(), redis.getTtl()));
        } else if (redis.isEnabled()) {
            log.info("No reactive Redis template available, Redis cache stage disabled");
        }

        FallbackProperties.StaticDefault staticDefault = properties.getStaticDefault();
        stages.add(StaticDefaultStage.builder()
                .descriptor(staticDefault.applyTo(StaticDefaultStage.defaultDescriptor()).toBuilder()
                        .retryCount(0)
                        .circuitBreakerThreshold(0)
                        .terminal(true)
                        .build())
                .objectMapper(objectMapper)
                .fallbackFile(hasText(staticDefault.getFallbackFile()) ? Path.of(staticDefault.getFallbackFile()) : null)
                .keyedByEndpoint(staticDefault.isKeyedByEndpoint())
                .smartDefaults(staticDefault.isSmartDefaults())
                .build());

        log.info("Created {} fallback stages", stages.size());
        return stages;
    }

    private WebClientApiTransport transport(StageDescriptor descriptor, String baseUrl) {
        return new WebClientApiTransport(descriptor.getName(), webClientBuilder.clone().baseUrl(baseUrl).build());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
