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

package org.fireflyframework.fallback.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.fallback.exception.CacheMissException;
import org.fireflyframework.fallback.exception.ResponseTransformationException;
import org.fireflyframework.fallback.exception.StageExecutionException;
import org.fireflyframework.fallback.exception.TransportException;
import org.fireflyframework.fallback.model.FallbackRequest;
import org.fireflyframework.fallback.model.StageDescriptor;
import org.fireflyframework.fallback.model.StageMetadata;
import org.fireflyframework.fallback.model.StageResult;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Distributed cache stage backed by Redis. Values are stored as JSON strings under
 * {@code keyPrefix + cacheKey} with a fixed time to live.
 */
@Slf4j
public class RedisCacheStage implements FallbackStage, CacheWriter {

    public static final String DEFAULT_NAME = "redis-cache";
    public static final String DEFAULT_KEY_PREFIX = "firefly:fallback:";
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(3600);

    private static final String HEALTH_KEY = "health";
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(2);

    private final StageDescriptor descriptor;
    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisCacheStage(StageDescriptor descriptor,
                           ReactiveRedisTemplate<String, String> redisTemplate,
                           ObjectMapper objectMapper,
                           String keyPrefix,
                           Duration ttl) {
        this.descriptor = descriptor;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix != null ? keyPrefix : DEFAULT_KEY_PREFIX;
        this.ttl = ttl;
    }

    /**
     * Default descriptor: 500 ms timeout, 1 retry, breaker after 5 failures.
     *
     * @return the default descriptor
     */
    public static StageDescriptor defaultDescriptor() {
        return StageDescriptor.builder()
                .name(DEFAULT_NAME)
                .priority(4)
                .timeoutMs(500)
                .retryCount(1)
                .circuitBreakerThreshold(5)
                .trustScore(0.6)
                .build();
    }

    @Override
    public StageDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Mono<StageResult> execute(FallbackRequest request) {
        return Mono.defer(() -> {
            String key = keyPrefix + CacheKeyGenerator.generate(request);
            return redisTemplate.opsForValue().get(key)
                    .onErrorMap(e -> !(e instanceof StageExecutionException),
                            e -> new TransportException(getName(), "Redis read failed: " + e.getMessage(), e))
                    .switchIfEmpty(Mono.error(() -> new CacheMissException(getName(), key)))
                    .flatMap(json -> deserialize(key, json))
                    .map(data -> StageResult.success(getName(), data, StageMetadata.builder()
                            .source(getName())
                            .cached(true)
                            .build()));
        });
    }

    @Override
    public Mono<Void> write(FallbackRequest request, Object data) {
        if (data == null) {
            return Mono.empty();
        }
        String key = keyPrefix + CacheKeyGenerator.generate(request);
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(data))
                .flatMap(json -> redisTemplate.opsForValue().set(key, json, ttl))
                .doOnNext(stored -> log.debug("Stored {} in Redis (ok={})", key, stored))
                .then();
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return redisTemplate.hasKey(keyPrefix + HEALTH_KEY)
                .thenReturn(true)
                .timeout(HEALTH_TIMEOUT)
                .onErrorResume(e -> {
                    log.debug("Redis health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    private Mono<Object> deserialize(String key, String json) {
        return Mono.fromCallable(() -> objectMapper.readValue(json, Object.class))
                .onErrorMap(JsonProcessingException.class, e -> new ResponseTransformationException(
                        getName(), "Cached value under " + key + " is not valid JSON", e));
    }
}
