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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.fallback.exception.CacheMissException;
import org.fireflyframework.fallback.model.FallbackRequest;
import org.fireflyframework.fallback.model.StageDescriptor;
import org.fireflyframework.fallback.model.StageMetadata;
import org.fireflyframework.fallback.model.StageResult;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * In-process cache stage backed by Caffeine, bounded by size and expiring entries
 * a fixed time after they were written.
 */
@Slf4j
public class MemoryCacheStage implements FallbackStage, CacheWriter {

    public static final String DEFAULT_NAME = "memory-cache";
    public static final long DEFAULT_MAX_ENTRIES = 1000;
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);

    private final StageDescriptor descriptor;
    private final Cache<String, Object> cache;

    public MemoryCacheStage(StageDescriptor descriptor, long maxEntries, Duration ttl) {
        this.descriptor = descriptor;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
        log.info("Memory cache stage '{}' holds up to {} entries for {}", descriptor.getName(), maxEntries, ttl);
    }

    /**
     * Default descriptor: 100 ms timeout, no retries, breaker after 5 failures.
     *
     * @return the default descriptor
     */
    public static StageDescriptor defaultDescriptor() {
        return StageDescriptor.builder()
                .name(DEFAULT_NAME)
                .priority(3)
                .timeoutMs(100)
                .retryCount(0)
                .circuitBreakerThreshold(5)
                .trustScore(0.7)
                .build();
    }

    @Override
    public StageDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Mono<StageResult> execute(FallbackRequest request) {
        return Mono.defer(() -> {
            String key = CacheKeyGenerator.generate(request);
            Object cached = cache.getIfPresent(key);
            if (cached == null) {
                return Mono.error(new CacheMissException(getName(), key));
            }
            log.debug("Memory cache hit for {}", key);
            return Mono.just(StageResult.success(getName(), cached, StageMetadata.builder()
                    .source(getName())
                    .cached(true)
                    .build()));
        });
    }

    @Override
    public Mono<Void> write(FallbackRequest request, Object data) {
        return Mono.fromRunnable(() -> {
            if (data != null) {
                cache.put(CacheKeyGenerator.generate(request), data);
            }
        });
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.just(true);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
    }
}
