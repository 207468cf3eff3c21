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

import lombok.Data;
import lombok.EqualsAndHashCode;
import org.fireflyframework.fallback.metrics.MetricsSettings;
import org.fireflyframework.fallback.model.CacheWriteMode;
import org.fireflyframework.fallback.model.StageDescriptor;
import org.fireflyframework.fallback.stage.MemoryCacheStage;
import org.fireflyframework.fallback.stage.RedisCacheStage;
import org.fireflyframework.fallback.transform.MappingRule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties of the fallback engine.
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   fallback:
 *     primary-api:
 *       base-url: https://api.example.com
 *     secondary-api:
 *       base-url: https://backup.example.com
 *       endpoint-mappings:
 *         - from: /users
 *           to: /api/v2/accounts
 *       field-mappings:
 *         - from: name
 *           to: userName
 *     static-default:
 *       fallback-file: /etc/firefly/fallback.json
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.fallback")
public class FallbackProperties {

    /**
     * Enable or disable the fallback engine.
     */
    private boolean enabled = true;

    /**
     * Budget for a whole cascade in milliseconds; once spent, only the terminal
     * stage is tried. 0 disables it.
     */
    private long overallTimeoutMs = 0;

    private CacheWriteMode cacheWriteMode = CacheWriteMode.ASYNC;

    /**
     * Positional overrides, aligned with the enabled stages in priority order.
     */
    private List<Integer> timeouts = new ArrayList<>();
    private List<Integer> retryAttempts = new ArrayList<>();
    private List<Integer> circuitBreakerThresholds = new ArrayList<>();

    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Retry retry = new Retry();

    private PrimaryApi primaryApi = new PrimaryApi();
    private SecondaryApi secondaryApi = new SecondaryApi();
    private MemoryCache memoryCache = new MemoryCache();
    private RedisCache redisCache = new RedisCache();
    private StaticDefault staticDefault = new StaticDefault();

    private MetricsSettings metrics = MetricsSettings.defaults();

    /**
     * Interval of the background trend analysis. Zero or negative disables it.
     */
    private Duration trendAnalysisInterval = Duration.ofMinutes(1);

    @Data
    public static class CircuitBreaker {
        /**
         * Time an open breaker waits before letting a probe through.
         */
        private long cooldownMs = 30000;
    }

    @Data
    public static class Retry {
        private long initialBackoffMs = 100;
        private double multiplier = 2.0;
    }

    /**
     * Settings shared by all stages. Unset values keep the stage's built-in defaults.
     */
    @Data
    public static class StageProperties {
        private boolean enabled = true;
        private Integer priority;
        private Long timeoutMs;
        private Integer retryCount;
        private Integer circuitBreakerThreshold;
        private Double trustScore;

        public StageDescriptor applyTo(StageDescriptor defaults) {
            StageDescriptor.StageDescriptorBuilder builder = defaults.toBuilder();
            if (priority != null) {
                builder.priority(priority);
            }
            if (timeoutMs != null) {
                builder.timeoutMs(timeoutMs);
            }
            if (retryCount != null) {
                builder.retryCount(retryCount);
            }
            if (circuitBreakerThreshold != null) {
                builder.circuitBreakerThreshold(circuitBreakerThreshold);
            }
            if (trustScore != null) {
                builder.trustScore(trustScore);
            }
            return builder.build();
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class PrimaryApi extends StageProperties {
        /**
         * Base URL of the authoritative API. The stage is only created when set.
         */
        private String baseUrl;
        private String healthPath = "/health";
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class SecondaryApi extends StageProperties {
        /**
         * Base URL of the backup API. The stage is only created when set.
         */
        private String baseUrl;
        private String healthPath = "/health";
        private List<MappingRule> endpointMappings = new ArrayList<>();
        private List<MappingRule> fieldMappings = new ArrayList<>();
        private List<MappingRule> responseFieldMappings = new ArrayList<>();
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class MemoryCache extends StageProperties {
        private long maxEntries = MemoryCacheStage.DEFAULT_MAX_ENTRIES;
        private Duration ttl = MemoryCacheStage.DEFAULT_TTL;
    }

    /**
     * The stage is only created when a reactive Redis template is available.
     */
    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class RedisCache extends StageProperties {
        private String keyPrefix = RedisCacheStage.DEFAULT_KEY_PREFIX;
        private Duration ttl = RedisCacheStage.DEFAULT_TTL;
    }

    /**
     * The terminal stage cannot be disabled; its retry and breaker settings are ignored.
     */
    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class StaticDefault extends StageProperties {
        /**
         * JSON document served before any synthesized default.
         */
        private String fallbackFile;
        private boolean keyedByEndpoint = true;
        private boolean smartDefaults = true;
    }
}
