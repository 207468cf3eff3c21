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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.fallback.model.FallbackRequest;
import org.fireflyframework.fallback.model.StageDescriptor;
import org.fireflyframework.fallback.model.StageMetadata;
import org.fireflyframework.fallback.model.StageResult;
import org.fireflyframework.fallback.transform.TransformContext;
import org.fireflyframework.fallback.transform.TransformationChain;
import org.fireflyframework.fallback.transform.transformers.DefaultFieldTransformer;
import reactor.core.publisher.Mono;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Terminal stage that always produces data without any I/O besides an optional
 * local file.
 *
 * <p>Resolution order:</p>
 * <ol>
 *   <li>the configured fallback file, read on every call; when keyed by endpoint,
 *       the entry for the request endpoint (falling through when absent)</li>
 *   <li>the first {@link DefaultEntityTemplate} whose pattern matches the endpoint</li>
 *   <li>per-field defaults inferred from the request's sample data</li>
 * </ol>
 * <p>Map results are then back-filled with {@code timestamp}, {@code id},
 * {@code status} and {@code message} unless smart defaults are disabled. Any
 * failure is answered with the emergency payload.</p>
 */
@Slf4j
public class StaticDefaultStage implements FallbackStage {

    public static final String DEFAULT_NAME = "static-default";
    public static final String FALLBACK_STATUS = "fallback";

    private final StageDescriptor descriptor;
    private final ObjectMapper objectMapper;
    private final Path fallbackFile;
    private final boolean keyedByEndpoint;
    private final boolean smartDefaults;
    private final List<DefaultEntityTemplate> templates;
    private final Clock clock;
    private final TransformationChain<Map<String, Object>, Map<String, Object>> smartDefaultsChain;

    @Builder
    public StaticDefaultStage(StageDescriptor descriptor,
                              ObjectMapper objectMapper,
                              Path fallbackFile,
                              Boolean keyedByEndpoint,
                              Boolean smartDefaults,
                              List<DefaultEntityTemplate> templates,
                              Clock clock) {
        this.descriptor = descriptor != null ? descriptor : defaultDescriptor();
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.fallbackFile = fallbackFile;
        this.keyedByEndpoint = keyedByEndpoint == null || keyedByEndpoint;
        this.smartDefaults = smartDefaults == null || smartDefaults;
        this.templates = templates != null ? List.copyOf(templates) : DefaultEntityTemplate.defaults();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.smartDefaultsChain = TransformationChain.<Map<String, Object>, Map<String, Object>>create()
                .then(new DefaultFieldTransformer("timestamp", context -> this.clock.instant().toString()))
                .then(new DefaultFieldTransformer("id", context -> UUID.randomUUID().toString()))
                .then(new DefaultFieldTransformer("status", context -> FALLBACK_STATUS))
                .then(new DefaultFieldTransformer("message",
                        context -> "Fallback data served for " + context.getEndpoint()));
    }

    /**
     * Default descriptor: terminal, no timeout, no retries, no breaker.
     *
     * @return the default descriptor
     */
    public static StageDescriptor defaultDescriptor() {
        return StageDescriptor.builder()
                .name(DEFAULT_NAME)
                .priority(5)
                .timeoutMs(0)
                .retryCount(0)
                .circuitBreakerThreshold(0)
                .trustScore(0.2)
                .terminal(true)
                .build();
    }

    @Override
    public StageDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Mono<StageResult> execute(FallbackRequest request) {
        return Mono.defer(() -> fromFile(request)
                        .switchIfEmpty(Mono.fromCallable(() -> synthesize(request)))
                        .flatMap(data -> applySmartDefaults(data, request))
                        .map(data -> StageResult.success(getName(), data, StageMetadata.builder()
                                .source(getName())
                                .build())))
                .onErrorResume(e -> {
                    log.error("Static default generation failed for {}, serving emergency payload",
                            request.getEndpoint(), e);
                    return Mono.just(StageResult.success(getName(), emergencyPayload(e), StageMetadata.builder()
                            .source(getName())
                            .errorDetails(e.getMessage())
                            .build()));
                });
    }

    @Override
    public Mono<Boolean> healthCheck() {
        if (fallbackFile == null) {
            return Mono.just(true);
        }
        return Mono.fromCallable(() -> Files.isReadable(fallbackFile))
                .onErrorReturn(false);
    }

    private Mono<Object> fromFile(FallbackRequest request) {
        if (fallbackFile == null) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> {
            Object document = objectMapper.readValue(fallbackFile.toFile(), Object.class);
            if (!keyedByEndpoint) {
                return document;
            }
            if (document instanceof Map<?, ?> entries) {
                Object entry = entries.get(request.getEndpoint());
                if (entry == null) {
                    log.debug("No fallback file entry for {}", request.getEndpoint());
                }
                return entry;
            }
            return null;
        });
    }

    private Object synthesize(FallbackRequest request) {
        for (DefaultEntityTemplate template : templates) {
            Optional<Map<String, Object>> entity = template.match(request.getEndpoint());
            if (entity.isPresent()) {
                log.debug("Synthesized default {} for {}", template.getEntity(), request.getEndpoint());
                return entity.get();
            }
        }
        return inferDefaults(request.getData());
    }

    private Map<String, Object> inferDefaults(Object sample) {
        Map<String, Object> defaults = new LinkedHashMap<>();
        if (sample instanceof Map<?, ?> fields) {
            fields.forEach((name, value) -> defaults.put(String.valueOf(name), defaultFor(value)));
        }
        return defaults;
    }

    private Object defaultFor(Object value) {
        if (value instanceof CharSequence) {
            return "";
        }
        if (value instanceof Number) {
            return 0;
        }
        if (value instanceof Boolean) {
            return false;
        }
        if (value instanceof Collection || (value != null && value.getClass().isArray())) {
            return new ArrayList<>();
        }
        if (value instanceof Map) {
            return new LinkedHashMap<>();
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private Mono<Object> applySmartDefaults(Object data, FallbackRequest request) {
        if (!smartDefaults || !(data instanceof Map)) {
            return Mono.just(data);
        }
        return smartDefaultsChain.execute((Map<String, Object>) data, TransformContext.of(getName(), request.getEndpoint()))
                .cast(Object.class);
    }

    private Map<String, Object> emergencyPayload(Throwable error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", "error");
        payload.put("fallback", true);
        payload.put("data", null);
        payload.put("message", "Fallback data could not be generated: " + error.getMessage());
        payload.put("timestamp", clock.instant().toString());
        return payload;
    }
}
