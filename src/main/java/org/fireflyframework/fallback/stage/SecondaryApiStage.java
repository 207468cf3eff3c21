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

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.fallback.exception.ResponseTransformationException;
import org.fireflyframework.fallback.exception.StageExecutionException;
import org.fireflyframework.fallback.model.FallbackRequest;
import org.fireflyframework.fallback.model.StageDescriptor;
import org.fireflyframework.fallback.model.StageResult;
import org.fireflyframework.fallback.transform.DataTransformer;
import org.fireflyframework.fallback.transform.MappingTable;
import org.fireflyframework.fallback.transform.TransformContext;
import org.fireflyframework.fallback.transform.transformers.FieldMappingTransformer;
import org.fireflyframework.fallback.transport.ApiCall;
import org.fireflyframework.fallback.transport.ApiResponse;
import org.fireflyframework.fallback.transport.ApiTransport;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stage calling the backup API, whose contract may differ from the primary one.
 *
 * <p>Outbound, the endpoint is rewritten through the endpoint mapping table and the
 * fields of a map body are renamed through the field mapping table. Inbound, the
 * response is reshaped either by a custom transformer or by the response field
 * mapping table; either marks the result metadata as transformed.</p>
 */
@Slf4j
public class SecondaryApiStage extends AbstractApiStage {

    public static final String DEFAULT_NAME = "secondary-api";

    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(3);

    private final MappingTable endpointMappings;
    private final FieldMappingTransformer requestFieldMapper;
    private final boolean mapsRequestFields;
    private final DataTransformer<Object, Object> responseTransformer;

    @Builder
    public SecondaryApiStage(StageDescriptor descriptor,
                             ApiTransport transport,
                             String healthPath,
                             MappingTable endpointMappings,
                             MappingTable fieldMappings,
                             MappingTable responseFieldMappings,
                             DataTransformer<Object, Object> responseTransformer) {
        super(descriptor != null ? descriptor : defaultDescriptor(), transport, healthPath,
                HEALTH_TIMEOUT, Set.of(200, 204));
        this.endpointMappings = endpointMappings != null ? endpointMappings : MappingTable.empty();
        MappingTable requestFields = fieldMappings != null ? fieldMappings : MappingTable.empty();
        this.requestFieldMapper = new FieldMappingTransformer(requestFields);
        this.mapsRequestFields = !requestFields.isEmpty();

        if (responseTransformer != null) {
            this.responseTransformer = responseTransformer;
        } else if (responseFieldMappings != null && !responseFieldMappings.isEmpty()) {
            FieldMappingTransformer mapper = new FieldMappingTransformer(responseFieldMappings);
            this.responseTransformer = (body, context) -> mapResponseFields(mapper, body, context);
        } else {
            this.responseTransformer = null;
        }
    }

    /**
     * Default descriptor: 5 s timeout, 1 retry, breaker after 3 failures.
     *
     * @return the default descriptor
     */
    public static StageDescriptor defaultDescriptor() {
        return StageDescriptor.builder()
                .name(DEFAULT_NAME)
                .priority(2)
                .timeoutMs(5000)
                .retryCount(1)
                .circuitBreakerThreshold(3)
                .trustScore(0.9)
                .build();
    }

    @Override
    @SuppressWarnings("unchecked")
    protected Mono<ApiCall> prepareCall(FallbackRequest request) {
        String path = endpointMappings.remapPath(request.getEndpoint());
        if (!path.equals(request.getEndpoint())) {
            log.debug("Stage '{}' remapped endpoint {} to {}", getName(), request.getEndpoint(), path);
        }

        Object data = request.getData();
        if (!mapsRequestFields || !(data instanceof Map)) {
            return Mono.just(buildCall(request, path, data));
        }

        return requestFieldMapper.transform((Map<String, Object>) data, TransformContext.of(getName(), path))
                .map(body -> buildCall(request, path, body))
                .onErrorMap(e -> !(e instanceof StageExecutionException), e -> new ResponseTransformationException(
                        getName(), "Could not map request fields: " + e.getMessage(), e));
    }

    @Override
    protected Mono<StageResult> toResult(FallbackRequest request, ApiResponse response) {
        if (responseTransformer == null || response.getBody() == null) {
            return super.toResult(request, response);
        }

        return responseTransformer.transform(response.getBody(), TransformContext.of(getName(), request.getEndpoint()))
                .map(body -> StageResult.success(getName(), body, metadataFor(response).transformed(true).build()))
                .onErrorMap(e -> !(e instanceof StageExecutionException), e -> new ResponseTransformationException(
                        getName(), "Could not transform response: " + e.getMessage(), e));
    }

    @SuppressWarnings("unchecked")
    private static Mono<Object> mapResponseFields(FieldMappingTransformer mapper, Object body, TransformContext context) {
        if (body instanceof Map) {
            return mapper.transform((Map<String, Object>) body, context).cast(Object.class);
        }
        if (body instanceof List) {
            return Flux.fromIterable((List<Object>) body)
                    .concatMap(element -> element instanceof Map
                            ? mapper.transform((Map<String, Object>) element, context).map(mapped -> (Object) mapped)
                            : Mono.just(element))
                    .collectList()
                    .cast(Object.class);
        }
        return Mono.just(body);
    }
}
