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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.fallback.model.FallbackRequest;
import org.fireflyframework.fallback.model.StageDescriptor;
import org.fireflyframework.fallback.model.StageMetadata;
import org.fireflyframework.fallback.model.StageResult;
import org.fireflyframework.fallback.transport.ApiCall;
import org.fireflyframework.fallback.transport.ApiResponse;
import org.fireflyframework.fallback.transport.ApiTransport;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Set;

/**
 * Base class for stages backed by an upstream HTTP API.
 *
 * <p>Subclasses customize the outbound call with {@link #prepareCall(FallbackRequest)}
 * and the stage result with {@link #toResult(FallbackRequest, ApiResponse)}.
 * Health is a {@code GET} of the configured health path, healthy when the status
 * is one of the accepted codes.</p>
 */
@Slf4j
public abstract class AbstractApiStage implements FallbackStage {

    private static final Set<HttpMethod> BODYLESS_METHODS = Set.of(HttpMethod.GET, HttpMethod.HEAD);

    protected final StageDescriptor descriptor;
    protected final ApiTransport transport;
    private final String healthPath;
    private final Duration healthTimeout;
    private final Set<Integer> healthyStatuses;

    protected AbstractApiStage(StageDescriptor descriptor,
                               ApiTransport transport,
                               String healthPath,
                               Duration healthTimeout,
                               Set<Integer> healthyStatuses) {
        this.descriptor = descriptor;
        this.transport = transport;
        this.healthPath = healthPath;
        this.healthTimeout = healthTimeout;
        this.healthyStatuses = Set.copyOf(healthyStatuses);
    }

    @Override
    public StageDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Mono<StageResult> execute(FallbackRequest request) {
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            return prepareCall(request)
                    .flatMap(transport::send)
                    .flatMap(response -> toResult(request, response))
                    .map(result -> result.toBuilder()
                            .durationMs(System.currentTimeMillis() - start)
                            .build());
        });
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return transport.probe(healthPath, healthTimeout)
                .map(healthyStatuses::contains)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.debug("Health check of stage '{}' failed: {}", getName(), e.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Builds the outbound call. The default sends the request as is; the body is
     * only attached to methods that carry one.
     *
     * @param request the normalized request
     * @return the call to send
     */
    protected Mono<ApiCall> prepareCall(FallbackRequest request) {
        return Mono.fromCallable(() -> buildCall(request, request.getEndpoint(), request.getData()));
    }

    /**
     * Converts a 2xx response into the stage result.
     *
     * @param request  the normalized request
     * @param response the decoded response
     * @return the stage result
     */
    protected Mono<StageResult> toResult(FallbackRequest request, ApiResponse response) {
        return Mono.just(StageResult.success(getName(), response.getBody(), metadataFor(response).build()));
    }

    protected ApiCall buildCall(FallbackRequest request, String path, Object body) {
        HttpMethod method = HttpMethod.valueOf(request.getMethod());
        return ApiCall.builder()
                .method(method)
                .path(path)
                .body(BODYLESS_METHODS.contains(method) ? null : body)
                .queryParams(request.getParams())
                .build();
    }

    protected StageMetadata.StageMetadataBuilder metadataFor(ApiResponse response) {
        return StageMetadata.builder()
                .source(getName())
                .statusCode(response.getStatusCode());
    }
}
