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

package org.fireflyframework.fallback.transport;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.fallback.exception.ResponseTransformationException;
import org.fireflyframework.fallback.exception.TransportException;
import org.fireflyframework.fallback.exception.UpstreamStatusException;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.UnsupportedMediaTypeException;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * {@link ApiTransport} backed by a Spring WebFlux {@link WebClient}.
 *
 * <p>The client is expected to carry the base URL of the upstream service. A query
 * string embedded in the call path is kept as a query and merged with the call's
 * query parameters.
 * Response bodies are decoded as generic JSON ({@code Map}, {@code List} or scalar).</p>
 */
@Slf4j
public class WebClientApiTransport implements ApiTransport {

    private final String stageName;
    private final WebClient webClient;

    /**
     * Creates a transport for one stage.
     *
     * @param stageName the owning stage, reported in failures
     * @param webClient a client configured with the upstream base URL
     */
    public WebClientApiTransport(String stageName, WebClient webClient) {
        this.stageName = stageName;
        this.webClient = webClient;
    }

    @Override
    public Mono<ApiResponse> send(ApiCall call) {
        return Mono.defer(() -> {
            long start = System.nanoTime();

            UriComponents target = UriComponentsBuilder.fromUriString(call.getPath()).build();
            WebClient.RequestBodySpec bodySpec = webClient.method(call.getMethod())
                    .uri(uriBuilder -> {
                        uriBuilder.path(target.getPath());
                        if (target.getQuery() != null) {
                            uriBuilder.query(target.getQuery());
                        }
                        call.getQueryParams().forEach((name, value) -> uriBuilder.queryParam(name, value));
                        return uriBuilder.build();
                    });
            WebClient.RequestHeadersSpec<?> request = call.getBody() != null
                    ? bodySpec.bodyValue(call.getBody())
                    : bodySpec;

            log.debug("Stage '{}' sending {} {}", stageName, call.getMethod(), call.getPath());

            return request.accept(MediaType.APPLICATION_JSON)
                    .exchangeToMono(response -> handleResponse(response, start));
        })
        .onErrorMap(WebClientRequestException.class, e -> new TransportException(stageName,
                "Request to " + call.getPath() + " failed: " + e.getMessage(), e))
        .onErrorMap(e -> e instanceof DecodingException || e instanceof UnsupportedMediaTypeException,
                e -> new ResponseTransformationException(stageName,
                        "Could not decode response from " + call.getPath() + ": " + e.getMessage(), e));
    }

    @Override
    public Mono<Integer> probe(String path, Duration timeout) {
        return webClient.get()
                .uri(path)
                .exchangeToMono(response -> response.releaseBody()
                        .thenReturn(response.statusCode().value()))
                .timeout(timeout);
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response, long start) {
        int status = response.statusCode().value();

        if (!response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMap(body -> Mono.error(new UpstreamStatusException(stageName, status, body)));
        }

        return response.bodyToMono(Object.class)
                .map(body -> toApiResponse(status, body, start))
                .switchIfEmpty(Mono.fromSupplier(() -> toApiResponse(status, null, start)));
    }

    private ApiResponse toApiResponse(int status, Object body, long start) {
        return ApiResponse.builder()
                .statusCode(status)
                .body(body)
                .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start))
                .build();
    }
}
