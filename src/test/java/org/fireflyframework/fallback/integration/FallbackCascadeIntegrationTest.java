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

package org.fireflyframework.fallback.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.fallback.config.FallbackProperties;
import org.fireflyframework.fallback.config.FallbackStageFactory;
import org.fireflyframework.fallback.controller.FallbackController;
import org.fireflyframework.fallback.controller.advice.FallbackExceptionHandler;
import org.fireflyframework.fallback.metrics.MetricsCollector;
import org.fireflyframework.fallback.model.CacheWriteMode;
import org.fireflyframework.fallback.orchestrator.FallbackOrchestrator;
import org.fireflyframework.fallback.transform.MappingRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end cascade through the stage factory, orchestrator and HTTP layer,
 * with upstream services simulated at the WebClient exchange level.
 */
class FallbackCascadeIntegrationTest {

    private final List<String> upstreamCalls = new CopyOnWriteArrayList<>();

    private volatile boolean primaryUp;
    private volatile boolean secondaryUp;

    private MetricsCollector metricsCollector;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        FallbackProperties properties = new FallbackProperties();
        properties.setCacheWriteMode(CacheWriteMode.SYNC);
        properties.getPrimaryApi().setBaseUrl("http://primary.test");
        properties.getPrimaryApi().setRetryCount(0);
        properties.getSecondaryApi().setBaseUrl("http://secondary.test");
        properties.getSecondaryApi().setRetryCount(0);
        properties.getSecondaryApi().setEndpointMappings(List.of(MappingRule.of("/users", "/api/v2/accounts")));
        properties.getSecondaryApi().setResponseFieldMappings(List.of(MappingRule.of("userName", "name")));

        WebClient.Builder webClientBuilder = WebClient.builder().exchangeFunction(this::upstream);
        FallbackStageFactory factory = new FallbackStageFactory(properties, webClientBuilder, new ObjectMapper(), null);

        metricsCollector = new MetricsCollector(properties.getMetrics());
        FallbackOrchestrator orchestrator = FallbackOrchestrator.builder()
                .stages(factory.createStages())
                .initialBackoff(Duration.ofMillis(1))
                .metricsCollector(metricsCollector)
                .cacheWriteMode(properties.getCacheWriteMode())
                .build();

        webTestClient = WebTestClient.bindToController(new FallbackController(orchestrator))
                .controllerAdvice(new FallbackExceptionHandler())
                .build();
    }

    private Mono<ClientResponse> upstream(ClientRequest request) {
        String host = request.url().getHost();
        upstreamCalls.add(host + request.url().getPath());
        boolean up = "primary.test".equals(host) ? primaryUp : secondaryUp;
        if (!up) {
            return Mono.error(new WebClientRequestException(new ConnectException("Connection refused"),
                    request.method(), request.url(), request.headers()));
        }
        String body = "primary.test".equals(host)
                ? "{\"id\":\"42\",\"name\":\"John\"}"
                : "{\"id\":\"42\",\"userName\":\"John (secondary)\"}";
        return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    private WebTestClient.BodyContentSpec execute(String endpoint) {
        return webTestClient.post()
                .uri("/api/v1/fallback/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("endpoint", endpoint))
                .exchange()
                .expectStatus().isOk()
                .expectBody();
    }

    @Test
    void shouldServeFromPrimary_whenHealthy() {
        primaryUp = true;

        execute("/users/42")
                .jsonPath("$.source").isEqualTo("primary-api")
                .jsonPath("$.data.name").isEqualTo("John")
                .jsonPath("$.degraded").isEqualTo(false);

        assertThat(upstreamCalls).containsExactly("primary.test/users/42");
    }

    @Test
    void shouldRemapToSecondary_whenPrimaryIsDown() {
        secondaryUp = true;

        execute("/users/42")
                .jsonPath("$.source").isEqualTo("secondary-api")
                .jsonPath("$.data.name").isEqualTo("John (secondary)")
                .jsonPath("$.metadata.transformed").isEqualTo(true)
                .jsonPath("$.failedAttempts[0].stageName").isEqualTo("primary-api");

        assertThat(upstreamCalls).containsExactly("primary.test/users/42", "secondary.test/api/v2/accounts/42");
    }

    @Test
    void shouldServeCachedCopy_afterBothApisGoDown() {
        // Given - a successful call primes the memory cache
        primaryUp = true;
        execute("/users/42").jsonPath("$.source").isEqualTo("primary-api");
        primaryUp = false;

        // When & Then
        execute("/users/42")
                .jsonPath("$.source").isEqualTo("memory-cache")
                .jsonPath("$.data.name").isEqualTo("John")
                .jsonPath("$.metadata.cached").isEqualTo(true);
    }

    @Test
    void shouldServeStaticDefault_whenEverythingIsDown() {
        execute("/users/42")
                .jsonPath("$.source").isEqualTo("static-default")
                .jsonPath("$.data.id").isEqualTo("42")
                .jsonPath("$.data.status").isEqualTo("fallback")
                .jsonPath("$.failedAttempts.length()").isEqualTo(3);

        assertThat(metricsCollector.getMetrics().getTotalEvaluations()).isEqualTo(4);
    }

    @Test
    void shouldOpenPrimaryBreaker_afterRepeatedFailures() {
        secondaryUp = true;
        for (int i = 0; i < 3; i++) {
            execute("/users/42").jsonPath("$.source").isEqualTo("secondary-api");
        }

        execute("/users/42")
                .jsonPath("$.failedAttempts[0].skipped").isEqualTo(true)
                .jsonPath("$.failedAttempts[0].reason").isEqualTo("circuit breaker open");

        webTestClient.get()
                .uri("/api/v1/fallback/circuit-breakers")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].stageName").isEqualTo("primary-api")
                .jsonPath("$[0].state").isEqualTo("OPEN");
    }

    @Test
    void shouldReportPerStageHealth_whenApisAreDown() {
        webTestClient.get()
                .uri("/api/v1/fallback/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.stages['memory-cache']").isEqualTo(true)
                .jsonPath("$.stages['primary-api']").isEqualTo(false);
    }

    @Test
    void shouldRejectRequestWithoutEndpoint() {
        webTestClient.post()
                .uri("/api/v1/fallback/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("method", "GET"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid Request");
    }
}
