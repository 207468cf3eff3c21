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

package org.fireflyframework.fallback.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.fallback.metrics.DashboardSummary;
import org.fireflyframework.fallback.metrics.SystemMetrics;
import org.fireflyframework.fallback.model.FallbackResult;
import org.fireflyframework.fallback.orchestrator.FallbackOrchestrator;
import org.fireflyframework.fallback.resiliency.CircuitBreakerSnapshot;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST surface of the fallback engine.
 *
 * <p><b>Example Usage:</b></p>
 * <pre>{@code
 * POST /api/v1/fallback/execute
 * {
 *   "endpoint": "/users/42",
 *   "method": "GET"
 * }
 * }</pre>
 *
 * <p>The response is always a successful {@link FallbackResult}; callers detect
 * degraded answers through {@code source}, {@code degraded} and {@code metadata}.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/fallback")
@Tag(name = "Fallback", description = "Staged fallback execution and monitoring")
public class FallbackController {

    private final FallbackOrchestrator orchestrator;

    public FallbackController(FallbackOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/execute")
    @Operation(
        summary = "Execute a request through the fallback cascade",
        description = "Tries every stage in priority order until one answers. The static default stage always answers."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Data produced by one of the stages",
            content = @Content(schema = @Schema(implementation = FallbackResult.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Malformed request (missing endpoint or invalid params)"
        )
    })
    public Mono<FallbackResult> execute(
            @Parameter(description = "Request with endpoint, optional method, data and params", required = true)
            @RequestBody Map<String, Object> request) {
        log.debug("Received fallback request for {}", request.get("endpoint"));
        return orchestrator.execute((Object) request);
    }

    @GetMapping("/metrics")
    @Operation(summary = "Aggregated stage metrics, anomalies and trends")
    public Mono<SystemMetrics> metrics() {
        return Mono.fromCallable(orchestrator::getMetrics);
    }

    @GetMapping(value = "/metrics/prometheus", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Metrics in the Prometheus text exposition format")
    public Mono<String> prometheus() {
        return Mono.fromCallable(orchestrator::getMonitoringExposition);
    }

    @GetMapping("/dashboard")
    @Operation(summary = "Dashboard summary with rankings and predictions")
    public Mono<DashboardSummary> dashboard() {
        return Mono.fromCallable(orchestrator::getDashboardSummary);
    }

    @GetMapping("/health")
    @Operation(
        summary = "Health of every stage's data source",
        description = "Returns 200 when at least one non-terminal stage is healthy, 503 otherwise"
    )
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return orchestrator.healthCheck()
                .map(stages -> {
                    List<String> names = orchestrator.getStages().stream()
                            .filter(stage -> !stage.isTerminal())
                            .map(stage -> stage.getName())
                            .toList();
                    boolean upstreamAvailable = names.isEmpty()
                            || names.stream().anyMatch(name -> Boolean.TRUE.equals(stages.get(name)));

                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", upstreamAvailable ? "UP" : "DEGRADED");
                    body.put("stages", stages);
                    return ResponseEntity.status(upstreamAvailable ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                            .body(body);
                });
    }

    @GetMapping("/circuit-breakers")
    @Operation(summary = "State of every stage circuit breaker")
    public Mono<List<CircuitBreakerSnapshot>> circuitBreakers() {
        return Mono.fromCallable(orchestrator::getCircuitBreakerSnapshots);
    }
}
