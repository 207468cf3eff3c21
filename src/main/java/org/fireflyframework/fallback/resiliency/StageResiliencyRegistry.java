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

package org.fireflyframework.fallback.resiliency;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.fallback.exception.CacheMissException;
import org.fireflyframework.fallback.model.StageDescriptor;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry that manages per-stage Resilience4j instances.
 *
 * <p>Every stage gets a retry instance sized from its descriptor. Stages with a
 * positive {@code circuitBreakerThreshold} also get a circuit breaker that opens
 * after that many consecutive failures, stays open for the configured cooldown
 * and then lets exactly one probe through.</p>
 *
 * <p>Decoration is applied in order: per-try timeout ({@link #withTimeout}),
 * then retry, then circuit breaker ({@link #decorate}). The breaker therefore
 * sees one outcome per exhausted stage, and an open breaker short-circuits the
 * whole stage including its retries.</p>
 */
@Slf4j
public class StageResiliencyRegistry {

    private final Map<String, StageResiliencyInstances> stageInstances;
    private final Clock clock;

    public StageResiliencyRegistry(List<StageDescriptor> stages,
                                   Duration cooldown,
                                   Duration initialBackoff,
                                   double backoffMultiplier) {
        this(stages, cooldown, initialBackoff, backoffMultiplier, Clock.systemUTC());
    }

    StageResiliencyRegistry(List<StageDescriptor> stages,
                            Duration cooldown,
                            Duration initialBackoff,
                            double backoffMultiplier,
                            Clock clock) {
        this.clock = clock;
        this.stageInstances = new LinkedHashMap<>();

        stages.forEach(descriptor -> {
            StageResiliencyInstances instances =
                    createInstances(descriptor, cooldown, initialBackoff, backoffMultiplier);
            stageInstances.put(descriptor.getName(), instances);
            log.info("Registered resilience configuration for stage '{}': "
                            + "timeoutMs={}, retries={}, circuitBreakerThreshold={}",
                    descriptor.getName(),
                    descriptor.getTimeoutMs(),
                    descriptor.getRetryCount(),
                    descriptor.getCircuitBreakerThreshold());
        });

        log.info("Initialized StageResiliencyRegistry with {} stages, cooldown {}", stageInstances.size(), cooldown);
    }

    /**
     * Applies the stage's per-try timeout, if it has one.
     *
     * @param stageName the stage name
     * @param attempt   a single try of the stage
     * @param <T>       the return type
     * @return the try bounded by the stage timeout
     */
    public <T> Mono<T> withTimeout(String stageName, Mono<T> attempt) {
        return require(stageName).descriptor().timeout()
                .map(attempt::timeout)
                .orElse(attempt);
    }

    /**
     * Decorates a (timed) stage try with the stage's retry and circuit breaker.
     *
     * <p>When the breaker rejects the call the returned Mono fails with
     * {@link io.github.resilience4j.circuitbreaker.CallNotPermittedException}
     * without subscribing to {@code attempt}.</p>
     *
     * @param stageName the stage name
     * @param attempt   a single try of the stage, resubscribed on every retry
     * @param <T>       the return type
     * @return the decorated operation
     */
    public <T> Mono<T> decorate(String stageName, Mono<T> attempt) {
        StageResiliencyInstances instances = require(stageName);
        Mono<T> decorated = attempt;

        if (instances.descriptor().getRetryCount() > 0) {
            log.debug("Applying retry to stage '{}' operation", stageName);
            decorated = decorated.transformDeferred(RetryOperator.of(instances.retry()));
        }

        if (instances.circuitBreaker() != null) {
            log.debug("Applying circuit breaker to stage '{}' operation", stageName);
            decorated = decorated.transformDeferred(CircuitBreakerOperator.of(instances.circuitBreaker()));
        }

        return decorated;
    }

    /**
     * Returns whether a stage is guarded by a circuit breaker.
     *
     * @param stageName the stage name
     * @return true if the stage has a breaker
     */
    public boolean hasCircuitBreaker(String stageName) {
        StageResiliencyInstances instances = stageInstances.get(stageName);
        return instances != null && instances.circuitBreaker() != null;
    }

    /**
     * Returns the breaker snapshot of one stage.
     *
     * @param stageName the stage name
     * @return the snapshot, or empty if the stage has no breaker
     */
    public Optional<CircuitBreakerSnapshot> getSnapshot(String stageName) {
        StageResiliencyInstances instances = stageInstances.get(stageName);
        if (instances == null || instances.circuitBreaker() == null) {
            return Optional.empty();
        }
        return Optional.of(instances.status().snapshot(stageName, instances.circuitBreaker().getState()));
    }

    /**
     * Returns the snapshots of every breaker, in stage order.
     *
     * @return breaker snapshots
     */
    public List<CircuitBreakerSnapshot> getSnapshots() {
        List<CircuitBreakerSnapshot> snapshots = new ArrayList<>();
        stageInstances.keySet().forEach(name -> getSnapshot(name).ifPresent(snapshots::add));
        return Collections.unmodifiableList(snapshots);
    }

    private StageResiliencyInstances require(String stageName) {
        StageResiliencyInstances instances = stageInstances.get(stageName);
        if (instances == null) {
            throw new IllegalArgumentException("Unknown stage '" + stageName + "'");
        }
        return instances;
    }

    private StageResiliencyInstances createInstances(StageDescriptor descriptor,
                                                     Duration cooldown,
                                                     Duration initialBackoff,
                                                     double backoffMultiplier) {
        String name = descriptor.getName();
        CircuitBreaker circuitBreaker = null;
        BreakerStatus status = new BreakerStatus(clock.instant());

        if (descriptor.hasCircuitBreaker()) {
            int threshold = descriptor.getCircuitBreakerThreshold();
            // A full count-based window at 100% failure rate opens after exactly N consecutive failures
            CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                    .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                    .slidingWindowSize(threshold)
                    .minimumNumberOfCalls(threshold)
                    .failureRateThreshold(100.0f)
                    .permittedNumberOfCallsInHalfOpenState(1)
                    .waitDurationInOpenState(cooldown)
                    .automaticTransitionFromOpenToHalfOpenEnabled(false)
                    .ignoreExceptions(CacheMissException.class)
                    .build();
            circuitBreaker = CircuitBreaker.of(name, cbConfig);

            circuitBreaker.getEventPublisher()
                    .onError(event -> status.recordFailure(clock.instant()))
                    .onSuccess(event -> status.recordSuccess())
                    .onStateTransition(event -> {
                        CircuitBreakerState to = CircuitBreakerState.from(event.getStateTransition().getToState());
                        status.recordTransition(to, clock.instant());
                        if (to == CircuitBreakerState.OPEN) {
                            log.warn("Circuit breaker for stage '{}' opened, cooldown {}", name, cooldown);
                        } else {
                            log.info("Circuit breaker for stage '{}' moved to {}", name, to);
                        }
                    });
        }

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(descriptor.getRetryCount() + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1L, initialBackoff.toMillis()), Math.max(1.0, backoffMultiplier)))
                .retryOnException(RetryPolicy::isRetryable)
                .build();
        Retry retry = Retry.of(name, retryConfig);
        retry.getEventPublisher()
                .onRetry(event -> log.debug("Retrying stage '{}' (attempt {}) after {}",
                        name, event.getNumberOfRetryAttempts(), event.getLastThrowable().toString()));

        return new StageResiliencyInstances(descriptor, circuitBreaker, retry, status);
    }

    /**
     * Holds the Resilience4j instances for a single stage.
     */
    private record StageResiliencyInstances(
            StageDescriptor descriptor,
            CircuitBreaker circuitBreaker,
            Retry retry,
            BreakerStatus status
    ) {}

    /**
     * Failure bookkeeping not exposed by Resilience4j metrics.
     */
    private static final class BreakerStatus {

        private int consecutiveFailures;
        private Instant lastFailureTime;
        private Instant lastStateChange;

        BreakerStatus(Instant created) {
            this.lastStateChange = created;
        }

        synchronized void recordFailure(Instant at) {
            consecutiveFailures++;
            lastFailureTime = at;
        }

        synchronized void recordSuccess() {
            consecutiveFailures = 0;
        }

        synchronized void recordTransition(CircuitBreakerState to, Instant at) {
            lastStateChange = at;
            if (to == CircuitBreakerState.HALF_OPEN) {
                consecutiveFailures = 0;
            }
        }

        synchronized CircuitBreakerSnapshot snapshot(String stageName, CircuitBreaker.State state) {
            return CircuitBreakerSnapshot.builder()
                    .stageName(stageName)
                    .state(CircuitBreakerState.from(state))
                    .consecutiveFailures(consecutiveFailures)
                    .lastFailureTime(lastFailureTime)
                    .lastStateChange(lastStateChange)
                    .build();
        }
    }
}
