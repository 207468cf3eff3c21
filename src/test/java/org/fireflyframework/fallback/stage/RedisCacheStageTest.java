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
import org.fireflyframework.fallback.exception.CacheMissException;
import org.fireflyframework.fallback.exception.ResponseTransformationException;
import org.fireflyframework.fallback.exception.TransportException;
import org.fireflyframework.fallback.model.FallbackRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RedisCacheStage}.
 */
@ExtendWith(MockitoExtension.class)
class RedisCacheStageTest {

    @Mock
    private ReactiveRedisTemplate<String, String> redisTemplate;

    @Mock
    private ReactiveValueOperations<String, String> valueOperations;

    private RedisCacheStage stage;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        stage = new RedisCacheStage(RedisCacheStage.defaultDescriptor(), redisTemplate, new ObjectMapper(),
                "test:", Duration.ofMinutes(10));
    }

    @Test
    void execute_shouldDeserializeCachedJson() {
        // Given
        when(valueOperations.get("test:GET:/users/1")).thenReturn(Mono.just("{\"id\":1,\"name\":\"Ada\"}"));

        // When & Then
        StepVerifier.create(stage.execute(FallbackRequest.ofPath("/users/1")))
                .assertNext(result -> {
                    assertThat(result.getData()).isEqualTo(Map.of("id", 1, "name", "Ada"));
                    assertThat(result.getMetadata().isCached()).isTrue();
                    assertThat(result.getStageName()).isEqualTo("redis-cache");
                })
                .verifyComplete();
    }

    @Test
    void execute_shouldMiss_whenKeyAbsent() {
        when(valueOperations.get(anyString())).thenReturn(Mono.empty());

        StepVerifier.create(stage.execute(FallbackRequest.ofPath("/users/1")))
                .expectError(CacheMissException.class)
                .verify();
    }

    @Test
    void execute_shouldReportTransportFailure_whenRedisIsDown() {
        when(valueOperations.get(anyString()))
                .thenReturn(Mono.error(new RedisConnectionFailureException("connection refused")));

        StepVerifier.create(stage.execute(FallbackRequest.ofPath("/users/1")))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(TransportException.class);
                    assertThat(((TransportException) error).isRetryable()).isTrue();
                })
                .verify();
    }

    @Test
    void execute_shouldReportTransformationFailure_forCorruptValue() {
        when(valueOperations.get(anyString())).thenReturn(Mono.just("{broken"));

        StepVerifier.create(stage.execute(FallbackRequest.ofPath("/users/1")))
                .expectError(ResponseTransformationException.class)
                .verify();
    }

    @Test
    void write_shouldStoreJsonWithTtl() {
        when(valueOperations.set("test:GET:/users/1", "{\"id\":1}", Duration.ofMinutes(10)))
                .thenReturn(Mono.just(true));

        StepVerifier.create(stage.write(FallbackRequest.ofPath("/users/1"), Map.of("id", 1)))
                .verifyComplete();

        verify(valueOperations).set("test:GET:/users/1", "{\"id\":1}", Duration.ofMinutes(10));
    }

    @Test
    void healthCheck_shouldReflectRedisReachability() {
        when(redisTemplate.hasKey("test:health"))
                .thenReturn(Mono.just(false), Mono.error(new RedisConnectionFailureException("down")));

        StepVerifier.create(stage.healthCheck()).expectNext(true).verifyComplete();
        StepVerifier.create(stage.healthCheck()).expectNext(false).verifyComplete();
    }
}
