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

package org.fireflyframework.fallback.model;

import org.fireflyframework.fallback.exception.FallbackConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FallbackConfiguration}.
 */
class FallbackConfigurationTest {

    private static StageDescriptor stage(String name, int priority) {
        return StageDescriptor.builder()
                .name(name)
                .priority(priority)
                .timeoutMs(1000)
                .retryCount(1)
                .circuitBreakerThreshold(3)
                .build();
    }

    private static StageDescriptor terminal(String name, int priority) {
        return StageDescriptor.builder()
                .name(name)
                .priority(priority)
                .terminal(true)
                .build();
    }

    @Test
    void resolveStages_shouldApplyPositionalOverrides() {
        // Given
        FallbackConfiguration configuration = FallbackConfiguration.builder()
                .stages(List.of(stage("primary", 1), stage("secondary", 2), terminal("static", 3)))
                .timeouts(List.of(200, 400, 0))
                .retryAttempts(List.of(0, 3, 0))
                .build();

        // When
        List<StageDescriptor> resolved = configuration.resolveStages();

        // Then
        assertThat(resolved).extracting(StageDescriptor::getTimeoutMs).containsExactly(200L, 400L, 0L);
        assertThat(resolved).extracting(StageDescriptor::getRetryCount).containsExactly(0, 3, 0);
        assertThat(resolved).extracting(StageDescriptor::getCircuitBreakerThreshold).containsExactly(3, 3, 0);
    }

    @Test
    void resolveStages_shouldKeepDescriptorValues_whenOverridesEmpty() {
        FallbackConfiguration configuration = FallbackConfiguration.builder()
                .stages(List.of(stage("primary", 1), terminal("static", 2)))
                .build();

        assertThat(configuration.resolveStages().get(0).getTimeoutMs()).isEqualTo(1000);
    }

    @Test
    void resolveStages_shouldRejectMisalignedOverrides() {
        FallbackConfiguration configuration = FallbackConfiguration.builder()
                .stages(List.of(stage("primary", 1), terminal("static", 2)))
                .timeouts(List.of(100))
                .build();

        assertThatThrownBy(configuration::resolveStages)
                .isInstanceOf(FallbackConfigurationException.class)
                .hasMessageContaining("timeouts");
    }

    @Test
    void validate_shouldRejectNonIncreasingPriorities() {
        assertThatThrownBy(() -> FallbackConfiguration.validate(
                List.of(stage("a", 2), stage("b", 2), terminal("static", 3))))
                .isInstanceOf(FallbackConfigurationException.class)
                .hasMessageContaining("priority");
    }

    @Test
    void validate_shouldRejectDuplicateNames() {
        assertThatThrownBy(() -> FallbackConfiguration.validate(
                List.of(stage("a", 1), stage("a", 2), terminal("static", 3))))
                .isInstanceOf(FallbackConfigurationException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void validate_shouldRequireExactlyOneTerminalStageInLastPosition() {
        assertThatThrownBy(() -> FallbackConfiguration.validate(List.of(stage("a", 1), stage("b", 2))))
                .isInstanceOf(FallbackConfigurationException.class)
                .hasMessageContaining("Exactly one terminal stage");

        assertThatThrownBy(() -> FallbackConfiguration.validate(List.of(terminal("static", 1), stage("a", 2))))
                .isInstanceOf(FallbackConfigurationException.class)
                .hasMessageContaining("must be the last stage");
    }

    @Test
    void validate_shouldRejectTerminalStageWithRetriesOrBreaker() {
        StageDescriptor retrying = terminal("static", 2).toBuilder().retryCount(1).circuitBreakerThreshold(2).build();

        assertThatThrownBy(() -> FallbackConfiguration.validate(List.of(stage("a", 1), retrying)))
                .isInstanceOfSatisfying(FallbackConfigurationException.class, e -> {
                    assertThat(e.getMessage()).contains("retryCount 0");
                    assertThat(e.getMessage()).contains("circuit breaker");
                });
    }
}
