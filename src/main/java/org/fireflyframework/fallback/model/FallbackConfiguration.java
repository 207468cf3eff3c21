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

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.fallback.exception.FallbackConfigurationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Construction-time description of the stage chain.
 *
 * <p>The {@code timeouts}, {@code retryAttempts} and {@code circuitBreakerThresholds}
 * lists are positional overrides aligned with {@code stages}. An empty list keeps
 * the values declared on each {@link StageDescriptor}; a non-empty list must have
 * exactly one entry per stage.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * FallbackConfiguration configuration = FallbackConfiguration.builder()
 *     .stages(List.of(primary, secondary, staticDefault))
 *     .timeouts(List.of(3000, 5000, 0))
 *     .build();
 * List<StageDescriptor> resolved = configuration.resolveStages();
 * }</pre>
 */
@Data
@Builder
public class FallbackConfiguration {

    private final List<StageDescriptor> stages;

    @Builder.Default
    private final List<Integer> timeouts = List.of();

    @Builder.Default
    private final List<Integer> retryAttempts = List.of();

    @Builder.Default
    private final List<Integer> circuitBreakerThresholds = List.of();

    /**
     * Applies the positional overrides and validates the resulting chain.
     *
     * @return the effective descriptors, in configured order
     * @throws FallbackConfigurationException if the chain is invalid
     */
    public List<StageDescriptor> resolveStages() {
        if (stages == null || stages.isEmpty()) {
            throw new FallbackConfigurationException("At least one stage must be configured");
        }

        List<String> errors = new ArrayList<>();
        checkAligned("timeouts", timeouts, errors);
        checkAligned("retryAttempts", retryAttempts, errors);
        checkAligned("circuitBreakerThresholds", circuitBreakerThresholds, errors);
        if (!errors.isEmpty()) {
            throw new FallbackConfigurationException(errors);
        }

        List<StageDescriptor> resolved = new ArrayList<>(stages.size());
        for (int i = 0; i < stages.size(); i++) {
            StageDescriptor.StageDescriptorBuilder builder = stages.get(i).toBuilder();
            if (!timeouts.isEmpty()) {
                builder.timeoutMs(timeouts.get(i));
            }
            if (!retryAttempts.isEmpty()) {
                builder.retryCount(retryAttempts.get(i));
            }
            if (!circuitBreakerThresholds.isEmpty()) {
                builder.circuitBreakerThreshold(circuitBreakerThresholds.get(i));
            }
            resolved.add(builder.build());
        }

        validate(resolved);
        return List.copyOf(resolved);
    }

    /**
     * Checks the chain invariants: unique names, strictly increasing priorities,
     * and exactly one terminal stage placed last with no retries and no breaker.
     *
     * @param descriptors the descriptors in execution order
     * @throws FallbackConfigurationException listing every violation found
     */
    public static void validate(List<StageDescriptor> descriptors) {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();
        int terminalCount = 0;

        for (int i = 0; i < descriptors.size(); i++) {
            StageDescriptor descriptor = descriptors.get(i);
            String name = descriptor.getName();

            if (name == null || name.isBlank()) {
                errors.add("Stage at position " + i + " has no name");
            } else if (!names.add(name)) {
                errors.add("Duplicate stage name '" + name + "'");
            }
            if (i > 0 && descriptor.getPriority() <= descriptors.get(i - 1).getPriority()) {
                errors.add("Stage '" + name + "' priority " + descriptor.getPriority()
                        + " does not increase over the previous stage");
            }
            if (descriptor.getRetryCount() < 0) {
                errors.add("Stage '" + name + "' has a negative retry count");
            }
            if (descriptor.getTrustScore() < 0.0 || descriptor.getTrustScore() > 1.0) {
                errors.add("Stage '" + name + "' trust score must be within [0, 1]");
            }
            if (descriptor.isTerminal()) {
                terminalCount++;
                if (i != descriptors.size() - 1) {
                    errors.add("Terminal stage '" + name + "' must be the last stage");
                }
                if (descriptor.getRetryCount() != 0) {
                    errors.add("Terminal stage '" + name + "' must have retryCount 0");
                }
                if (descriptor.hasCircuitBreaker()) {
                    errors.add("Terminal stage '" + name + "' must not have a circuit breaker");
                }
            }
        }

        if (terminalCount != 1) {
            errors.add("Exactly one terminal stage is required, found " + terminalCount);
        }
        if (!errors.isEmpty()) {
            throw new FallbackConfigurationException(errors);
        }
    }

    private void checkAligned(String field, List<Integer> values, List<String> errors) {
        if (values.isEmpty()) {
            return;
        }
        if (values.size() != stages.size()) {
            errors.add(field + " has " + values.size() + " entries but " + stages.size() + " stages are configured");
            return;
        }
        for (Integer value : values) {
            if (value == null || value < 0) {
                errors.add(field + " entries must be non-negative");
                return;
            }
        }
    }
}
