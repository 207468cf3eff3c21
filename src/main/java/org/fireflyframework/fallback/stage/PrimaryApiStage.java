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

import org.fireflyframework.fallback.model.StageDescriptor;
import org.fireflyframework.fallback.transport.ApiTransport;

import java.time.Duration;
import java.util.Set;

/**
 * Stage calling the authoritative upstream API.
 */
public class PrimaryApiStage extends AbstractApiStage {

    public static final String DEFAULT_NAME = "primary-api";

    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(2);

    public PrimaryApiStage(StageDescriptor descriptor, ApiTransport transport, String healthPath) {
        super(descriptor, transport, healthPath, HEALTH_TIMEOUT, Set.of(200));
    }

    /**
     * Default descriptor: 3 s timeout, 2 retries, breaker after 3 failures, full trust.
     *
     * @return the default descriptor
     */
    public static StageDescriptor defaultDescriptor() {
        return StageDescriptor.builder()
                .name(DEFAULT_NAME)
                .priority(1)
                .timeoutMs(3000)
                .retryCount(2)
                .circuitBreakerThreshold(3)
                .trustScore(1.0)
                .build();
    }
}
