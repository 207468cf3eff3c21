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

package org.fireflyframework.fallback.transform;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Context shared by the transformers of one chain execution.
 */
@Data
@Builder
public class TransformContext {

    private final String stageName;
    private final String endpoint;

    @Builder.Default
    private final Map<String, Object> metadata = new HashMap<>();

    @Builder.Default
    private final Instant startTime = Instant.now();

    /**
     * Creates a context for the given stage and endpoint.
     *
     * @param stageName the stage running the chain
     * @param endpoint  the logical endpoint of the request
     * @return a new context
     */
    public static TransformContext of(String stageName, String endpoint) {
        return TransformContext.builder()
                .stageName(stageName)
                .endpoint(endpoint)
                .build();
    }
}
