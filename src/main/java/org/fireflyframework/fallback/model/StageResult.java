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
import lombok.Value;

/**
 * Outcome of one stage execution. {@code data} is meaningful when {@code success}
 * is true, {@code error} otherwise.
 */
@Value
@Builder(toBuilder = true)
public class StageResult {

    boolean success;
    Object data;
    String error;
    String stageName;
    long durationMs;
    StageMetadata metadata;

    /**
     * Creates a successful result.
     *
     * @param stageName the producing stage
     * @param data      the payload
     * @param metadata  provenance of the payload
     * @return a successful {@link StageResult}
     */
    public static StageResult success(String stageName, Object data, StageMetadata metadata) {
        return StageResult.builder()
                .success(true)
                .stageName(stageName)
                .data(data)
                .metadata(metadata)
                .build();
    }

    /**
     * Creates a failed result.
     *
     * @param stageName  the failing stage
     * @param error      a human-readable description of the failure
     * @param durationMs time spent on the stage
     * @return a failed {@link StageResult}
     */
    public static StageResult failure(String stageName, String error, long durationMs) {
        return StageResult.builder()
                .success(false)
                .stageName(stageName)
                .error(error)
                .durationMs(durationMs)
                .metadata(StageMetadata.builder()
                        .source(stageName)
                        .errorDetails(error)
                        .build())
                .build();
    }
}
