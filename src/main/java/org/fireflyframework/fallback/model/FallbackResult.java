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

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Final answer of the fallback cascade for one logical request.
 *
 * <p>{@code success} is always true: degradation is reported through
 * {@link #getSource()}, {@link #isDegraded()} and {@link #getMetadata()}, never
 * through an error.</p>
 *
 * <p><b>Example Response:</b></p>
 * <pre>{@code
 * {
 *   "requestId": "9b2c0d1e-...",
 *   "success": true,
 *   "data": { "id": "42", "status": "fallback" },
 *   "source": "static-default",
 *   "totalDurationMs": 37,
 *   "degraded": true,
 *   "failedAttempts": [
 *     { "stageName": "primary-api", "skipped": false, "reason": "Connection refused", "tries": 3 }
 *   ]
 * }
 * }</pre>
 */
@Value
@Builder
@Schema(description = "Result of a fallback cascade")
public class FallbackResult {

    @Schema(description = "Correlation id of the request")
    String requestId;

    @Schema(description = "Always true; inspect source and metadata for degradation", example = "true")
    boolean success;

    @Schema(description = "Payload produced by the winning stage")
    Object data;

    @Schema(description = "Name of the stage that answered", example = "primary-api")
    String source;

    @Schema(description = "Total elapsed time across the cascade", example = "37")
    long totalDurationMs;

    @Schema(description = "Stages that failed or were skipped before the winner, in order")
    List<StageAttempt> failedAttempts;

    @Schema(description = "Provenance of the payload")
    StageMetadata metadata;

    @Schema(description = "True when the answer did not come from the first configured stage")
    boolean degraded;
}
