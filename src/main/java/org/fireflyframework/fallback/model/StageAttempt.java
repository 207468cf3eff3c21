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

/**
 * Diagnostic record of a stage that did not answer a request.
 */
@Value
@Builder
@Schema(description = "A stage that failed or was skipped during the cascade")
public class StageAttempt {

    @Schema(description = "Stage name", example = "primary-api")
    String stageName;

    @Schema(description = "True when the stage was not called at all (open circuit or exhausted deadline)")
    boolean skipped;

    @Schema(description = "Why the stage did not answer", example = "Upstream responded with status 503")
    String reason;

    @Schema(description = "Time spent on the stage, retries included", example = "412")
    long durationMs;

    @Schema(description = "Number of tries made, 0 when skipped", example = "3")
    int tries;
}
