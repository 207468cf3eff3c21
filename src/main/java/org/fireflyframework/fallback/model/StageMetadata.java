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
 * Provenance of a stage result. Callers inspect it to tell fresh data from
 * cached or synthesized data.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Provenance of the data returned by a fallback stage")
public class StageMetadata {

    @Schema(description = "Name of the stage that produced the data", example = "primary-api")
    String source;

    @Schema(description = "Upstream HTTP status, when the stage called an API", example = "200")
    Integer statusCode;

    @Schema(description = "Whether the data was served from a cache")
    boolean cached;

    @Schema(description = "Whether the data was reshaped by a response transform")
    boolean transformed;

    @Schema(description = "Details of a degraded or failed generation, if any")
    String errorDetails;
}
