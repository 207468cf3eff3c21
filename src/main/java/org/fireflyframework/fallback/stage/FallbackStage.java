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

import org.fireflyframework.fallback.model.FallbackRequest;
import org.fireflyframework.fallback.model.StageDescriptor;
import org.fireflyframework.fallback.model.StageResult;
import reactor.core.publisher.Mono;

/**
 * One data source in the fallback cascade.
 *
 * <p>A stage answers with a successful {@link StageResult} or fails with a
 * {@link org.fireflyframework.fallback.exception.StageExecutionException}. Timeouts,
 * retries and circuit breaking are applied by the orchestrator from the stage's
 * {@link #descriptor()}, never by the stage itself.</p>
 */
public interface FallbackStage {

    /**
     * Returns the static description of this stage.
     *
     * @return the descriptor
     */
    StageDescriptor descriptor();

    default String getName() {
        return descriptor().getName();
    }

    /**
     * Performs a single try against the data source.
     *
     * @param request the normalized request
     * @return the stage result
     */
    Mono<StageResult> execute(FallbackRequest request);

    /**
     * Checks whether the data source is reachable. Never errors.
     *
     * @return true if healthy
     */
    Mono<Boolean> healthCheck();
}
