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
import reactor.core.publisher.Mono;

/**
 * Stage that can be populated with data answered by a more trusted stage.
 */
public interface CacheWriter {

    /**
     * Stores data under the key derived from the request.
     *
     * @param request the request the data answers
     * @param data    the data to store, never null
     * @return completion signal
     */
    Mono<Void> write(FallbackRequest request, Object data);
}
