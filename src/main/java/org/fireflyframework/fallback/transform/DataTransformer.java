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

import reactor.core.publisher.Mono;

/**
 * Reshapes a payload on its way to or from a stage.
 *
 * <p>Used for outbound request bodies, inbound API responses and the
 * smart-defaults layer of the static default stage.</p>
 *
 * @param <S> the source type
 * @param <T> the target type
 */
@FunctionalInterface
public interface DataTransformer<S, T> {

    /**
     * Transforms the given source value within the provided context.
     *
     * @param source  the input value
     * @param context the transformation context
     * @return a {@link Mono} emitting the transformed result
     */
    Mono<T> transform(S source, TransformContext context);
}
