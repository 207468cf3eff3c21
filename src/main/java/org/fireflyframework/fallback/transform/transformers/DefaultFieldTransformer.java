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

package org.fireflyframework.fallback.transform.transformers;

import org.fireflyframework.fallback.transform.DataTransformer;
import org.fireflyframework.fallback.transform.TransformContext;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Back-fills a field with a computed value when the field is absent or null.
 * Present values are never overwritten.
 */
public class DefaultFieldTransformer implements DataTransformer<Map<String, Object>, Map<String, Object>> {

    private final String fieldName;
    private final Function<TransformContext, Object> computation;

    /**
     * Creates a transformer that back-fills one field.
     *
     * @param fieldName   the field to fill
     * @param computation computes the default value from the context
     */
    public DefaultFieldTransformer(String fieldName, Function<TransformContext, Object> computation) {
        this.fieldName = fieldName;
        this.computation = computation;
    }

    @Override
    public Mono<Map<String, Object>> transform(Map<String, Object> source, TransformContext context) {
        return Mono.fromCallable(() -> {
            Map<String, Object> result = new LinkedHashMap<>(source);
            if (result.get(fieldName) == null) {
                result.put(fieldName, computation.apply(context));
            }
            return result;
        });
    }
}
