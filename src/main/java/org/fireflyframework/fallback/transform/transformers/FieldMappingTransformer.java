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
import org.fireflyframework.fallback.transform.MappingTable;
import org.fireflyframework.fallback.transform.TransformContext;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renames top-level fields according to a {@link MappingTable}.
 *
 * <p>All renames are applied at once against the source map, so every field is
 * renamed at most once and chained or swapped tables ({@code a -> b, b -> c})
 * keep both values. Fields without a rule are copied unchanged unless a renamed
 * field takes their name, in which case the renamed value wins.</p>
 */
public class FieldMappingTransformer implements DataTransformer<Map<String, Object>, Map<String, Object>> {

    private final MappingTable fieldMappings;

    /**
     * Creates a transformer with the given field mappings.
     *
     * @param fieldMappings source field names to target field names
     */
    public FieldMappingTransformer(MappingTable fieldMappings) {
        this.fieldMappings = fieldMappings;
    }

    @Override
    public Mono<Map<String, Object>> transform(Map<String, Object> source, TransformContext context) {
        return Mono.fromCallable(() -> {
            Map<String, String> renames = fieldMappings.asMap();
            Set<String> renamedTargets = source.keySet().stream()
                    .filter(renames::containsKey)
                    .map(renames::get)
                    .collect(Collectors.toSet());

            Map<String, Object> result = new LinkedHashMap<>();
            source.forEach((field, value) -> {
                String target = renames.get(field);
                if (target != null) {
                    result.put(target, value);
                } else if (!renamedTargets.contains(field)) {
                    result.put(field, value);
                }
            });
            return result;
        });
    }
}
