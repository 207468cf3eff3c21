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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.fireflyframework.fallback.model.FallbackRequest;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Derives cache keys of the form {@code METHOD:endpoint?a=1&b=2#digest}, with
 * parameters sorted by name so that equivalent requests share an entry.
 *
 * <p>The {@code #digest} suffix is present only when the request carries a body.
 * It is the MD5 of the body's JSON form with map entries ordered by key, so two
 * requests to the same endpoint with different bodies never share an entry.</p>
 */
public final class CacheKeyGenerator {

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CacheKeyGenerator() {
    }

    public static String generate(FallbackRequest request) {
        StringBuilder key = new StringBuilder()
                .append(request.getMethod())
                .append(':')
                .append(request.getEndpoint());

        Map<String, Object> params = request.getParams();
        if (params != null && !params.isEmpty()) {
            key.append('?').append(new TreeMap<>(params).entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue())
                    .collect(Collectors.joining("&")));
        }

        if (request.getData() != null) {
            key.append('#').append(digest(request.getData()));
        }
        return key.toString();
    }

    private static String digest(Object data) {
        try {
            byte[] json = CANONICAL_MAPPER.writeValueAsString(data).getBytes(StandardCharsets.UTF_8);
            return DigestUtils.md5DigestAsHex(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body cannot be serialized for a cache key", e);
        }
    }
}
