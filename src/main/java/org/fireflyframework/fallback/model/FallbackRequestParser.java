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

import org.fireflyframework.fallback.exception.InvalidFallbackRequestException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves the polymorphic request input into a {@link FallbackRequest}.
 *
 * <p>Accepted shapes:</p>
 * <ul>
 *   <li>a {@link CharSequence} - treated as an endpoint path</li>
 *   <li>a {@link Map} with a mandatory {@code endpoint} and optional
 *       {@code method}, {@code data} and {@code params} entries</li>
 *   <li>an already normalized {@link FallbackRequest}</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * FallbackRequest byPath = FallbackRequestParser.parse("/users/42");
 * FallbackRequest structured = FallbackRequestParser.parse(Map.of(
 *     "endpoint", "/users",
 *     "method", "POST",
 *     "data", Map.of("name", "John")));
 * }</pre>
 */
public final class FallbackRequestParser {

    private FallbackRequestParser() {}

    /**
     * Normalizes a raw request.
     *
     * @param raw the raw request
     * @return the normalized request
     * @throws InvalidFallbackRequestException if the shape is not supported
     */
    public static FallbackRequest parse(Object raw) {
        if (raw == null) {
            throw new InvalidFallbackRequestException("Request must not be null");
        }
        if (raw instanceof FallbackRequest request) {
            return request;
        }
        if (raw instanceof CharSequence path) {
            return FallbackRequest.ofPath(requireEndpoint(path.toString()));
        }
        if (raw instanceof Map<?, ?> map) {
            return parseStructured(map);
        }
        throw new InvalidFallbackRequestException(
                "Unsupported request type: " + raw.getClass().getName());
    }

    private static FallbackRequest parseStructured(Map<?, ?> map) {
        Object endpoint = map.get("endpoint");
        if (!(endpoint instanceof CharSequence)) {
            throw new InvalidFallbackRequestException("Structured request requires a string 'endpoint'");
        }

        Object method = map.get("method");
        String resolvedMethod = method == null
                ? FallbackRequest.DEFAULT_METHOD
                : method.toString().trim().toUpperCase(Locale.ROOT);
        if (resolvedMethod.isEmpty()) {
            resolvedMethod = FallbackRequest.DEFAULT_METHOD;
        }

        return FallbackRequest.builder()
                .kind(RequestKind.STRUCTURED)
                .endpoint(requireEndpoint(endpoint.toString()))
                .method(resolvedMethod)
                .data(map.get("data"))
                .params(parseParams(map.get("params")))
                .build();
    }

    private static Map<String, Object> parseParams(Object params) {
        if (params == null) {
            return Map.of();
        }
        if (!(params instanceof Map<?, ?> raw)) {
            throw new InvalidFallbackRequestException("'params' must be an object");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        raw.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    private static String requireEndpoint(String endpoint) {
        String trimmed = endpoint.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidFallbackRequestException("Endpoint must not be blank");
        }
        return trimmed;
    }
}
