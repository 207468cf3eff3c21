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

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A logical request, normalized once before any stage sees it.
 *
 * <p>Instances are produced by {@link FallbackRequestParser} from either a bare
 * endpoint path or a structured {@code {endpoint, method, data, params}} map.
 * Every stage reads the same normalized form.</p>
 */
@Value
@Builder(toBuilder = true)
public class FallbackRequest {

    public static final String DEFAULT_METHOD = "GET";

    RequestKind kind;
    String endpoint;

    @Builder.Default
    String method = DEFAULT_METHOD;

    /**
     * Request body, or a sample object used to infer default field values.
     */
    Object data;

    @Builder.Default
    Map<String, Object> params = Map.of();

    /**
     * Creates a path-only request.
     *
     * @param endpoint the endpoint path
     * @return a {@link RequestKind#PATH} request using {@code GET}
     */
    public static FallbackRequest ofPath(String endpoint) {
        return FallbackRequest.builder()
                .kind(RequestKind.PATH)
                .endpoint(endpoint)
                .build();
    }
}
