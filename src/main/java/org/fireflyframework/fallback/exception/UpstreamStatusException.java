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

package org.fireflyframework.fallback.exception;

import java.util.Set;

/**
 * An upstream API answered with a non-success HTTP status.
 *
 * <p>Rate-limit, timeout, server and gateway statuses are retryable. Client,
 * validation and not-found statuses fail the stage immediately.</p>
 */
public class UpstreamStatusException extends StageExecutionException {

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(408, 429, 500, 502, 503, 504);

    private final int statusCode;
    private final String responseBody;

    public UpstreamStatusException(String stageName, int statusCode, String responseBody) {
        super(stageName,
                "Upstream responded with status " + statusCode,
                isRetryableStatus(statusCode));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * Classifies an HTTP status code.
     *
     * @param statusCode the status code
     * @return true if a later attempt may succeed
     */
    public static boolean isRetryableStatus(int statusCode) {
        return RETRYABLE_STATUSES.contains(statusCode);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
