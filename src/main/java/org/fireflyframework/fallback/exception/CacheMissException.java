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

/**
 * A cache stage holds no entry for the request.
 *
 * <p>A miss is an ordinary stage failure, so the cascade proceeds. It is not
 * retried and it is ignored by the stage's circuit breaker.</p>
 */
public class CacheMissException extends StageExecutionException {

    private final String cacheKey;

    public CacheMissException(String stageName, String cacheKey) {
        super(stageName, "No cached entry for key " + cacheKey, false);
        this.cacheKey = cacheKey;
    }

    public String getCacheKey() {
        return cacheKey;
    }
}
