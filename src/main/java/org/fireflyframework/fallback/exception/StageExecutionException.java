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
 * Base class for every failure a fallback stage can signal.
 *
 * <p>Stage failures never reach the caller of the orchestrator. They are converted
 * into failed attempts and the cascade advances to the next stage. The
 * {@link #isRetryable()} flag decides whether the stage's retry budget is spent
 * on the failure or the stage is abandoned immediately.</p>
 *
 * @see TransportException
 * @see UpstreamStatusException
 * @see ResponseTransformationException
 * @see CacheMissException
 */
public class StageExecutionException extends RuntimeException {

    private final String stageName;
    private final boolean retryable;

    public StageExecutionException(String stageName, String message, boolean retryable) {
        super(message);
        this.stageName = stageName;
        this.retryable = retryable;
    }

    public StageExecutionException(String stageName, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.stageName = stageName;
        this.retryable = retryable;
    }

    /**
     * Returns the name of the stage that failed.
     *
     * @return the stage name
     */
    public String getStageName() {
        return stageName;
    }

    /**
     * Returns whether the failure may succeed when the same stage is tried again.
     *
     * @return true if the failure is retryable
     */
    public boolean isRetryable() {
        return retryable;
    }
}
