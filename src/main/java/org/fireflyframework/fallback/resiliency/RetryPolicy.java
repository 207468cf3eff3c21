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

package org.fireflyframework.fallback.resiliency;

import org.fireflyframework.fallback.exception.StageExecutionException;

import java.util.concurrent.TimeoutException;

/**
 * Decides which stage failures are worth another try of the same stage.
 */
public final class RetryPolicy {

    private RetryPolicy() {
    }

    /**
     * Per-try timeouts and stage exceptions flagged retryable are retried.
     * Anything else abandons the stage immediately.
     *
     * @param error the failure of one try
     * @return true if the stage may be tried again
     */
    public static boolean isRetryable(Throwable error) {
        if (error instanceof StageExecutionException stageError) {
            return stageError.isRetryable();
        }
        return error instanceof TimeoutException;
    }
}
