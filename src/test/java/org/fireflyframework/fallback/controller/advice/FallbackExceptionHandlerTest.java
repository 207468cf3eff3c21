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

package org.fireflyframework.fallback.controller.advice;

import org.fireflyframework.fallback.exception.InvalidFallbackRequestException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FallbackExceptionHandler}.
 */
class FallbackExceptionHandlerTest {

    private final FallbackExceptionHandler handler = new FallbackExceptionHandler();

    @Test
    void handleInvalidRequest_shouldReturnBadRequestBody() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleInvalidRequest(new InvalidFallbackRequestException("Endpoint must not be blank"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody())
                .containsEntry("status", 400)
                .containsEntry("error", "Invalid Request")
                .containsEntry("message", "Endpoint must not be blank")
                .containsKey("timestamp");
    }

    @Test
    void handleCascadeDefect_shouldReturnServerErrorBody() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleCascadeDefect(new IllegalStateException("Every fallback stage failed for /users"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody())
                .containsEntry("status", 500)
                .containsEntry("error", "Fallback Failure")
                .containsEntry("message", "Every fallback stage failed for /users");
    }
}
