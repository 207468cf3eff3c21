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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.fallback.exception.InvalidFallbackRequestException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for fallback controllers.
 *
 * <p>Stage failures never surface here; only malformed requests and defects do.</p>
 */
@Slf4j
@RestControllerAdvice(basePackages = "org.fireflyframework.fallback.controller")
public class FallbackExceptionHandler {

    @ExceptionHandler(InvalidFallbackRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(InvalidFallbackRequestException ex) {
        log.warn("Rejected fallback request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleCascadeDefect(IllegalStateException ex) {
        log.error("Fallback cascade produced no result", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Fallback Failure", ex.getMessage()));
    }

    private static Map<String, Object> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
