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

import java.util.List;

/**
 * Raised at construction time when a stage chain or mapping table is invalid.
 */
public class FallbackConfigurationException extends RuntimeException {

    private final List<String> errors;

    public FallbackConfigurationException(String message) {
        this(List.of(message));
    }

    public FallbackConfigurationException(List<String> errors) {
        super("Invalid fallback configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
