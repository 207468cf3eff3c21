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

package org.fireflyframework.fallback.transport;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * HTTP client seen by the API stages.
 *
 * <p>Implementations must signal failures with the stage exception taxonomy:
 * {@link org.fireflyframework.fallback.exception.TransportException} for network
 * errors, {@link org.fireflyframework.fallback.exception.UpstreamStatusException}
 * for non-2xx statuses and
 * {@link org.fireflyframework.fallback.exception.ResponseTransformationException}
 * for undecodable bodies.</p>
 */
public interface ApiTransport {

    /**
     * Sends a call and decodes the JSON response.
     *
     * @param call the outbound call
     * @return the decoded response, or an error from the stage taxonomy
     */
    Mono<ApiResponse> send(ApiCall call);

    /**
     * Issues a lightweight {@code GET} and reports the raw status code, whatever it is.
     *
     * @param path    the health path
     * @param timeout maximum time to wait
     * @return the status code
     */
    Mono<Integer> probe(String path, Duration timeout);
}
