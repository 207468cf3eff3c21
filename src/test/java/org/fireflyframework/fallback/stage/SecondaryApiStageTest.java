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

package org.fireflyframework.fallback.stage;

import org.fireflyframework.fallback.exception.ResponseTransformationException;
import org.fireflyframework.fallback.model.FallbackRequest;
import org.fireflyframework.fallback.model.RequestKind;
import org.fireflyframework.fallback.transform.MappingRule;
import org.fireflyframework.fallback.transform.MappingTable;
import org.fireflyframework.fallback.transport.ApiCall;
import org.fireflyframework.fallback.transport.ApiResponse;
import org.fireflyframework.fallback.transport.ApiTransport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link SecondaryApiStage}.
 */
@ExtendWith(MockitoExtension.class)
class SecondaryApiStageTest {

    @Mock
    private ApiTransport transport;

    private SecondaryApiStage.SecondaryApiStageBuilder stage() {
        return SecondaryApiStage.builder()
                .transport(transport)
                .healthPath("/status")
                .endpointMappings(MappingTable.of("endpoints",
                        List.of(MappingRule.of("/users", "/api/v2/accounts"))))
                .fieldMappings(MappingTable.of("fields", List.of(MappingRule.of("name", "userName"))));
    }

    @Test
    void execute_shouldRemapEndpointAndRequestFields() {
        // Given
        ArgumentCaptor<ApiCall> captor = ArgumentCaptor.forClass(ApiCall.class);
        when(transport.send(captor.capture())).thenReturn(Mono.just(ApiResponse.builder()
                .statusCode(200)
                .body(Map.of("ok", true))
                .build()));
        FallbackRequest request = FallbackRequest.builder()
                .kind(RequestKind.STRUCTURED)
                .endpoint("/users/7")
                .method("PUT")
                .data(Map.of("name", "Ada", "age", 36))
                .build();

        // When
        StepVerifier.create(stage().build().execute(request))
                .assertNext(result -> {
                    assertThat(result.getStageName()).isEqualTo("secondary-api");
                    assertThat(result.getMetadata().isTransformed()).isFalse();
                })
                .verifyComplete();

        // Then
        ApiCall call = captor.getValue();
        assertThat(call.getPath()).isEqualTo("/api/v2/accounts/7");
        assertThat(call.getBody()).isEqualTo(Map.of("userName", "Ada", "age", 36));
    }

    @Test
    void execute_shouldLeaveUnmappedEndpointUntouched() {
        ArgumentCaptor<ApiCall> captor = ArgumentCaptor.forClass(ApiCall.class);
        when(transport.send(captor.capture())).thenReturn(Mono.just(ApiResponse.builder().statusCode(200).build()));

        StepVerifier.create(stage().build().execute(FallbackRequest.ofPath("/products/1")))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(captor.getValue().getPath()).isEqualTo("/products/1");
    }

    @Test
    void execute_shouldMapResponseFields_andFlagTransformed() {
        // Given
        when(transport.send(any(ApiCall.class))).thenReturn(Mono.just(ApiResponse.builder()
                .statusCode(200)
                .body(List.of(Map.of("userName", "Ada"), Map.of("userName", "Alan")))
                .build()));
        SecondaryApiStage secondary = stage()
                .responseFieldMappings(MappingTable.of("response", List.of(MappingRule.of("userName", "name"))))
                .build();

        // When & Then
        StepVerifier.create(secondary.execute(FallbackRequest.ofPath("/users")))
                .assertNext(result -> {
                    assertThat(result.getData()).isEqualTo(List.of(Map.of("name", "Ada"), Map.of("name", "Alan")));
                    assertThat(result.getMetadata().isTransformed()).isTrue();
                    assertThat(result.getMetadata().getStatusCode()).isEqualTo(200);
                })
                .verifyComplete();
    }

    @Test
    void execute_shouldFailAsTransformation_whenResponseTransformerThrows() {
        when(transport.send(any(ApiCall.class))).thenReturn(Mono.just(ApiResponse.builder()
                .statusCode(200)
                .body(Map.of("id", 1))
                .build()));
        SecondaryApiStage secondary = stage()
                .responseTransformer((body, context) -> Mono.error(new IllegalArgumentException("unexpected shape")))
                .build();

        StepVerifier.create(secondary.execute(FallbackRequest.ofPath("/users")))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ResponseTransformationException.class);
                    assertThat(error.getMessage()).contains("unexpected shape");
                })
                .verify();
    }

    @Test
    void healthCheck_shouldAccept200And204() {
        when(transport.probe(eq("/status"), any(Duration.class)))
                .thenReturn(Mono.just(204), Mono.just(200), Mono.just(500));
        SecondaryApiStage secondary = stage().build();

        StepVerifier.create(secondary.healthCheck()).expectNext(true).verifyComplete();
        StepVerifier.create(secondary.healthCheck()).expectNext(true).verifyComplete();
        StepVerifier.create(secondary.healthCheck()).expectNext(false).verifyComplete();
    }

    @Test
    void builder_shouldFallBackToDefaultDescriptor() {
        SecondaryApiStage secondary = SecondaryApiStage.builder().transport(transport).healthPath("/health").build();

        assertThat(secondary.getName()).isEqualTo(SecondaryApiStage.DEFAULT_NAME);
        assertThat(secondary.descriptor().getPriority()).isEqualTo(2);
        assertThat(secondary.descriptor().getTrustScore()).isEqualTo(0.9);
    }
}
