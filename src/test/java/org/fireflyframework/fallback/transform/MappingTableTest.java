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

package org.fireflyframework.fallback.transform;

import org.fireflyframework.fallback.exception.FallbackConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MappingTable}.
 */
class MappingTableTest {

    private final MappingTable endpoints = MappingTable.of("endpoints", List.of(
            MappingRule.of("/users", "/api/v2/accounts"),
            MappingRule.of("/users/admin", "/api/v2/admins"),
            MappingRule.of("/orders", "/api/v2/purchases")));

    @Test
    void remapPath_shouldPreferExactMatch() {
        assertThat(endpoints.remapPath("/users")).isEqualTo("/api/v2/accounts");
        assertThat(endpoints.remapPath("/users/admin")).isEqualTo("/api/v2/admins");
    }

    @Test
    void remapPath_shouldUseLongestPrefixAndKeepRemainder() {
        assertThat(endpoints.remapPath("/users/42")).isEqualTo("/api/v2/accounts/42");
        assertThat(endpoints.remapPath("/users/admin/7")).isEqualTo("/api/v2/admins/7");
    }

    @Test
    void remapPath_shouldOnlyMatchWholeSegments() {
        assertThat(endpoints.remapPath("/usersettings")).isEqualTo("/usersettings");
        assertThat(endpoints.remapPath("/products/1")).isEqualTo("/products/1");
    }

    @Test
    void lookup_shouldReturnMappedValue() {
        assertThat(endpoints.lookup("/orders")).contains("/api/v2/purchases");
        assertThat(endpoints.lookup("/unknown")).isEmpty();
    }

    @Test
    void asMap_shouldPreserveDeclarationOrder() {
        assertThat(endpoints.asMap().keySet()).containsExactly("/users", "/users/admin", "/orders");
    }

    @Test
    void of_shouldReturnEmptyTable_whenNoRules() {
        assertThat(MappingTable.of("fields", null).isEmpty()).isTrue();
        assertThat(MappingTable.of("fields", List.of())).isSameAs(MappingTable.empty());
    }

    @Test
    void of_shouldRejectDuplicateSources() {
        assertThatThrownBy(() -> MappingTable.of("fields", List.of(
                MappingRule.of("name", "userName"),
                MappingRule.of("name", "fullName"))))
                .isInstanceOf(FallbackConfigurationException.class)
                .hasMessageContaining("'name' more than once");
    }

    @Test
    void of_shouldRejectBlankOrMissingRules() {
        assertThatThrownBy(() -> MappingTable.of("fields", List.of(MappingRule.of(" ", "userName"))))
                .isInstanceOf(FallbackConfigurationException.class);
        assertThatThrownBy(() -> MappingTable.of("fields", Arrays.asList(MappingRule.of("a", "b"), null)))
                .isInstanceOf(FallbackConfigurationException.class);
    }
}
