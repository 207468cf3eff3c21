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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Path pattern paired with the shape of a placeholder entity.
 *
 * <p>The pattern's first capturing group, when present and matched, is the entity
 * identifier. Templates never set {@code status}; that field is left to the smart
 * defaults.</p>
 */
public final class DefaultEntityTemplate {

    private static final String PATH_PREFIX = "^/?(?:api/(?:v\\d+/)?)?";
    private static final String ID_SUFFIX = "(?:/([^/?]+))?/?(?:\\?.*)?$";

    private final String entity;
    private final Pattern pattern;
    private final Function<String, Map<String, Object>> factory;

    public DefaultEntityTemplate(String entity, Pattern pattern, Function<String, Map<String, Object>> factory) {
        this.entity = entity;
        this.pattern = pattern;
        this.factory = factory;
    }

    /**
     * Creates a template matching {@code /segment}, {@code /segment/{id}} and their
     * {@code /api} and {@code /api/vN} prefixed forms.
     *
     * @param entity      the entity name, for logging
     * @param segmentRegex regex for the collection segment, e.g. {@code users?}
     * @param factory     builds the entity from the extracted id (possibly null)
     * @return the template
     */
    public static DefaultEntityTemplate forSegment(String entity, String segmentRegex,
                                                   Function<String, Map<String, Object>> factory) {
        return new DefaultEntityTemplate(entity,
                Pattern.compile(PATH_PREFIX + segmentRegex + ID_SUFFIX, Pattern.CASE_INSENSITIVE),
                factory);
    }

    /**
     * Built-in templates for users, products, orders, customers and inventory.
     *
     * @return the default template table
     */
    public static List<DefaultEntityTemplate> defaults() {
        return List.of(
                forSegment("user", "users?", id -> entity(id,
                        "name", "Unknown User",
                        "email", "",
                        "role", "guest",
                        "active", false)),
                forSegment("product", "products?", id -> entity(id,
                        "name", "Unavailable Product",
                        "price", 0,
                        "currency", "USD",
                        "available", false)),
                forSegment("order", "orders?", id -> entity(id,
                        "items", new ArrayList<>(),
                        "total", 0,
                        "currency", "USD")),
                forSegment("customer", "customers?", id -> entity(id,
                        "name", "Unknown Customer",
                        "email", "",
                        "tier", "standard")),
                forSegment("inventory", "inventor(?:y|ies)", id -> entity(id,
                        "sku", "",
                        "quantity", 0,
                        "available", false)));
    }

    public Optional<Map<String, Object>> match(String endpoint) {
        if (endpoint == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(endpoint);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String id = matcher.groupCount() >= 1 ? matcher.group(1) : null;
        return Optional.of(factory.apply(id));
    }

    public String getEntity() {
        return entity;
    }

    private static Map<String, Object> entity(String id, Object... fields) {
        Map<String, Object> entity = new LinkedHashMap<>();
        entity.put("id", id);
        for (int i = 0; i + 1 < fields.length; i += 2) {
            entity.put((String) fields[i], fields[i + 1]);
        }
        return entity;
    }
}
