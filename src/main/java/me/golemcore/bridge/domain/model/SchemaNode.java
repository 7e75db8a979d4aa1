package me.golemcore.bridge.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive JSON-Schema-like description of a tool parameter.
 *
 * <p>
 * {@code type} keeps the raw keyword reported by the tool host, so unknown
 * kinds survive until translation where they fall back to string.
 * {@code properties} is meaningful only for objects and {@code items} only for
 * arrays. Property order is preserved.
 */
@Value
@Builder(toBuilder = true)
public class SchemaNode {

    String type;
    String description;

    @Builder.Default
    Map<String, SchemaNode> properties = Map.of();

    SchemaNode items;

    @Builder.Default
    List<String> required = List.of();

    @Builder.Default
    List<String> enumValues = List.of();

    /**
     * Resolved kind, or {@code null} when the type keyword is missing or not one
     * of the supported kinds.
     */
    public SchemaType resolvedType() {
        return SchemaType.fromJsonName(type);
    }

    public boolean hasItems() {
        return items != null;
    }

    public boolean hasEnumValues() {
        return enumValues != null && !enumValues.isEmpty();
    }

    public static SchemaNode of(SchemaType type, String description) {
        return SchemaNode.builder()
                .type(type.getJsonName())
                .description(description)
                .build();
    }

    public static SchemaNode arrayOf(SchemaNode items, String description) {
        return SchemaNode.builder()
                .type(SchemaType.ARRAY.getJsonName())
                .description(description)
                .items(items)
                .build();
    }

    public static SchemaNode object(Map<String, SchemaNode> properties, List<String> required) {
        return SchemaNode.builder()
                .type(SchemaType.OBJECT.getJsonName())
                .properties(properties != null ? new LinkedHashMap<>(properties) : Map.of())
                .required(required != null ? List.copyOf(required) : List.of())
                .build();
    }

    /**
     * Parameter schema for a tool without inputs.
     */
    public static SchemaNode emptyObject() {
        return object(Map.of(), List.of());
    }
}
