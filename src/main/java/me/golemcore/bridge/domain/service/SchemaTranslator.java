package me.golemcore.bridge.domain.service;

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

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bridge.domain.exception.SchemaTranslationException;
import me.golemcore.bridge.domain.model.SchemaNode;
import me.golemcore.bridge.domain.model.SchemaType;
import me.golemcore.bridge.domain.model.ToolSpec;
import me.golemcore.bridge.domain.model.TranslatedToolSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts tool parameter schemas into langchain4j function declarations.
 *
 * <p>
 * Mapping:
 * <ul>
 * <li>{@code string}, {@code integer}, {@code number}, {@code boolean} to the
 * matching primitive schema
 * <li>{@code array} to {@link JsonArraySchema}, items translated recursively; no
 * items means an untyped array
 * <li>{@code object} to {@link JsonObjectSchema}, properties translated
 * recursively, {@code required} passed through as-is
 * <li>non-empty {@code enum} to {@link JsonEnumSchema}
 * <li>anything else, or a missing type, to string
 * </ul>
 *
 * <p>
 * Failures are local: a property that cannot be translated is dropped with a
 * diagnostic, and a tool that cannot be assembled is left out of the set. No
 * failure aborts translation of the remaining tools.
 *
 * <p>
 * Stateless and thread-safe.
 */
@Slf4j
public class SchemaTranslator {

    /**
     * Translates a single schema node. Diagnostics for dropped nested
     * properties are logged only.
     */
    public JsonSchemaElement translate(SchemaNode schema) {
        return translate(schema, "$", new ArrayList<>());
    }

    /**
     * Translates every tool, dropping the ones that cannot be assembled.
     */
    public TranslatedToolSet translateAll(List<ToolSpec> tools) {
        if (tools == null || tools.isEmpty()) {
            return TranslatedToolSet.empty();
        }

        List<ToolSpecification> specifications = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();
        for (ToolSpec tool : tools) {
            try {
                specifications.add(translateTool(tool, diagnostics));
            } catch (RuntimeException e) {
                String toolName = tool != null ? tool.getName() : null;
                String diagnostic = "tool '" + toolName + "' dropped: " + e.getMessage();
                log.warn("[Schema] {}", diagnostic);
                diagnostics.add(diagnostic);
            }
        }
        return new TranslatedToolSet(specifications, diagnostics);
    }

    /**
     * Translates one tool into a function declaration whose parameters are
     * always an object schema.
     *
     * @throws SchemaTranslationException
     *             if the tool has no usable name
     */
    public ToolSpecification translateTool(ToolSpec tool, List<String> diagnostics) {
        if (tool == null) {
            throw new SchemaTranslationException("tool spec is null");
        }
        if (tool.getName() == null || tool.getName().isBlank()) {
            throw new SchemaTranslationException("tool name is missing");
        }

        SchemaNode parameters = tool.getParameterSchema() != null
                ? tool.getParameterSchema()
                : SchemaNode.emptyObject();

        JsonObjectSchema.Builder parametersBuilder = JsonObjectSchema.builder();
        addProperties(parametersBuilder, parameters.getProperties(), tool.getName(), diagnostics);
        if (parameters.getRequired() != null && !parameters.getRequired().isEmpty()) {
            parametersBuilder.required(parameters.getRequired());
        }

        return ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription() != null ? tool.getDescription() : "")
                .parameters(parametersBuilder.build())
                .build();
    }

    private JsonSchemaElement translate(SchemaNode schema, String path, List<String> diagnostics) {
        if (schema == null) {
            throw new SchemaTranslationException("schema at " + path + " is null");
        }

        String description = schema.getDescription();
        SchemaType type = schema.resolvedType();

        // Enumerations are advertised for strings only; other kinds keep their primitive schema
        if (schema.hasEnumValues() && (type == null || type == SchemaType.STRING)) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(schema.getEnumValues());
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }

        if (type == null) {
            if (schema.getType() != null) {
                log.debug("[Schema] Unknown type '{}' at {}, falling back to string", schema.getType(), path);
            }
            type = SchemaType.STRING;
        }

        switch (type) {
        case INTEGER -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case NUMBER -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case BOOLEAN -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case ARRAY -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            if (schema.hasItems()) {
                try {
                    builder.items(translate(schema.getItems(), path + "[]", diagnostics));
                } catch (RuntimeException e) {
                    report(diagnostics, "items of " + path + " dropped, treating as untyped array: "
                            + e.getMessage());
                }
            }
            return builder.build();
        }
        case OBJECT -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            addProperties(builder, schema.getProperties(), path, diagnostics);
            if (schema.getRequired() != null && !schema.getRequired().isEmpty()) {
                builder.required(schema.getRequired());
            }
            return builder.build();
        }
        default -> {
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private void addProperties(JsonObjectSchema.Builder builder, Map<String, SchemaNode> properties, String path,
            List<String> diagnostics) {
        if (properties == null || properties.isEmpty()) {
            return;
        }
        for (Map.Entry<String, SchemaNode> entry : properties.entrySet()) {
            String propertyName = entry.getKey();
            String propertyPath = path + "." + propertyName;
            try {
                if (propertyName == null || propertyName.isBlank()) {
                    throw new SchemaTranslationException("property name is blank");
                }
                builder.addProperty(propertyName, translate(entry.getValue(), propertyPath, diagnostics));
            } catch (RuntimeException e) {
                report(diagnostics, "property " + propertyPath + " dropped: " + e.getMessage());
            }
        }
    }

    private void report(List<String> diagnostics, String diagnostic) {
        log.warn("[Schema] {}", diagnostic);
        diagnostics.add(diagnostic);
    }
}
