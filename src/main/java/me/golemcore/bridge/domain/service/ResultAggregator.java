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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bridge.domain.model.FunctionCallPart;
import me.golemcore.bridge.domain.model.FunctionResultPart;
import me.golemcore.bridge.domain.model.ModelTurn;
import me.golemcore.bridge.domain.model.TextPart;
import me.golemcore.bridge.domain.model.ToolResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shapes model turns and tool outcomes on their way through the loop.
 */
@Slf4j
@RequiredArgsConstructor
public class ResultAggregator {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public boolean hasFunctionCalls(ModelTurn turn) {
        return turn != null && turn.hasFunctionCalls();
    }

    public List<FunctionCallPart> functionCalls(ModelTurn turn) {
        return turn != null ? turn.functionCalls() : List.of();
    }

    /**
     * Concatenates the text parts of a turn in order. Returns an empty string
     * when the turn carries no text.
     */
    public String mergeText(ModelTurn turn) {
        if (turn == null) {
            return "";
        }
        return turn.textParts().stream()
                .map(TextPart::text)
                .filter(text -> text != null)
                .collect(Collectors.joining());
    }

    /**
     * Wraps a tool outcome as the function result answering {@code call}:
     * {@code {result: text}} on success, {@code {error: message}} otherwise.
     */
    public FunctionResultPart toFunctionResult(FunctionCallPart call, ToolResult result) {
        Map<String, Object> response = new LinkedHashMap<>();
        if (result != null && result.isSuccess()) {
            response.put(FunctionResultPart.KEY_RESULT, result.getOutput());
        } else {
            String error = result != null ? result.getError() : null;
            response.put(FunctionResultPart.KEY_ERROR, error != null ? error : "Unknown error");
        }
        return new FunctionResultPart(call.id(), call.name(), response);
    }

    /**
     * Structured arguments of a function call. A native mapping wins over the
     * JSON form; blank or malformed JSON yields an empty mapping.
     */
    public Map<String, Object> parseArguments(FunctionCallPart call) {
        if (call.arguments() != null) {
            return call.arguments();
        }
        String json = call.argumentsJson();
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, MAP_TYPE);
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            log.warn("[ToolLoop] Malformed arguments for '{}', using empty arguments: {}", call.name(),
                    e.getOriginalMessage());
            return Map.of();
        }
    }
}
