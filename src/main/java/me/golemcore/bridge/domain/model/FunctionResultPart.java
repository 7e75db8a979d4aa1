package me.golemcore.bridge.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The outcome of one tool call, replayed to the model as {@code {name,
 * response}}. The response holds either a {@code result} or an {@code error}
 * entry.
 *
 * @param id
 *            id of the matching {@link FunctionCallPart}, may be {@code null}
 * @param name
 *            tool name
 * @param response
 *            structured response mapping
 */
public record FunctionResultPart(String id, String name, Map<String, Object> response) implements Part {

    public static final String KEY_RESULT = "result";
    public static final String KEY_ERROR = "error";

    public FunctionResultPart {
        response = response != null ? Collections.unmodifiableMap(new LinkedHashMap<>(response)) : Map.of();
    }

    public boolean isError() {
        return response.containsKey(KEY_ERROR);
    }
}
