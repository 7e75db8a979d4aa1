package me.golemcore.bridge.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request from the model to invoke a tool.
 *
 * <p>
 * Backends deliver arguments either as a structured mapping or as a raw JSON
 * string; exactly one of {@code arguments} and {@code argumentsJson} is
 * normally set. {@code id} is passed through when the backend supplies one so
 * that providers which correlate by id can do so.
 *
 * @param id
 *            backend-assigned call id, may be {@code null}
 * @param name
 *            tool name
 * @param arguments
 *            structured arguments, or {@code null} when only JSON was given
 * @param argumentsJson
 *            raw JSON arguments, or {@code null}
 */
public record FunctionCallPart(String id, String name, Map<String, Object> arguments, String argumentsJson)
        implements Part {

    public FunctionCallPart {
        arguments = arguments != null ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments)) : null;
    }

    public static FunctionCallPart of(String id, String name, Map<String, Object> arguments) {
        return new FunctionCallPart(id, name, arguments, null);
    }

    public static FunctionCallPart ofJson(String id, String name, String argumentsJson) {
        return new FunctionCallPart(id, name, null, argumentsJson);
    }
}
