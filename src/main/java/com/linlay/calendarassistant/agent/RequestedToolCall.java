package com.linlay.calendarassistant.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool call requested by the model.
 *
 * @param rawArguments the payload exactly as received, replayed to the model in history
 * @param arguments    the decoded payload, empty when {@code rawArguments} did not parse
 */
public record RequestedToolCall(
        String id,
        String name,
        String rawArguments,
        Map<String, Object> arguments
) {
    public RequestedToolCall {
        name = name == null ? "" : name.trim();
        rawArguments = rawArguments == null ? "" : rawArguments;
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public String argument(String key) {
        Object value = arguments.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    public boolean hasArgument(String key) {
        return argument(key) != null;
    }
}
