package com.linlay.calendarassistant.tool;

import com.linlay.calendarassistant.agent.IsoTimestamps;
import com.linlay.calendarassistant.agent.RequestedToolCall;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Typed reads over a tool call's decoded arguments.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static String requireText(RequestedToolCall call, String key) {
        String value = call.argument(key);
        if (value == null) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value;
    }

    static Instant requireInstant(RequestedToolCall call, String key) {
        String value = requireText(call, key);
        return IsoTimestamps.parse(value)
                .orElseThrow(() -> new IllegalArgumentException(key + " is not an ISO-8601 timestamp: " + value));
    }

    /**
     * The calendar day an all-day argument names, read from the text rather than the instant.
     */
    static LocalDate requireDate(RequestedToolCall call, String key, ZoneId zone) {
        String value = requireText(call, key);
        return IsoTimestamps.calendarDate(value, zone)
                .orElseThrow(() -> new IllegalArgumentException(key + " is not an ISO-8601 date: " + value));
    }

    static Instant optionalInstant(RequestedToolCall call, String key) {
        return call.hasArgument(key) ? requireInstant(call, key) : null;
    }

    static boolean flag(RequestedToolCall call, String key) {
        Object value = call.arguments().get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null && "true".equals(String.valueOf(value).trim().toLowerCase(Locale.ROOT));
    }

    /**
     * A list argument, {@code null} when absent. A single string is read as a one-element list.
     */
    static List<String> stringList(RequestedToolCall call, String key) {
        Object value = call.arguments().get(key);
        if (value == null) {
            return null;
        }
        List<String> values = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !String.valueOf(item).isBlank()) {
                    values.add(String.valueOf(item).trim());
                }
            }
        } else if (!String.valueOf(value).isBlank()) {
            values.add(String.valueOf(value).trim());
        }
        return values;
    }
}
