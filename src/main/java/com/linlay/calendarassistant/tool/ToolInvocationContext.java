package com.linlay.calendarassistant.tool;

import com.linlay.calendarassistant.calendar.CalendarProvider;

import java.util.Objects;

/**
 * Per-request collaborators a calendar tool runs against.
 *
 * @param userEmail the caller's own address, may be {@code null}
 */
public record ToolInvocationContext(
        CalendarProvider provider,
        String userEmail
) {
    public ToolInvocationContext {
        Objects.requireNonNull(provider, "provider");
    }
}
