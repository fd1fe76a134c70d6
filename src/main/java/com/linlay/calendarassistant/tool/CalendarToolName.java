package com.linlay.calendarassistant.tool;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed set of calendar actions offered to the model, in schema order.
 */
public enum CalendarToolName {

    GET_CALENDAR("get_calendar", false, "Consulting events", "Consulted events"),
    SCHEDULE_EVENT("schedule_event", true, "Scheduling events", "Scheduled events"),
    EDIT_EVENT("edit_event", true, "Editing events", "Edited events"),
    DELETE_EVENT("delete_event", true, "Deleting events", "Deleted events");

    public static final String UNKNOWN_PENDING_LABEL = "Processing events";

    private final String wireName;
    private final boolean mutating;
    private final String pendingLabel;
    private final String doneLabel;

    CalendarToolName(String wireName, boolean mutating, String pendingLabel, String doneLabel) {
        this.wireName = wireName;
        this.mutating = mutating;
        this.pendingLabel = pendingLabel;
        this.doneLabel = doneLabel;
    }

    public String wireName() {
        return wireName;
    }

    public boolean mutating() {
        return mutating;
    }

    public String pendingLabel() {
        return pendingLabel;
    }

    public String doneLabel() {
        return doneLabel;
    }

    public static Optional<CalendarToolName> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim();
        return Arrays.stream(values())
                .filter(value -> value.wireName.equals(normalized))
                .findFirst();
    }

    public static boolean isMutating(String name) {
        return fromWireName(name).map(CalendarToolName::mutating).orElse(false);
    }
}
