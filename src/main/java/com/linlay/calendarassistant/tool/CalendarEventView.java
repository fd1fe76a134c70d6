package com.linlay.calendarassistant.tool;

import com.linlay.calendarassistant.calendar.CalendarEvent;
import com.linlay.calendarassistant.calendar.EventAttendee;

import java.util.List;
import java.util.Objects;

/**
 * Uniform event shape returned by {@code get_calendar}.
 */
public record CalendarEventView(
        String id,
        String title,
        String start,
        String end,
        boolean allDay,
        ExtendedProps extendedProps
) {

    public record ExtendedProps(
            String description,
            List<String> attendees,
            List<String> recurrence,
            String hangoutLink,
            String videoConferenceLink,
            String responseStatus
    ) {
    }

    static CalendarEventView from(CalendarEvent event) {
        boolean allDay = event.start() == null || event.start().dateTime() == null;
        List<String> attendees = event.attendees() == null
                ? List.of()
                : event.attendees().stream()
                        .filter(Objects::nonNull)
                        .map(EventAttendee::email)
                        .filter(Objects::nonNull)
                        .toList();
        return new CalendarEventView(
                event.id(),
                event.summary() == null || event.summary().isBlank() ? "Busy" : event.summary(),
                event.start() == null ? null : event.start().value(),
                event.end() == null ? null : event.end().value(),
                allDay,
                new ExtendedProps(
                        event.description() == null ? "" : event.description(),
                        attendees,
                        event.recurrence() == null ? List.of() : event.recurrence(),
                        event.hangoutLink() == null ? "" : event.hangoutLink(),
                        event.conferenceData() == null ? "" : event.conferenceData().videoUri().orElse(""),
                        event.status()
                )
        );
    }
}
