package com.linlay.calendarassistant.calendar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Provider event resource. Null fields are omitted on the wire, which is what makes a
 * partially filled instance usable as a patch body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CalendarEvent(
        String id,
        String status,
        String summary,
        String description,
        EventDateTime start,
        EventDateTime end,
        List<EventAttendee> attendees,
        List<String> recurrence,
        String hangoutLink,
        ConferenceData conferenceData,
        String htmlLink
) {

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String summary;
        private String description;
        private EventDateTime start;
        private EventDateTime end;
        private List<EventAttendee> attendees;
        private List<String> recurrence;

        private Builder() {
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder start(EventDateTime start) {
            this.start = start;
            return this;
        }

        public Builder end(EventDateTime end) {
            this.end = end;
            return this;
        }

        public Builder attendees(List<EventAttendee> attendees) {
            this.attendees = attendees == null ? null : List.copyOf(attendees);
            return this;
        }

        public Builder recurrence(List<String> recurrence) {
            this.recurrence = recurrence == null ? null : List.copyOf(recurrence);
            return this;
        }

        public CalendarEvent build() {
            return new CalendarEvent(null, null, summary, description, start, end, attendees, recurrence, null, null, null);
        }
    }
}
