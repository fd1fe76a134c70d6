package com.linlay.calendarassistant.calendar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Either a zoned {@code dateTime} or an all-day {@code date}, never both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventDateTime(
        String dateTime,
        String date,
        String timeZone
) {

    public static EventDateTime timed(String dateTime, String timeZone) {
        return new EventDateTime(dateTime, null, timeZone);
    }

    public static EventDateTime allDay(String date, String timeZone) {
        return new EventDateTime(null, date, timeZone);
    }

    public boolean isAllDay() {
        return dateTime == null && date != null;
    }

    public String value() {
        return dateTime != null ? dateTime : date;
    }
}
