package com.linlay.calendarassistant.tool;

import com.linlay.calendarassistant.calendar.EventDateTime;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Builds provider time fields. An all-day end that does not move past the start is pushed to the
 * next day, since the provider treats the end date as exclusive.
 */
final class EventTimes {

    private EventTimes() {
    }

    static EventDateTime timed(Instant instant, ZoneId zone) {
        return EventDateTime.timed(instant.atZone(zone).toOffsetDateTime().toString(), zone.getId());
    }

    static EventDateTime allDayStart(LocalDate date, ZoneId zone) {
        return EventDateTime.allDay(date.toString(), zone.getId());
    }

    /**
     * @param startDate the start day when it is known, otherwise {@code null}
     */
    static EventDateTime allDayEnd(LocalDate startDate, LocalDate endDate, ZoneId zone) {
        LocalDate end = endDate;
        if (startDate != null && !end.isAfter(startDate)) {
            end = startDate.plusDays(1);
        }
        return EventDateTime.allDay(end.toString(), zone.getId());
    }
}
