package com.linlay.calendarassistant.calendar;

import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Calendar backend bound to one caller's credentials. Failures surface as
 * {@link CalendarProviderException}.
 */
public interface CalendarProvider {

    Mono<List<CalendarEvent>> listEvents(String calendarId, Instant timeMin, Instant timeMax);

    Mono<CalendarEvent> insertEvent(String calendarId, CalendarEvent event);

    /**
     * Applies only the non-null fields of {@code patch}.
     */
    Mono<CalendarEvent> patchEvent(String calendarId, String eventId, CalendarEvent patch);

    Mono<Void> deleteEvent(String calendarId, String eventId);

    /**
     * IANA zone configured on the primary calendar, empty when the provider does not say.
     */
    Mono<String> primaryTimeZone();
}
