package com.linlay.calendarassistant.calendar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventAttendee(
        String email,
        String responseStatus
) {

    public static EventAttendee of(String email) {
        return new EventAttendee(email, null);
    }
}
