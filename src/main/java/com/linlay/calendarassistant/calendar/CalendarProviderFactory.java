package com.linlay.calendarassistant.calendar;

@FunctionalInterface
public interface CalendarProviderFactory {

    CalendarProvider forAccessToken(String accessToken);
}
