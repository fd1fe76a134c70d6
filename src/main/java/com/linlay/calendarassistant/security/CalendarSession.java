package com.linlay.calendarassistant.security;

import org.springframework.util.StringUtils;

/**
 * The authenticated caller and the access token used against their calendar.
 */
public record CalendarSession(
        String accessToken,
        String userName,
        String userEmail
) {

    public boolean hasAccessToken() {
        return StringUtils.hasText(accessToken);
    }

    @Override
    public String toString() {
        return "CalendarSession[userName=" + userName + ", userEmail=" + userEmail + ", accessToken=***]";
    }
}
