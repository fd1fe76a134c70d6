package com.linlay.calendarassistant.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "calendar")
public class CalendarProperties {

    @NotBlank
    private String baseUrl = "https://www.googleapis.com/calendar/v3";
    @NotBlank
    private String defaultCalendarId = "primary";
    @NotBlank
    private String defaultTimeZone = "America/Los_Angeles";
    @Min(1)
    private long requestTimeoutMs = 20_000L;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getDefaultCalendarId() {
        return defaultCalendarId;
    }

    public void setDefaultCalendarId(String defaultCalendarId) {
        this.defaultCalendarId = defaultCalendarId;
    }

    public String getDefaultTimeZone() {
        return defaultTimeZone;
    }

    public void setDefaultTimeZone(String defaultTimeZone) {
        this.defaultTimeZone = defaultTimeZone;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }
}
