package com.linlay.calendarassistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Location of {@code instruction.txt} and {@code functions/*.json}.
 */
@ConfigurationProperties(prefix = "assistant.config")
public class AssistantResourceProperties {

    private String location = "classpath:assistant/";

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }
}
