package com.linlay.calendarassistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CalendarAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalendarAssistantApplication.class, args);
    }
}
