package com.linlay.calendarassistant.calendar;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.calendarassistant.config.CalendarProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Component
public class GoogleCalendarProviderFactory implements CalendarProviderFactory {

    private final CalendarProperties properties;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    public GoogleCalendarProviderFactory(
            CalendarProperties properties,
            WebClient.Builder loggingWebClientBuilder,
            ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.webClientBuilder = loggingWebClientBuilder;
        this.objectMapper = objectMapper;
    }

    @Override
    public CalendarProvider forAccessToken(String accessToken) {
        if (!StringUtils.hasText(accessToken)) {
            throw new IllegalArgumentException("A calendar access token is required");
        }
        WebClient webClient = webClientBuilder.clone()
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken.trim())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        return new GoogleCalendarClient(webClient, objectMapper, Duration.ofMillis(properties.getRequestTimeoutMs()));
    }
}
