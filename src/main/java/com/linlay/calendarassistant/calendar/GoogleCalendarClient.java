package com.linlay.calendarassistant.calendar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Calendar v3 over WebClient. The client passed in already carries the base url and the
 * caller's bearer token.
 */
public class GoogleCalendarClient implements CalendarProvider {

    private static final Logger log = LoggerFactory.getLogger(GoogleCalendarClient.class);
    private static final int MAX_PAGES = 10;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public GoogleCalendarClient(WebClient webClient, ObjectMapper objectMapper, Duration timeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public Mono<List<CalendarEvent>> listEvents(String calendarId, Instant timeMin, Instant timeMax) {
        return fetchPage(calendarId, timeMin, timeMax, null)
                .expand(page -> StringUtils.hasText(page.nextPageToken())
                        ? fetchPage(calendarId, timeMin, timeMax, page.nextPageToken())
                        : Mono.empty())
                .take(MAX_PAGES)
                .flatMapIterable(page -> page.items() == null ? List.<CalendarEvent>of() : page.items())
                .collectList();
    }

    private Mono<EventPage> fetchPage(String calendarId, Instant timeMin, Instant timeMax, String pageToken) {
        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/calendars/{calendarId}/events")
                            .queryParam("timeMin", timeMin.toString())
                            .queryParam("timeMax", timeMax.toString())
                            .queryParam("singleEvents", true)
                            .queryParam("orderBy", "startTime");
                    if (StringUtils.hasText(pageToken)) {
                        uriBuilder.queryParam("pageToken", pageToken);
                    }
                    return uriBuilder.build(calendarId);
                })
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toProviderException)
                .bodyToMono(EventPage.class)
                .timeout(timeout);
    }

    @Override
    public Mono<CalendarEvent> insertEvent(String calendarId, CalendarEvent event) {
        return webClient.post()
                .uri("/calendars/{calendarId}/events", calendarId)
                .bodyValue(event)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toProviderException)
                .bodyToMono(CalendarEvent.class)
                .timeout(timeout);
    }

    @Override
    public Mono<CalendarEvent> patchEvent(String calendarId, String eventId, CalendarEvent patch) {
        return webClient.patch()
                .uri("/calendars/{calendarId}/events/{eventId}", calendarId, eventId)
                .bodyValue(patch)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toProviderException)
                .bodyToMono(CalendarEvent.class)
                .timeout(timeout);
    }

    @Override
    public Mono<Void> deleteEvent(String calendarId, String eventId) {
        return webClient.delete()
                .uri("/calendars/{calendarId}/events/{eventId}", calendarId, eventId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toProviderException)
                .bodyToMono(Void.class)
                .timeout(timeout);
    }

    @Override
    public Mono<String> primaryTimeZone() {
        return webClient.get()
                .uri("/calendars/primary")
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toProviderException)
                .bodyToMono(CalendarMetadata.class)
                .timeout(timeout)
                .flatMap(metadata -> Mono.justOrEmpty(metadata.timeZone()))
                .filter(StringUtils::hasText);
    }

    private Mono<? extends Throwable> toProviderException(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> parseError(status, body));
    }

    CalendarProviderException parseError(int status, String body) {
        String code = null;
        String message = null;
        List<String> reasons = new ArrayList<>();
        if (StringUtils.hasText(body)) {
            try {
                JsonNode error = objectMapper.readTree(body).path("error");
                if (error.isTextual()) {
                    // OAuth endpoints answer {"error":"invalid_grant","error_description":"..."}
                    code = error.asText();
                    message = objectMapper.readTree(body).path("error_description").asText(null);
                } else if (error.isObject()) {
                    code = error.hasNonNull("status") ? error.get("status").asText() : error.path("code").asText(null);
                    message = error.path("message").asText(null);
                    for (JsonNode item : error.path("errors")) {
                        String reason = item.path("reason").asText("");
                        if (StringUtils.hasText(reason) && !reasons.contains(reason)) {
                            reasons.add(reason);
                        }
                    }
                }
            } catch (Exception ex) {
                log.debug("Calendar error body is not JSON: {}", ex.getMessage());
                message = body.length() > 200 ? body.substring(0, 200) : body;
            }
        }
        return new CalendarProviderException(status, code, message, reasons);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EventPage(List<CalendarEvent> items, String nextPageToken) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CalendarMetadata(String id, String timeZone) {
    }
}
