package com.linlay.calendarassistant.tool;

import com.linlay.calendarassistant.calendar.CalendarProvider;
import com.linlay.calendarassistant.config.CalendarProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Effective zone for a new or edited event: the explicit argument, else the primary calendar's
 * zone, else the configured default.
 */
@Component
public class TimeZoneResolver {

    private static final Logger log = LoggerFactory.getLogger(TimeZoneResolver.class);

    private final CalendarProperties properties;

    public TimeZoneResolver(CalendarProperties properties) {
        this.properties = properties;
    }

    public Mono<ZoneId> resolve(String explicitZone, CalendarProvider provider) {
        Optional<ZoneId> explicit = toZone(explicitZone);
        if (explicit.isPresent()) {
            return Mono.just(explicit.get());
        }
        return provider.primaryTimeZone()
                .flatMap(zone -> Mono.justOrEmpty(toZone(zone)))
                .onErrorResume(ex -> {
                    log.debug("Primary calendar zone unavailable: {}", ex.toString());
                    return Mono.empty();
                })
                .defaultIfEmpty(defaultZone());
    }

    ZoneId defaultZone() {
        return toZone(properties.getDefaultTimeZone()).orElse(ZoneId.of("America/Los_Angeles"));
    }

    private Optional<ZoneId> toZone(String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        try {
            return Optional.of(ZoneId.of(value.trim()));
        } catch (DateTimeException ex) {
            log.debug("Ignoring unknown time zone '{}'", value);
            return Optional.empty();
        }
    }
}
