package com.linlay.calendarassistant.tool;

import com.linlay.calendarassistant.agent.RequestedToolCall;
import com.linlay.calendarassistant.calendar.CalendarEvent;
import com.linlay.calendarassistant.calendar.EventAttendee;
import com.linlay.calendarassistant.config.CalendarProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Partial update: only the arguments that are present reach the provider.
 */
@Component
public class EditEventTool implements CalendarTool {

    private final CalendarProperties properties;
    private final TimeZoneResolver timeZoneResolver;

    public EditEventTool(CalendarProperties properties, TimeZoneResolver timeZoneResolver) {
        this.properties = properties;
        this.timeZoneResolver = timeZoneResolver;
    }

    @Override
    public CalendarToolName name() {
        return CalendarToolName.EDIT_EVENT;
    }

    @Override
    public Mono<Object> invoke(RequestedToolCall call, ToolInvocationContext context) {
        return Mono.defer(() -> {
            String eventId = ToolArguments.requireText(call, "event_id");
            Instant start = ToolArguments.optionalInstant(call, "start_time");
            Instant end = ToolArguments.optionalInstant(call, "end_time");
            boolean allDay = ToolArguments.flag(call, "all_day");
            CalendarEvent.Builder patch = CalendarEvent.builder()
                    .summary(call.argument("summary"))
                    .description(call.argument("description"))
                    .recurrence(ToolArguments.stringList(call, "recurrence"));
            List<String> attendees = ToolArguments.stringList(call, "attendees");
            if (attendees != null) {
                patch.attendees(attendees.stream().map(EventAttendee::of).toList());
            }
            if (start == null && end == null) {
                return context.provider().patchEvent(properties.getDefaultCalendarId(), eventId, patch.build());
            }
            return timeZoneResolver.resolve(call.argument("time_zone"), context.provider())
                    .flatMap(zone -> {
                        if (allDay) {
                            LocalDate startDate = start == null ? null : ToolArguments.requireDate(call, "start_time", zone);
                            if (startDate != null) {
                                patch.start(EventTimes.allDayStart(startDate, zone));
                            }
                            if (end != null) {
                                patch.end(EventTimes.allDayEnd(startDate, ToolArguments.requireDate(call, "end_time", zone), zone));
                            }
                        } else {
                            if (start != null) {
                                patch.start(EventTimes.timed(start, zone));
                            }
                            if (end != null) {
                                patch.end(EventTimes.timed(end, zone));
                            }
                        }
                        return context.provider().patchEvent(properties.getDefaultCalendarId(), eventId, patch.build());
                    });
        });
    }
}
