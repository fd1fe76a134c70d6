package com.linlay.calendarassistant.tool;

import com.linlay.calendarassistant.agent.RequestedToolCall;
import com.linlay.calendarassistant.calendar.CalendarEvent;
import com.linlay.calendarassistant.calendar.EventAttendee;
import com.linlay.calendarassistant.config.CalendarProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Component
public class ScheduleEventTool implements CalendarTool {

    private final CalendarProperties properties;
    private final TimeZoneResolver timeZoneResolver;

    public ScheduleEventTool(CalendarProperties properties, TimeZoneResolver timeZoneResolver) {
        this.properties = properties;
        this.timeZoneResolver = timeZoneResolver;
    }

    @Override
    public CalendarToolName name() {
        return CalendarToolName.SCHEDULE_EVENT;
    }

    @Override
    public Mono<Object> invoke(RequestedToolCall call, ToolInvocationContext context) {
        return Mono.defer(() -> {
            Instant start = ToolArguments.requireInstant(call, "start_time");
            Instant end = ToolArguments.requireInstant(call, "end_time");
            boolean allDay = ToolArguments.flag(call, "all_day");
            return timeZoneResolver.resolve(call.argument("time_zone"), context.provider())
                    .flatMap(zone -> {
                        CalendarEvent.Builder builder = CalendarEvent.builder();
                        if (allDay) {
                            LocalDate startDate = ToolArguments.requireDate(call, "start_time", zone);
                            LocalDate endDate = ToolArguments.requireDate(call, "end_time", zone);
                            builder.start(EventTimes.allDayStart(startDate, zone))
                                    .end(EventTimes.allDayEnd(startDate, endDate, zone));
                        } else {
                            builder.start(EventTimes.timed(start, zone))
                                    .end(EventTimes.timed(end, zone));
                        }
                        CalendarEvent event = builder
                                .summary(call.argument("summary"))
                                .description(call.argument("description"))
                                .attendees(withSelf(ToolArguments.stringList(call, "attendees"), context.userEmail()))
                                .recurrence(ToolArguments.stringList(call, "recurrence"))
                                .build();
                        return context.provider().insertEvent(properties.getDefaultCalendarId(), event);
                    });
        });
    }

    /**
     * Adds the caller to the guest list when anyone else is invited.
     */
    static List<EventAttendee> withSelf(List<String> attendees, String userEmail) {
        if (attendees == null || attendees.isEmpty()) {
            return null;
        }
        List<String> emails = new ArrayList<>(attendees);
        if (StringUtils.hasText(userEmail) && emails.stream().noneMatch(userEmail::equalsIgnoreCase)) {
            emails.add(userEmail);
        }
        return emails.stream().map(EventAttendee::of).toList();
    }
}
