package com.linlay.calendarassistant.tool;

import com.linlay.calendarassistant.agent.RequestedToolCall;
import com.linlay.calendarassistant.config.CalendarProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Component
public class GetCalendarTool implements CalendarTool {

    private final CalendarProperties properties;

    public GetCalendarTool(CalendarProperties properties) {
        this.properties = properties;
    }

    @Override
    public CalendarToolName name() {
        return CalendarToolName.GET_CALENDAR;
    }

    @Override
    public Mono<Object> invoke(RequestedToolCall call, ToolInvocationContext context) {
        return Mono.defer(() -> {
            Instant start = ToolArguments.requireInstant(call, "start_time");
            Instant end = ToolArguments.requireInstant(call, "end_time");
            if (!end.isAfter(start)) {
                return Mono.error(new IllegalArgumentException("end_time must be after start_time"));
            }
            String calendarId = call.hasArgument("calendar_id")
                    ? call.argument("calendar_id")
                    : properties.getDefaultCalendarId();
            return context.provider().listEvents(calendarId, start, end)
                    .map(events -> events.stream().map(CalendarEventView::from).toList());
        });
    }
}
