package com.linlay.calendarassistant.tool;

import com.linlay.calendarassistant.agent.RequestedToolCall;
import com.linlay.calendarassistant.config.CalendarProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class DeleteEventTool implements CalendarTool {

    private final CalendarProperties properties;

    public DeleteEventTool(CalendarProperties properties) {
        this.properties = properties;
    }

    @Override
    public CalendarToolName name() {
        return CalendarToolName.DELETE_EVENT;
    }

    @Override
    public Mono<Object> invoke(RequestedToolCall call, ToolInvocationContext context) {
        return Mono.defer(() -> {
            String eventId = ToolArguments.requireText(call, "event_id");
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("event_id", eventId);
            result.put("deleted", true);
            return context.provider().deleteEvent(properties.getDefaultCalendarId(), eventId)
                    .thenReturn(result);
        });
    }
}
