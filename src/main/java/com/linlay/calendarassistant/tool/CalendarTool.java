package com.linlay.calendarassistant.tool;

import com.linlay.calendarassistant.agent.RequestedToolCall;
import reactor.core.publisher.Mono;

public interface CalendarTool {

    CalendarToolName name();

    /**
     * Runs the call and returns the payload reported to the model under {@code data}.
     * Invalid arguments are signalled with {@link IllegalArgumentException}.
     */
    Mono<Object> invoke(RequestedToolCall call, ToolInvocationContext context);
}
