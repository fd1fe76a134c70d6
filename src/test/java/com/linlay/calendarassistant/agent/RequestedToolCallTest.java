package com.linlay.calendarassistant.agent;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequestedToolCallTest {

    @Test
    void blankArgumentsShouldCountAsMissing() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("summary", "  ");
        arguments.put("event_id", " E1 ");
        arguments.put("description", null);

        RequestedToolCall call = new RequestedToolCall("call_1", " delete_event ", null, arguments);

        assertThat(call.name()).isEqualTo("delete_event");
        assertThat(call.rawArguments()).isEmpty();
        assertThat(call.argument("event_id")).isEqualTo("E1");
        assertThat(call.hasArgument("summary")).isFalse();
        assertThat(call.hasArgument("description")).isFalse();
        assertThat(call.hasArgument("start_time")).isFalse();
    }
}
