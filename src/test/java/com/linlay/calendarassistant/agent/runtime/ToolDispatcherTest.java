package com.linlay.calendarassistant.agent.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.calendarassistant.agent.RequestedToolCall;
import com.linlay.calendarassistant.agent.ToolArgumentCodec;
import com.linlay.calendarassistant.calendar.CalendarProvider;
import com.linlay.calendarassistant.calendar.CalendarProviderException;
import com.linlay.calendarassistant.config.CalendarProperties;
import com.linlay.calendarassistant.stream.GuiEvent;
import com.linlay.calendarassistant.tool.DeleteEventTool;
import com.linlay.calendarassistant.tool.GetCalendarTool;
import com.linlay.calendarassistant.tool.ToolInvocationContext;
import com.linlay.calendarassistant.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolDispatcherTest {

    private final ToolArgumentCodec codec = new ToolArgumentCodec(new ObjectMapper());

    private CalendarProvider provider;
    private ToolDispatcher dispatcher;
    private ToolInvocationContext context;
    private final List<GuiEvent> guiEvents = new ArrayList<>();

    @BeforeEach
    void setUp() {
        CalendarProperties properties = new CalendarProperties();
        properties.setDefaultCalendarId("primary");
        provider = mock(CalendarProvider.class);
        context = new ToolInvocationContext(provider, "me@example.com");
        dispatcher = new ToolDispatcher(
                new ToolRegistry(List.of(new GetCalendarTool(properties), new DeleteEventTool(properties))),
                codec
        );
    }

    @Test
    void successfulMutationShouldReportDidMutate() {
        when(provider.deleteEvent("primary", "E123")).thenReturn(Mono.empty());

        ToolExecutionResult result = dispatcher.execute(call("delete_event", Map.of("event_id", "E123")), context, guiEvents::add)
                .block();

        assertThat(result).isNotNull();
        assertThat(result.didMutate()).isTrue();
        assertThat(result.output()).isEqualTo("{\"data\":{\"event_id\":\"E123\",\"deleted\":true}}");
        assertThat(guiEvents).containsExactly(
                GuiEvent.pending("call_delete_event", "delete_event", "Deleting events"),
                GuiEvent.done("call_delete_event", "delete_event", "Deleted events"));
    }

    @Test
    void readOnlyToolShouldNotMutate() {
        when(provider.listEvents(eq("primary"), any(), any()))
                .thenReturn(Mono.just(List.of()));

        ToolExecutionResult result = dispatcher.execute(call("get_calendar", Map.of(
                "start_time", "2026-03-02T00:00:00Z",
                "end_time", "2026-03-03T00:00:00Z")), context, guiEvents::add).block();

        assertThat(result).isNotNull();
        assertThat(result.didMutate()).isFalse();
        assertThat(result.output()).isEqualTo("{\"data\":[]}");
        assertThat(guiEvents).extracting(GuiEvent::label).containsExactly("Consulting events", "Consulted events");
    }

    @Test
    void unknownToolShouldBecomeErrorResult() {
        ToolExecutionResult result = dispatcher.execute(call("send_email", Map.of()), context, guiEvents::add).block();

        assertThat(result).isNotNull();
        assertThat(result.didMutate()).isFalse();
        assertThat(result.output()).isEqualTo("{\"error\":\"Unsupported tool: send_email\"}");
        assertThat(guiEvents).containsExactly(
                GuiEvent.pending("call_send_email", "send_email", "Processing events"),
                GuiEvent.failed("call_send_email", "send_email", "Unsupported tool: send_email"));
    }

    @Test
    void namelessToolCallShouldBeAnsweredAsUnsupported() {
        RequestedToolCall nameless = new RequestedToolCall("call_blank", " ", "{}", Map.of());

        ToolExecutionResult result = dispatcher.execute(nameless, context, guiEvents::add).block();

        assertThat(result).isNotNull();
        assertThat(result.didMutate()).isFalse();
        assertThat(result.output()).isEqualTo("{\"error\":\"Unsupported tool: \"}");
        assertThat(guiEvents).last().isEqualTo(GuiEvent.failed("call_blank", "", "Unsupported tool: "));
    }

    @Test
    void knownButUnregisteredToolShouldBeUnsupported() {
        ToolExecutionResult result = dispatcher.execute(call("schedule_event", Map.of()), context, guiEvents::add).block();

        assertThat(result).isNotNull();
        assertThat(result.output()).isEqualTo("{\"error\":\"Unsupported tool: schedule_event\"}");
        assertThat(guiEvents.get(0).label()).isEqualTo("Scheduling events");
    }

    @Test
    void providerFailureShouldBeFormattedForTheModel() {
        when(provider.deleteEvent("primary", "E404")).thenReturn(Mono.error(
                new CalendarProviderException(404, "NOT_FOUND", "Not Found", List.of("notFound"))));

        ToolExecutionResult result = dispatcher.execute(call("delete_event", Map.of("event_id", "E404")), context, guiEvents::add)
                .block();

        assertThat(result).isNotNull();
        assertThat(result.didMutate()).isFalse();
        assertThat(result.output()).isEqualTo(
                "{\"error\":\"Calendar request failed (status 404, code NOT_FOUND): Not Found. Reasons: notFound\"}");
        assertThat(guiEvents).last().isEqualTo(GuiEvent.failed("call_delete_event", "delete_event", "Error on taking this action"));
    }

    @Test
    void missingArgumentShouldBeFormattedForTheModel() {
        ToolExecutionResult result = dispatcher.execute(call("delete_event", Map.of()), context, null).block();

        assertThat(result).isNotNull();
        assertThat(result.didMutate()).isFalse();
        assertThat(result.output()).isEqualTo("{\"error\":\"event_id is required\"}");
    }

    private RequestedToolCall call(String name, Map<String, Object> arguments) {
        return new RequestedToolCall("call_" + name, name, codec.serialize(arguments), arguments);
    }
}
