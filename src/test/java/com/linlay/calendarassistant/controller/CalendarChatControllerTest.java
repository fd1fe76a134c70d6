package com.linlay.calendarassistant.controller;

import com.linlay.calendarassistant.agent.RequestedToolCall;
import com.linlay.calendarassistant.calendar.CalendarProvider;
import com.linlay.calendarassistant.calendar.CalendarProviderFactory;
import com.linlay.calendarassistant.config.AssistantLlmProperties;
import com.linlay.calendarassistant.service.AssistantReply;
import com.linlay.calendarassistant.service.LlmCallSpec;
import com.linlay.calendarassistant.service.LlmReply;
import com.linlay.calendarassistant.service.LlmService;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.FluxExchangeResult;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "assistant.llm.base-url=https://example.com/v1",
                "assistant.llm.api-key=test-key",
                "assistant.llm.model=test-model",
                "assistant.auth.enabled=false"
        }
)
@AutoConfigureWebTestClient
@Import(CalendarChatControllerTest.TestCollaboratorsConfig.class)
class CalendarChatControllerTest {

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE = new ParameterizedTypeReference<>() {
    };

    @Autowired
    private WebTestClient webTestClient;

    @TestConfiguration
    static class TestCollaboratorsConfig {

        @Bean
        @Primary
        LlmService scriptedLlmService() {
            return new LlmService(new AssistantLlmProperties()) {
                @Override
                public Mono<LlmReply> complete(LlmCallSpec spec) {
                    if ("time-range".equals(spec.stage())) {
                        return Mono.just(LlmReply.of(AssistantReply.text("{\"start\":null,\"end\":null}")));
                    }
                    List<Message> messages = spec.messages();
                    Message last = messages.get(messages.size() - 1);
                    if (last instanceof ToolResponseMessage) {
                        return Mono.just(LlmReply.of(AssistantReply.text("Deleted event E123.")));
                    }
                    if (last.getText().contains("E123")) {
                        RequestedToolCall delete = new RequestedToolCall("call_1", "delete_event",
                                "{\"event_id\":\"E123\"}", Map.of("event_id", "E123"));
                        return Mono.just(LlmReply.of(AssistantReply.toolCalls(null, List.of(delete))));
                    }
                    return Mono.just(LlmReply.of(AssistantReply.text("Hello!")));
                }
            };
        }

        @Bean
        @Primary
        CalendarProviderFactory stubCalendarProviderFactory() {
            CalendarProvider provider = mock(CalendarProvider.class);
            when(provider.deleteEvent("primary", "E123")).thenReturn(Mono.empty());
            return accessToken -> provider;
        }
    }

    @Test
    void messagesWithoutSessionShouldAnswerNotAuthenticated() {
        List<ServerSentEvent<String>> events = submit(Map.of("question", "what's on today?"), null);

        assertThat(events).hasSize(1);
        assertThat(events.get(0).event()).isEqualTo("message");
        assertThat(events.get(0).data()).isEqualTo("{\"status\":\"\",\"text\":\"Not authenticated\",\"gui\":null}");
    }

    @Test
    void messagesShouldStreamEveryChannelThenDone() {
        List<ServerSentEvent<String>> events = submit(
                Map.of("question", "delete event with id E123", "threadId", "thread-ctl-1"), "token-1");

        assertThat(events).extracting(ServerSentEvent::event)
                .contains("status", "text", "gui", "thread-id", "mutation-count", "extracted-range");
        assertThat(events.get(events.size() - 1).event()).isEqualTo("done");
        assertThat(events.get(0).id()).isEqualTo("1");
        assertThat(events.get(events.size() - 1).id()).isEqualTo(String.valueOf(events.size()));
        assertThat(dataOf(events, "thread-id")).containsExactly("\"thread-ctl-1\"");
        assertThat(dataOf(events, "mutation-count")).containsExactly("0", "1");
        assertThat(dataOf(events, "extracted-range")).containsExactly("null", "null");
        assertThat(dataOf(events, "text")).contains("\"Deleted event E123.\"");
        assertThat(dataOf(events, "gui")).hasSize(2);
        assertThat(dataOf(events, "gui").get(1)).contains("\"label\":\"Deleted events\"", "\"phase\":\"DONE\"");

        webTestClient.get()
                .uri("/api/calendar/threads/{threadId}", "thread-ctl-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.code").isEqualTo(0)
                .jsonPath("$.data.threadId").isEqualTo("thread-ctl-1")
                .jsonPath("$.data.messages.length()").isEqualTo(4)
                .jsonPath("$.data.messages[1].toolCalls[0].name").isEqualTo("delete_event")
                .jsonPath("$.data.messages[2].toolCallId").isEqualTo("call_1");
    }

    @Test
    void unknownThreadShouldReturnNotFoundEnvelope() {
        webTestClient.get()
                .uri("/api/calendar/threads/{threadId}", "no-such-thread")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.code").isEqualTo(404)
                .jsonPath("$.msg").isEqualTo("thread not found: no-such-thread")
                .jsonPath("$.data.threadId").isEqualTo("no-such-thread");
    }

    private List<ServerSentEvent<String>> submit(Map<String, Object> body, String accessToken) {
        WebTestClient.RequestBodySpec request = webTestClient.post()
                .uri("/api/calendar/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM);
        if (accessToken != null) {
            request = request.header("X-Calendar-Access-Token", accessToken)
                    .header("X-User-Name", "Ada")
                    .header("X-User-Email", "ada@example.com");
        }
        FluxExchangeResult<ServerSentEvent<String>> result = request.bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .returnResult(SSE_TYPE);
        List<ServerSentEvent<String>> events = result.getResponseBody()
                .collectList()
                .block(Duration.ofSeconds(10));
        assertThat(events).isNotNull();
        return events;
    }

    private static List<String> dataOf(List<ServerSentEvent<String>> events, String name) {
        return events.stream()
                .filter(event -> name.equals(event.event()))
                .map(ServerSentEvent::data)
                .toList();
    }
}
