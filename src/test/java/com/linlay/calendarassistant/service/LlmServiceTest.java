package com.linlay.calendarassistant.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.calendarassistant.config.AssistantLlmProperties;
import com.linlay.calendarassistant.config.LlmInteractionLogProperties;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ClientCodecConfigurer;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldPostCompletionRequestAndParseReply() throws Exception {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        AtomicReference<String> body = new AtomicReference<>();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            captured.set(request);
            MockClientHttpRequest mockRequest = new MockClientHttpRequest(request.method(), request.url());
            return request.body().insert(mockRequest, new BodyContext())
                    .then(Mono.defer(() -> DataBufferUtils.join(mockRequest.getBody())))
                    .map(buffer -> {
                        body.set(readAndRelease(buffer));
                        return ClientResponse.create(HttpStatus.OK)
                                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                                .body("{\"choices\":[{\"finish_reason\":\"stop\",\"message\":{\"content\":\"ok\"}}]}")
                                .build();
                    });
        });
        LlmService service = new LlmService(properties("https://llm.example.com/v1"), objectMapper,
                new LlmInteractionLogProperties(), builder);
        List<Message> history = List.of(
                new UserMessage("delete E1"),
                new AssistantMessage("", Map.of(), List.of(
                        new AssistantMessage.ToolCall("call_1", "function", "delete_event", "{\"event_id\":\"E1\"}"))),
                new ToolResponseMessage(List.of(new ToolResponseMessage.ToolResponse("call_1", "delete_event", "{\"data\":{}}"))));
        LlmCallSpec spec = new LlmCallSpec("gpt-test", 0.2, "system text", history,
                List.of(new LlmService.LlmFunctionTool("delete_event", "Delete an event", Map.of("type", "object"), null)),
                false, 5000L, "round-1");

        LlmReply reply = service.complete(spec).block(Duration.ofSeconds(5));

        assertThat(reply).isNotNull();
        assertThat(reply.message().content()).isEqualTo("ok");
        assertThat(captured.get().url().toString()).isEqualTo("https://llm.example.com/v1/chat/completions");
        assertThat(captured.get().headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test");

        JsonNode request = objectMapper.readTree(body.get());
        assertThat(request.path("model").asText()).isEqualTo("gpt-test");
        assertThat(request.path("tool_choice").asText()).isEqualTo("auto");
        assertThat(request.path("tools").get(0).path("function").path("name").asText()).isEqualTo("delete_event");
        assertThat(request.has("response_format")).isFalse();
        JsonNode messages = request.path("messages");
        assertThat(messages).hasSize(4);
        assertThat(messages.get(0).path("role").asText()).isEqualTo("system");
        assertThat(messages.get(2).path("tool_calls").get(0).path("id").asText()).isEqualTo("call_1");
        assertThat(messages.get(3).path("role").asText()).isEqualTo("tool");
        assertThat(messages.get(3).path("tool_call_id").asText()).isEqualTo("call_1");
    }

    @Test
    void shouldTimeOutWithoutRetrying() {
        AtomicInteger attempts = new AtomicInteger();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            attempts.incrementAndGet();
            return Mono.never();
        });
        LlmService service = new LlmService(properties("https://llm.example.com"), objectMapper,
                new LlmInteractionLogProperties(), builder);
        LlmCallSpec spec = new LlmCallSpec("gpt-test", 0.0, "extract", List.of(new UserMessage("x")),
                List.of(), true, 100L, "time-range");

        assertThatThrownBy(() -> service.complete(spec).block(Duration.ofSeconds(5)))
                .hasCauseInstanceOf(TimeoutException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void missingApiKeyShouldFailTheCall() {
        AssistantLlmProperties properties = properties("https://llm.example.com/v1");
        properties.setApiKey(" ");
        LlmService service = new LlmService(properties);

        assertThatThrownBy(() -> service.complete(new LlmCallSpec("m", null, null, List.of(), List.of(), false, null, null)).block())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("api-key");
    }

    @Test
    void completionsUriShouldDependOnVersionedBaseUrl() {
        assertThat(OpenAiCompatibleClient.resolveCompletionsUri("https://api.openai.com/v1")).isEqualTo("/chat/completions");
        assertThat(OpenAiCompatibleClient.resolveCompletionsUri("https://api.openai.com/v1/")).isEqualTo("/chat/completions");
        assertThat(OpenAiCompatibleClient.resolveCompletionsUri("http://localhost:11434")).isEqualTo("/v1/chat/completions");
    }

    private AssistantLlmProperties properties(String baseUrl) {
        AssistantLlmProperties properties = new AssistantLlmProperties();
        properties.setBaseUrl(baseUrl);
        properties.setApiKey("sk-test");
        return properties;
    }

    private static String readAndRelease(DataBuffer buffer) {
        try {
            return buffer.toString(StandardCharsets.UTF_8);
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private static final class BodyContext implements BodyInserter.Context {

        private final ClientCodecConfigurer codecs = ClientCodecConfigurer.create();

        @Override
        public List<HttpMessageWriter<?>> messageWriters() {
            return codecs.getWriters();
        }

        @Override
        public Optional<ServerHttpRequest> serverRequest() {
            return Optional.empty();
        }

        @Override
        public Map<String, Object> hints() {
            return Map.of();
        }
    }
}
