package com.linlay.calendarassistant.service;

import com.linlay.calendarassistant.config.AssistantLlmProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Raw WebClient path to an OpenAI-compatible {@code /chat/completions} endpoint.
 * The whole body is read at once; there is no retry.
 */
class OpenAiCompatibleClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleClient.class);

    private final AssistantLlmProperties properties;
    private final WebClient.Builder webClientBuilder;
    private final ChatCompletionParser parser;
    private final LlmCallLogger callLogger;

    private volatile WebClient webClient;

    OpenAiCompatibleClient(
            AssistantLlmProperties properties,
            WebClient.Builder webClientBuilder,
            ChatCompletionParser parser,
            LlmCallLogger callLogger
    ) {
        this.properties = properties;
        this.webClientBuilder = webClientBuilder;
        this.parser = parser;
        this.callLogger = callLogger;
    }

    Mono<LlmReply> complete(LlmCallSpec spec, String traceId) {
        return Mono.defer(() -> {
            Map<String, Object> request = buildRequestBody(spec);
            callLogger.debug(log, "[{}][{}] LLM request messages={}, tools={}, jsonObject={}",
                    traceId, spec.stage(), spec.messages().size(), spec.tools().size(), spec.jsonObject());
            return client().post()
                    .uri(resolveCompletionsUri(properties.getBaseUrl()))
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(String.class)
                    .doOnNext(body -> callLogger.debug(log, "[{}][{}][raw] {}", traceId, spec.stage(), callLogger.sanitizeText(body)))
                    .map(parser::parse)
                    .defaultIfEmpty(LlmReply.empty());
        });
    }

    private WebClient client() {
        WebClient local = webClient;
        if (local != null) {
            return local;
        }
        if (!StringUtils.hasText(properties.getBaseUrl())) {
            throw new IllegalStateException("Missing assistant.llm.base-url");
        }
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalStateException("Missing assistant.llm.api-key");
        }
        local = webClientBuilder.clone()
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        webClient = local;
        return local;
    }

    static String resolveCompletionsUri(String baseUrl) {
        String normalized = baseUrl == null ? "" : baseUrl.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("/v1") || normalized.endsWith("/v1/")) {
            return "/chat/completions";
        }
        return "/v1/chat/completions";
    }

    Map<String, Object> buildRequestBody(LlmCallSpec spec) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", spec.model());
        if (spec.temperature() != null) {
            request.put("temperature", spec.temperature());
        }
        request.put("messages", buildRawMessages(spec.systemPrompt(), spec.messages()));
        if (spec.jsonObject()) {
            request.put("response_format", Map.of("type", "json_object"));
        }
        List<Map<String, Object>> rawTools = buildRawTools(spec.tools());
        if (!rawTools.isEmpty()) {
            request.put("tools", rawTools);
            request.put("tool_choice", "auto");
        }
        return request;
    }

    private List<Map<String, Object>> buildRawMessages(String systemPrompt, List<Message> messages) {
        List<Map<String, Object>> rawMessages = new ArrayList<>();
        if (StringUtils.hasText(systemPrompt)) {
            rawMessages.add(rawTextMessage("system", systemPrompt));
        }
        for (Message message : messages) {
            rawMessages.addAll(toRawMessages(message));
        }
        return rawMessages;
    }

    private List<Map<String, Object>> toRawMessages(Message message) {
        if (message == null) {
            return List.of();
        }
        if (message instanceof SystemMessage systemMessage) {
            return List.of(rawTextMessage("system", systemMessage.getText()));
        }
        if (message instanceof UserMessage userMessage) {
            return List.of(rawTextMessage("user", userMessage.getText()));
        }
        if (message instanceof AssistantMessage assistantMessage) {
            Map<String, Object> assistant = new LinkedHashMap<>();
            assistant.put("role", "assistant");
            String content = assistantMessage.getText();
            assistant.put("content", content == null ? "" : content);
            if (assistantMessage.hasToolCalls()) {
                List<Map<String, Object>> toolCalls = new ArrayList<>();
                for (AssistantMessage.ToolCall call : assistantMessage.getToolCalls()) {
                    Map<String, Object> function = new LinkedHashMap<>();
                    function.put("name", call.name());
                    function.put("arguments", StringUtils.hasText(call.arguments()) ? call.arguments() : "{}");
                    Map<String, Object> rawCall = new LinkedHashMap<>();
                    rawCall.put("id", call.id());
                    rawCall.put("type", "function");
                    rawCall.put("function", function);
                    toolCalls.add(rawCall);
                }
                assistant.put("tool_calls", toolCalls);
            }
            return List.of(assistant);
        }
        if (message instanceof ToolResponseMessage toolResponseMessage) {
            List<Map<String, Object>> results = new ArrayList<>();
            for (ToolResponseMessage.ToolResponse response : toolResponseMessage.getResponses()) {
                Map<String, Object> tool = new LinkedHashMap<>();
                tool.put("role", "tool");
                tool.put("tool_call_id", response.id());
                tool.put("content", response.responseData() == null ? "" : response.responseData());
                results.add(tool);
            }
            return results;
        }
        return List.of(rawTextMessage("user", message.getText()));
    }

    private List<Map<String, Object>> buildRawTools(List<LlmService.LlmFunctionTool> tools) {
        List<Map<String, Object>> rawTools = new ArrayList<>();
        for (LlmService.LlmFunctionTool tool : tools) {
            if (tool == null || !StringUtils.hasText(tool.name())) {
                continue;
            }
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", tool.name());
            if (StringUtils.hasText(tool.description())) {
                function.put("description", tool.description());
            }
            function.put("parameters", tool.parameters() == null ? Map.of("type", "object") : tool.parameters());
            if (tool.strict() != null) {
                function.put("strict", tool.strict());
            }
            rawTools.add(Map.of("type", "function", "function", function));
        }
        return rawTools;
    }

    private Map<String, Object> rawTextMessage(String role, String content) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content == null ? "" : content);
        return message;
    }
}
