package com.linlay.calendarassistant.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.calendarassistant.agent.RequestedToolCall;
import com.linlay.calendarassistant.agent.ToolArgumentCodec;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Reads an OpenAI-compatible {@code chat.completion} body into an {@link LlmReply}.
 * A legacy {@code function_call} becomes a single tool call with a synthesized id. Calls whose
 * function name is missing are kept; they are not this parser's to judge.
 */
class ChatCompletionParser {

    private final ObjectMapper objectMapper;
    private final ToolArgumentCodec argumentCodec;

    ChatCompletionParser(ObjectMapper objectMapper, ToolArgumentCodec argumentCodec) {
        this.objectMapper = objectMapper;
        this.argumentCodec = argumentCodec;
    }

    LlmReply parse(String body) {
        if (!StringUtils.hasText(body)) {
            return LlmReply.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception ex) {
            throw new IllegalStateException("Model response is not valid JSON", ex);
        }
        JsonNode choice = root.path("choices").path(0);
        if (choice.isMissingNode() || choice.isNull()) {
            return LlmReply.empty();
        }
        String finishReason = textOrNull(choice.get("finish_reason"));
        JsonNode message = choice.get("message");
        if (message == null || !message.isObject()) {
            return new LlmReply(null, finishReason);
        }

        String content = textOrNull(message.get("content"));
        List<RequestedToolCall> toolCalls = new ArrayList<>();
        JsonNode rawToolCalls = message.get("tool_calls");
        if (rawToolCalls != null && rawToolCalls.isArray()) {
            for (JsonNode rawCall : rawToolCalls) {
                if (!rawCall.isObject()) {
                    continue;
                }
                // a blank name stays a call so the dispatcher answers it as unsupported
                JsonNode function = rawCall.path("function");
                String name = textOrNull(function.get("name"));
                String id = textOrNull(rawCall.get("id"));
                toolCalls.add(toRequestedCall(StringUtils.hasText(id) ? id : synthesizeCallId(), name, function.get("arguments")));
            }
        }
        if (!toolCalls.isEmpty()) {
            return new LlmReply(new AssistantReply(content, toolCalls, false), finishReason);
        }

        JsonNode legacy = message.get("function_call");
        if (legacy != null && legacy.isObject()) {
            RequestedToolCall call = toRequestedCall(synthesizeCallId(), textOrNull(legacy.get("name")), legacy.get("arguments"));
            return new LlmReply(new AssistantReply(content, List.of(call), true), finishReason);
        }
        return new LlmReply(AssistantReply.text(content), finishReason);
    }

    private RequestedToolCall toRequestedCall(String id, String name, JsonNode argumentsNode) {
        String rawArguments;
        if (argumentsNode == null || argumentsNode.isNull()) {
            rawArguments = "";
        } else if (argumentsNode.isTextual()) {
            rawArguments = argumentsNode.asText();
        } else {
            rawArguments = argumentCodec.serialize(argumentsNode);
        }
        return new RequestedToolCall(id, name, rawArguments, argumentCodec.parse(rawArguments));
    }

    static String synthesizeCallId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "");
    }

    private String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }
}
