package com.linlay.calendarassistant.service;

import org.springframework.ai.chat.messages.Message;

import java.util.List;

/**
 * One non-streaming chat completion request.
 *
 * @param jsonObject forces {@code response_format=json_object}
 * @param timeoutMs  hard per-request timeout, {@code null} for the service default
 */
public record LlmCallSpec(
        String model,
        Double temperature,
        String systemPrompt,
        List<Message> messages,
        List<LlmService.LlmFunctionTool> tools,
        boolean jsonObject,
        Long timeoutMs,
        String stage
) {
    public LlmCallSpec {
        if (messages == null) {
            messages = List.of();
        } else {
            messages = List.copyOf(messages);
        }
        if (tools == null) {
            tools = List.of();
        } else {
            tools = List.copyOf(tools);
        }
        if (stage == null || stage.isBlank()) {
            stage = "default";
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            timeoutMs = null;
        }
    }
}
