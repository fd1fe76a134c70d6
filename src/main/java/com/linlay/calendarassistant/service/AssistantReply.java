package com.linlay.calendarassistant.service;

import com.linlay.calendarassistant.agent.RequestedToolCall;

import java.util.List;

/**
 * The model's message, with the modern {@code tool_calls} array and the legacy single
 * {@code function_call} both folded into {@link #toolCalls()}.
 */
public record AssistantReply(
        String content,
        List<RequestedToolCall> toolCalls,
        boolean legacyFunctionCall
) {
    public AssistantReply {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static AssistantReply text(String content) {
        return new AssistantReply(content, List.of(), false);
    }

    public static AssistantReply toolCalls(String content, List<RequestedToolCall> toolCalls) {
        return new AssistantReply(content, toolCalls, false);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
