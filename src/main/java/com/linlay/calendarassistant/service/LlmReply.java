package com.linlay.calendarassistant.service;

/**
 * @param message {@code null} when the response carried no choice or no message
 */
public record LlmReply(
        AssistantReply message,
        String finishReason
) {

    public static LlmReply of(AssistantReply message) {
        return new LlmReply(message, message == null ? null : message.hasToolCalls() ? "tool_calls" : "stop");
    }

    public static LlmReply empty() {
        return new LlmReply(null, null);
    }
}
