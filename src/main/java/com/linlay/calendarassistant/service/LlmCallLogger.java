package com.linlay.calendarassistant.service;

import com.linlay.calendarassistant.agent.RequestedToolCall;
import com.linlay.calendarassistant.config.LlmInteractionLogProperties;
import org.slf4j.Logger;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Trace ids, elapsed time and masked transcript logging for model calls.
 */
class LlmCallLogger {

    private final boolean enabled;
    private final boolean maskSensitive;
    private final int maxLoggedChars;

    LlmCallLogger(LlmInteractionLogProperties properties) {
        this.enabled = properties == null || properties.isEnabled();
        this.maskSensitive = properties == null || properties.isMaskSensitive();
        this.maxLoggedChars = properties == null ? 0 : properties.getMaxLoggedChars();
    }

    String generateTraceId() {
        return "llm-" + UUID.randomUUID().toString().replace("-", "");
    }

    long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    String sanitizeText(String text) {
        return LlmLogSanitizer.truncate(LlmLogSanitizer.maskText(text, maskSensitive), maxLoggedChars);
    }

    void info(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.info(pattern, arguments);
        }
    }

    void debug(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.debug(pattern, arguments);
        }
    }

    void logHistoryMessages(Logger logger, String traceId, String stage, List<Message> messages) {
        if (!enabled || !logger.isDebugEnabled() || messages == null || messages.isEmpty()) {
            return;
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (message == null) {
                continue;
            }
            builder.append('[').append(i).append("] role=")
                    .append(message.getMessageType() == null ? "unknown" : message.getMessageType().name().toLowerCase(Locale.ROOT))
                    .append(", text=")
                    .append(sanitizeText(message.getText()));
            if (message instanceof AssistantMessage assistantMessage && assistantMessage.hasToolCalls()) {
                builder.append(", toolCalls=").append(assistantMessage.getToolCalls().size());
            }
            if (message instanceof ToolResponseMessage toolResponseMessage
                    && toolResponseMessage.getResponses() != null
                    && !toolResponseMessage.getResponses().isEmpty()) {
                builder.append(", toolResponses=").append(toolResponseMessage.getResponses().size());
            }
            builder.append('\n');
        }
        logger.debug("[{}][{}] LLM history messages detail:\n{}", traceId, stage, builder);
    }

    void logReply(Logger logger, String traceId, String stage, LlmReply reply, long startNanos) {
        if (!enabled) {
            return;
        }
        if (reply == null || reply.message() == null) {
            logger.info("[{}][{}] LLM call finished in {} ms without a message", traceId, stage, elapsedMs(startNanos));
            return;
        }
        AssistantReply message = reply.message();
        logger.info("[{}][{}] LLM call finished in {} ms finish_reason={}, toolCalls={}, legacy={}",
                traceId, stage, elapsedMs(startNanos), reply.finishReason(),
                message.toolCalls().size(), message.legacyFunctionCall());
        if (message.content() != null && !message.content().isEmpty()) {
            logger.debug("[{}][{}] content: {}", traceId, stage, sanitizeText(message.content()));
        }
        for (RequestedToolCall call : message.toolCalls()) {
            logger.debug("[{}][{}] tool_call id={}, name={}, args={}",
                    traceId, stage, call.id(), call.name(), sanitizeText(call.rawArguments()));
        }
    }
}
