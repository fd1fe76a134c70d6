package com.linlay.calendarassistant.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.calendarassistant.agent.ToolArgumentCodec;
import com.linlay.calendarassistant.config.AssistantLlmProperties;
import com.linlay.calendarassistant.config.LlmInteractionLogProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Chat completion against the configured OpenAI-compatible model. Each call carries its own
 * hard timeout and is never retried.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final AssistantLlmProperties properties;
    private final LlmCallLogger callLogger;
    private final OpenAiCompatibleClient client;

    public record LlmFunctionTool(
            String name,
            String description,
            Map<String, Object> parameters,
            Boolean strict
    ) {
    }

    /**
     * Offline instance for tests that override {@link #complete(LlmCallSpec)}.
     */
    public LlmService(AssistantLlmProperties properties) {
        this(properties, new ObjectMapper(), new LlmInteractionLogProperties(), WebClient.builder());
    }

    @Autowired
    public LlmService(
            AssistantLlmProperties properties,
            ObjectMapper objectMapper,
            LlmInteractionLogProperties logProperties,
            WebClient.Builder loggingWebClientBuilder
    ) {
        this.properties = properties;
        this.callLogger = new LlmCallLogger(logProperties);
        ChatCompletionParser parser = new ChatCompletionParser(objectMapper, new ToolArgumentCodec(objectMapper));
        this.client = new OpenAiCompatibleClient(properties, loggingWebClientBuilder, parser, callLogger);
    }

    public Mono<LlmReply> complete(LlmCallSpec spec) {
        return Mono.defer(() -> {
            String traceId = callLogger.generateTraceId();
            long startNanos = System.nanoTime();
            long timeoutMs = spec.timeoutMs() == null ? properties.getRequestTimeoutMs() : spec.timeoutMs();

            callLogger.info(log, "[{}][{}] LLM call start model={}, messages={}, tools={}",
                    traceId, spec.stage(), spec.model(), spec.messages().size(), spec.tools().size());
            callLogger.debug(log, "[{}][{}] LLM system prompt:\n{}", traceId, spec.stage(),
                    callLogger.sanitizeText(spec.systemPrompt()));
            callLogger.logHistoryMessages(log, traceId, spec.stage(), spec.messages());

            return client.complete(spec, traceId)
                    .timeout(Duration.ofMillis(timeoutMs))
                    .doOnNext(reply -> callLogger.logReply(log, traceId, spec.stage(), reply, startNanos))
                    .doOnError(ex -> log.warn("[{}][{}] LLM call failed in {} ms: {}",
                            traceId, spec.stage(), callLogger.elapsedMs(startNanos), ex.toString()));
        });
    }
}
