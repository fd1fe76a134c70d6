package com.linlay.calendarassistant.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.calendarassistant.config.AssistantLlmProperties;
import com.linlay.calendarassistant.service.LlmCallSpec;
import com.linlay.calendarassistant.service.LlmReply;
import com.linlay.calendarassistant.service.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Asks the model, once, for the calendar window a question refers to.
 * <p>
 * Advisory only: timeouts, transport errors, malformed JSON and invalid windows all complete
 * empty. The call uses deterministic sampling and the short extraction timeout.
 */
@Component
public class TimeRangeExtractor {

    static final String EXTRACTION_PROMPT = "Extract a calendar time range from user text. "
            + "Return JSON only with { \"start\": ISO8601 string, \"end\": ISO8601 string } when a time range is clearly inferable. "
            + "If unclear or absent, return { \"start\": null, \"end\": null }. "
            + "Use UTC ISO8601 format and ensure end is after start.";

    private static final Logger log = LoggerFactory.getLogger(TimeRangeExtractor.class);

    private final LlmService llmService;
    private final AssistantLlmProperties properties;
    private final ObjectMapper objectMapper;

    public TimeRangeExtractor(LlmService llmService, AssistantLlmProperties properties, ObjectMapper objectMapper) {
        this.llmService = llmService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Mono<ExtractedTimeRange> extract(String question, Instant now) {
        return Mono.defer(() -> {
                    LlmCallSpec spec = new LlmCallSpec(
                            properties.resolveTimeRangeModel(),
                            0.0,
                            EXTRACTION_PROMPT,
                            List.of(new UserMessage("Now: " + now + "\nUser text: " + (question == null ? "" : question))),
                            List.of(),
                            true,
                            properties.getTimeRangeTimeoutMs(),
                            "time-range"
                    );
                    return llmService.complete(spec);
                })
                .flatMap(reply -> Mono.justOrEmpty(toRange(reply)))
                .onErrorResume(ex -> {
                    log.debug("Time range extraction skipped: {}", ex.toString());
                    return Mono.empty();
                });
    }

    Optional<ExtractedTimeRange> toRange(LlmReply reply) {
        if (reply == null || reply.message() == null || !StringUtils.hasText(reply.message().content())) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(reply.message().content());
        } catch (Exception ex) {
            log.debug("Time range reply is not JSON: {}", ex.getMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        Optional<Instant> start = IsoTimestamps.parse(textOrNull(node.get("start")));
        Optional<Instant> end = IsoTimestamps.parse(textOrNull(node.get("end")));
        if (start.isEmpty() || end.isEmpty() || !end.get().isAfter(start.get())) {
            return Optional.empty();
        }
        return Optional.of(new ExtractedTimeRange(start.get(), end.get()));
    }

    private String textOrNull(JsonNode node) {
        return node == null || node.isNull() || !node.isTextual() ? null : node.asText();
    }
}
