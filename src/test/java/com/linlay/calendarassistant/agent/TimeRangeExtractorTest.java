package com.linlay.calendarassistant.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.calendarassistant.config.AssistantLlmProperties;
import com.linlay.calendarassistant.service.AssistantReply;
import com.linlay.calendarassistant.service.LlmCallSpec;
import com.linlay.calendarassistant.service.LlmReply;
import com.linlay.calendarassistant.service.LlmService;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class TimeRangeExtractorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Test
    void shouldReturnRangeFromJsonReply() {
        AtomicReference<LlmCallSpec> captured = new AtomicReference<>();
        TimeRangeExtractor extractor = extractor(spec -> {
            captured.set(spec);
            return Mono.just(textReply("{\"start\":\"2026-03-02T00:00:00Z\",\"end\":\"2026-03-09T00:00:00Z\"}"));
        });

        ExtractedTimeRange range = extractor.extract("what's on this week?", NOW).block();

        assertThat(range).isNotNull();
        assertThat(range.start()).isEqualTo(Instant.parse("2026-03-02T00:00:00Z"));
        assertThat(range.end()).isEqualTo(Instant.parse("2026-03-09T00:00:00Z"));
        LlmCallSpec spec = captured.get();
        assertThat(spec.model()).isEqualTo("range-model");
        assertThat(spec.temperature()).isEqualTo(0.0);
        assertThat(spec.jsonObject()).isTrue();
        assertThat(spec.timeoutMs()).isEqualTo(1500L);
        assertThat(spec.tools()).isEmpty();
        assertThat(spec.systemPrompt()).isEqualTo(TimeRangeExtractor.EXTRACTION_PROMPT);
        assertThat(spec.messages()).hasSize(1);
        assertThat(spec.messages().get(0).getText())
                .isEqualTo("Now: 2026-03-02T09:00:00Z\nUser text: what's on this week?");
    }

    @Test
    void shouldCompleteEmptyWhenModelTimesOut() {
        TimeRangeExtractor extractor = extractor(spec -> Mono.error(new TimeoutException("Did not observe any item")));

        assertThat(extractor.extract("next week", NOW).blockOptional(Duration.ofSeconds(5))).isEmpty();
    }

    @Test
    void shouldCompleteEmptyForMalformedOrUnclearReplies() {
        assertThat(extractor(spec -> Mono.just(textReply("not json"))).extract("x", NOW).blockOptional()).isEmpty();
        assertThat(extractor(spec -> Mono.just(textReply("{\"start\":null,\"end\":null}"))).extract("x", NOW).blockOptional()).isEmpty();
        assertThat(extractor(spec -> Mono.just(textReply("{\"start\":\"soon\",\"end\":\"later\"}"))).extract("x", NOW).blockOptional()).isEmpty();
        assertThat(extractor(spec -> Mono.just(LlmReply.empty())).extract("x", NOW).blockOptional()).isEmpty();
        assertThat(extractor(spec -> Mono.empty()).extract("x", NOW).blockOptional()).isEmpty();
    }

    @Test
    void shouldRejectRangeWhoseEndIsNotAfterStart() {
        String sameInstant = "{\"start\":\"2026-03-02T10:00:00Z\",\"end\":\"2026-03-02T10:00:00Z\"}";
        String reversed = "{\"start\":\"2026-03-03T10:00:00Z\",\"end\":\"2026-03-02T10:00:00Z\"}";

        assertThat(extractor(spec -> Mono.just(textReply(sameInstant))).extract("x", NOW).blockOptional()).isEmpty();
        assertThat(extractor(spec -> Mono.just(textReply(reversed))).extract("x", NOW).blockOptional()).isEmpty();
    }

    @Test
    void shouldAcceptOffsetAndDateOnlyTimestamps() {
        TimeRangeExtractor extractor = extractor(spec -> Mono.just(
                textReply("{\"start\":\"2026-03-02T08:00:00+08:00\",\"end\":\"2026-03-04\"}")));

        ExtractedTimeRange range = extractor.extract("x", NOW).block();

        assertThat(range).isNotNull();
        assertThat(range.start()).isEqualTo(Instant.parse("2026-03-02T00:00:00Z"));
        assertThat(range.end()).isEqualTo(Instant.parse("2026-03-04T00:00:00Z"));
    }

    private TimeRangeExtractor extractor(Function<LlmCallSpec, Mono<LlmReply>> behavior) {
        AssistantLlmProperties properties = new AssistantLlmProperties();
        properties.setModel("main-model");
        properties.setTimeRangeModel("range-model");
        properties.setTimeRangeTimeoutMs(1500L);
        LlmService llmService = new LlmService(properties) {
            @Override
            public Mono<LlmReply> complete(LlmCallSpec spec) {
                return behavior.apply(spec);
            }
        };
        return new TimeRangeExtractor(llmService, properties, new ObjectMapper());
    }

    private static LlmReply textReply(String content) {
        return LlmReply.of(AssistantReply.text(content));
    }
}
