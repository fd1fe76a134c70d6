package com.linlay.calendarassistant.agent.policy;

import com.linlay.calendarassistant.agent.ExtractedTimeRange;
import com.linlay.calendarassistant.agent.RequestedToolCall;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class PatternClarificationGateTest {

    private static final ExtractedTimeRange WEEK = new ExtractedTimeRange(
            Instant.parse("2026-03-02T00:00:00Z"), Instant.parse("2026-03-09T00:00:00Z"));

    private final PatternClarificationGate gate = new PatternClarificationGate();

    @Test
    void deleteWithEventIdShouldProceed() {
        RequestedToolCall delete = call("delete_event", Map.of("event_id", "E123"));

        assertThat(gate.shouldDefer("delete event with id E123", null, List.of(delete))).isFalse();
    }

    @Test
    void vagueChineseSchedulingRequestShouldDefer() {
        RequestedToolCall schedule = call("schedule_event", Map.of("summary", "复习"));

        assertThat(gate.shouldDefer("安排一下复习，最近找时间", null, List.of(schedule))).isTrue();
        assertThat(gate.shouldDefer("安排一下复习，最近找时间", WEEK, List.of(schedule))).isTrue();
    }

    @Test
    void noActionPhraseShouldDeferEvenWithCompleteArguments() {
        RequestedToolCall complete = call("schedule_event", Map.of(
                "summary", "Dentist",
                "start_time", "2026-03-03T10:00:00Z",
                "end_time", "2026-03-03T11:00:00Z"));

        assertThat(gate.shouldDefer("Don't book it yet, what would a dentist slot on Tuesday look like?", WEEK, List.of(complete)))
                .isTrue();
        assertThat(gate.shouldDefer("先别创建，帮我看看周二的安排", WEEK, List.of(complete))).isTrue();
    }

    @Test
    void completeArgumentsShouldProceedDespiteVagueWording() {
        RequestedToolCall complete = call("schedule_event", Map.of(
                "summary", "Gym",
                "start_time", "2026-03-03T18:00:00Z",
                "end_time", "2026-03-03T19:00:00Z"));

        assertThat(gate.shouldDefer("schedule gym sometime soon", null, List.of(complete))).isFalse();
    }

    @Test
    void readOnlyCallsShouldNeverDefer() {
        RequestedToolCall read = call("get_calendar", Map.of());

        assertThat(gate.shouldDefer("don't change anything, schedule nothing, just look sometime", null, List.of(read))).isFalse();
        assertThat(gate.shouldDefer("anything", null, List.of())).isFalse();
    }

    @Test
    void incompleteCallWithoutSchedulingIntentShouldProceed() {
        RequestedToolCall edit = call("edit_event", Map.of("event_id", "E9", "summary", "Renamed"));

        assertThat(gate.shouldDefer("rename E9 to Renamed", null, List.of(edit))).isFalse();
    }

    @Test
    void incompleteSchedulingWithConcreteTimingShouldDeferOnlyWithoutRange() {
        RequestedToolCall schedule = call("schedule_event", Map.of("summary", "Standup"));

        assertThat(gate.shouldDefer("schedule a standup on March 3rd at 9am", WEEK, List.of(schedule))).isFalse();
        assertThat(gate.shouldDefer("schedule a standup on March 3rd at 9am", null, List.of(schedule))).isTrue();
    }

    @Test
    void customPatternsShouldReplaceDefaults() {
        ClarificationPatterns patterns = new ClarificationPatterns(
                List.of(Pattern.compile("dry run")),
                List.of(Pattern.compile("book")),
                List.of(Pattern.compile("whenever")));
        PatternClarificationGate custom = new PatternClarificationGate(patterns);
        RequestedToolCall delete = call("delete_event", Map.of("event_id", "E1"));

        assertThat(custom.shouldDefer("dry run: delete E1", null, List.of(delete))).isTrue();
        assertThat(custom.shouldDefer("don't delete E1", null, List.of(delete))).isFalse();
    }

    private static RequestedToolCall call(String name, Map<String, Object> arguments) {
        return new RequestedToolCall("call_" + name, name, "{}", arguments);
    }
}
