package com.linlay.calendarassistant.agent.policy;

import com.linlay.calendarassistant.agent.ExtractedTimeRange;
import com.linlay.calendarassistant.agent.RequestedToolCall;
import com.linlay.calendarassistant.tool.CalendarToolName;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Regex-driven {@link ClarificationGate}.
 * <ol>
 *     <li>Only mutating calls are ever deferred.</li>
 *     <li>An explicit "do not act yet" phrase always defers.</li>
 *     <li>If every mutating call carries all the fields it needs, nothing is deferred.</li>
 *     <li>Otherwise defer when the question asks to schedule something and its timing is vague
 *     or no range could be extracted.</li>
 * </ol>
 */
@Component
public class PatternClarificationGate implements ClarificationGate {

    private static final Map<CalendarToolName, List<String>> REQUIRED_ARGUMENTS = Map.of(
            CalendarToolName.SCHEDULE_EVENT, List.of("start_time", "end_time", "summary"),
            CalendarToolName.EDIT_EVENT, List.of("event_id", "start_time", "end_time", "summary"),
            CalendarToolName.DELETE_EVENT, List.of("event_id")
    );

    private final ClarificationPatterns patterns;

    @Autowired
    public PatternClarificationGate() {
        this(ClarificationPatterns.defaults());
    }

    public PatternClarificationGate(ClarificationPatterns patterns) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    @Override
    public boolean shouldDefer(String question, ExtractedTimeRange extractedRange, List<RequestedToolCall> requestedCalls) {
        if (requestedCalls == null) {
            return false;
        }
        List<RequestedToolCall> mutating = requestedCalls.stream()
                .filter(Objects::nonNull)
                .filter(call -> CalendarToolName.isMutating(call.name()))
                .toList();
        if (mutating.isEmpty()) {
            return false;
        }
        if (patterns.matchesNoAction(question)) {
            return true;
        }
        if (mutating.stream().allMatch(this::isSufficient)) {
            return false;
        }
        return patterns.matchesSchedulingIntent(question)
                && (patterns.matchesAmbiguousTime(question) || extractedRange == null);
    }

    boolean isSufficient(RequestedToolCall call) {
        List<String> required = CalendarToolName.fromWireName(call.name())
                .map(REQUIRED_ARGUMENTS::get)
                .orElse(List.of());
        return required.stream().allMatch(call::hasArgument);
    }
}
