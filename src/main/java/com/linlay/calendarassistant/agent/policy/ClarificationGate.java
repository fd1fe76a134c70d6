package com.linlay.calendarassistant.agent.policy;

import com.linlay.calendarassistant.agent.ExtractedTimeRange;
import com.linlay.calendarassistant.agent.RequestedToolCall;

import java.util.List;

/**
 * Decides whether the mutating calls of a round must wait for the user to confirm details.
 * Implementations are pure: no I/O and no state.
 */
@FunctionalInterface
public interface ClarificationGate {

    /**
     * @param extractedRange the range inferred for this request, {@code null} when none was
     */
    boolean shouldDefer(String question, ExtractedTimeRange extractedRange, List<RequestedToolCall> requestedCalls);
}
