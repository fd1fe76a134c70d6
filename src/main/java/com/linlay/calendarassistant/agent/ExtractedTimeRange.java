package com.linlay.calendarassistant.agent;

import java.time.Instant;
import java.util.Objects;

/**
 * A confidently inferred calendar window. {@code end} is always strictly after {@code start};
 * "no inference" is represented by the absence of a range, never by an empty window.
 */
public record ExtractedTimeRange(Instant start, Instant end) {

    public ExtractedTimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("end must be after start");
        }
    }
}
