package com.linlay.calendarassistant.stream;

import com.linlay.calendarassistant.agent.ExtractedTimeRange;

/**
 * Carries a possibly absent range through a channel, since Reactor signals cannot be null.
 */
public record RangeUpdate(ExtractedTimeRange range) {

    public static RangeUpdate none() {
        return new RangeUpdate(null);
    }
}
