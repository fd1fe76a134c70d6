package com.linlay.calendarassistant.model.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

public record ThreadSnapshotResponse(
        String threadId,
        List<Entry> messages
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(
            String role,
            String text,
            List<ToolCallView> toolCalls,
            String toolCallId
    ) {
    }

    public record ToolCallView(
            String id,
            String name,
            String arguments
    ) {
    }
}
