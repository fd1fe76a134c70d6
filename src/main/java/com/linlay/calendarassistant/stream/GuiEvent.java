package com.linlay.calendarassistant.stream;

/**
 * Tool progress for the UI. A {@code PENDING} entry is replaced by the later event with the same
 * {@code callId}.
 */
public record GuiEvent(
        String callId,
        String tool,
        Phase phase,
        String label
) {

    public enum Phase {
        PENDING,
        DONE,
        FAILED
    }

    public static GuiEvent pending(String callId, String tool, String label) {
        return new GuiEvent(callId, tool, Phase.PENDING, label);
    }

    public static GuiEvent done(String callId, String tool, String label) {
        return new GuiEvent(callId, tool, Phase.DONE, label);
    }

    public static GuiEvent failed(String callId, String tool, String label) {
        return new GuiEvent(callId, tool, Phase.FAILED, label);
    }
}
