package com.linlay.calendarassistant.service;

import com.linlay.calendarassistant.stream.ChatChannelSet;
import com.linlay.calendarassistant.stream.GuiEvent;

/**
 * Immediate answer to a submitted message. When {@code channels} is present the conversation is
 * running in the background and everything else arrives through it; otherwise {@code status}
 * and {@code text} are the whole result.
 */
public record SubmittedMessage(
        String threadId,
        String status,
        String text,
        GuiEvent gui,
        ChatChannelSet channels
) {

    public static final String NOT_AUTHENTICATED = "Not authenticated";
    public static final String SUBMIT_FAILED = "Failed to submit message";

    public static SubmittedMessage started(String threadId, ChatChannelSet channels) {
        return new SubmittedMessage(threadId, ChatChannelSet.STATUS_INIT, "", null, channels);
    }

    public static SubmittedMessage notAuthenticated() {
        return new SubmittedMessage(null, "", NOT_AUTHENTICATED, null, null);
    }

    public static SubmittedMessage failed(String threadId, String reason) {
        return new SubmittedMessage(threadId, SUBMIT_FAILED, reason, null, null);
    }

    public boolean accepted() {
        return channels != null;
    }
}
