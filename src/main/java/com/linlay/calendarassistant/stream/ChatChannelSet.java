package com.linlay.calendarassistant.stream;

import com.linlay.calendarassistant.agent.ExtractedTimeRange;

import java.util.List;

/**
 * The six per-request output streams. {@link #completeAll()} is the single finalization step and
 * may be called from any exit path, any number of times.
 */
public final class ChatChannelSet {

    public static final String STATUS_INIT = "conversation.init";

    private final StreamChannel<String> status = new StreamChannel<>("status");
    private final StreamChannel<String> text = new StreamChannel<>("text");
    private final StreamChannel<GuiEvent> gui = new StreamChannel<>("gui");
    private final StreamChannel<String> threadId = new StreamChannel<>("thread-id");
    private final StreamChannel<Integer> mutationCount = new StreamChannel<>("mutation-count");
    private final StreamChannel<RangeUpdate> extractedRange = new StreamChannel<>("extracted-range");

    private ChatChannelSet() {
    }

    public static ChatChannelSet open(String threadId) {
        ChatChannelSet channels = new ChatChannelSet();
        channels.status.emit(STATUS_INIT);
        channels.text.emit("");
        channels.threadId.emit(threadId);
        channels.mutationCount.emit(0);
        channels.extractedRange.emit(RangeUpdate.none());
        return channels;
    }

    public void status(String label) {
        status.emit(label);
    }

    public void appendText(String chunk) {
        text.emit(chunk);
    }

    public void gui(GuiEvent event) {
        gui.emit(event);
    }

    public void mutationCount(int count) {
        mutationCount.emit(count);
    }

    public void extractedRange(ExtractedTimeRange range) {
        extractedRange.emit(new RangeUpdate(range));
    }

    public void completeAll() {
        for (StreamChannel<?> channel : channels()) {
            channel.complete();
        }
    }

    public boolean isCompleted() {
        return channels().stream().allMatch(StreamChannel::isCompleted);
    }

    public StreamChannel<String> statusChannel() {
        return status;
    }

    public StreamChannel<String> textChannel() {
        return text;
    }

    public StreamChannel<GuiEvent> guiChannel() {
        return gui;
    }

    public StreamChannel<String> threadIdChannel() {
        return threadId;
    }

    public StreamChannel<Integer> mutationCountChannel() {
        return mutationCount;
    }

    public StreamChannel<RangeUpdate> extractedRangeChannel() {
        return extractedRange;
    }

    public List<StreamChannel<?>> channels() {
        return List.of(status, text, gui, threadId, mutationCount, extractedRange);
    }
}
