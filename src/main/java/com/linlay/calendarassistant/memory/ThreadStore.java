package com.linlay.calendarassistant.memory;

import org.springframework.ai.chat.messages.Message;

import java.util.List;
import java.util.Optional;

/**
 * Conversation history by thread id.
 * <p>
 * Callers read a whole history, extend it and write it back. There is no per-thread locking:
 * two concurrent requests on the same thread race and the last write wins.
 */
public interface ThreadStore {

    /**
     * Stored history in transcript order, empty for an unknown thread.
     */
    List<Message> get(String threadId);

    /**
     * Replaces the thread's history with at most the most recent {@code max-messages} entries.
     */
    void put(String threadId, List<Message> messages);

    /**
     * Drops the least recently written thread.
     *
     * @return the evicted thread id, empty when the store is empty
     */
    Optional<String> evictOldest();
}
