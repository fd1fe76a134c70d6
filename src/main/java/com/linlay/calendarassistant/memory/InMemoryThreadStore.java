package com.linlay.calendarassistant.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link ThreadStore}. Histories are truncated on write, and once more than
 * {@code max-threads} threads exist the least recently written ones are evicted.
 */
@Component
public class InMemoryThreadStore implements ThreadStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryThreadStore.class);

    private final ThreadStoreProperties properties;
    private final Map<String, StoredThread> threads = new ConcurrentHashMap<>();
    private final AtomicLong writeSequence = new AtomicLong();

    public InMemoryThreadStore(ThreadStoreProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<Message> get(String threadId) {
        if (!StringUtils.hasText(threadId)) {
            return List.of();
        }
        StoredThread stored = threads.get(threadId);
        return stored == null ? List.of() : stored.messages();
    }

    @Override
    public void put(String threadId, List<Message> messages) {
        if (!StringUtils.hasText(threadId)) {
            throw new IllegalArgumentException("threadId must not be blank");
        }
        threads.put(threadId, new StoredThread(truncate(messages), writeSequence.incrementAndGet()));
        int maxThreads = Math.max(1, properties.getMaxThreads());
        while (threads.size() > maxThreads) {
            if (evictOldest().isEmpty()) {
                break;
            }
        }
    }

    @Override
    public Optional<String> evictOldest() {
        Optional<String> oldest = threads.entrySet().stream()
                .min(Comparator.comparingLong(entry -> entry.getValue().sequence()))
                .map(Map.Entry::getKey);
        oldest.ifPresent(threadId -> {
            threads.remove(threadId);
            log.debug("Evicted conversation thread {}", threadId);
        });
        return oldest;
    }

    /**
     * Keeps the most recent messages, then drops tool results whose requesting assistant message
     * fell outside the window.
     */
    List<Message> truncate(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        int maxMessages = Math.max(1, properties.getMaxMessages());
        List<Message> window = new ArrayList<>(messages.subList(Math.max(0, messages.size() - maxMessages), messages.size()));
        while (!window.isEmpty() && window.get(0) instanceof ToolResponseMessage) {
            window.remove(0);
        }
        return List.copyOf(window);
    }

    private record StoredThread(List<Message> messages, long sequence) {
    }
}
