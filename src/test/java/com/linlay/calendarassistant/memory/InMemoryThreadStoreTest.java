package com.linlay.calendarassistant.memory;

import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryThreadStoreTest {

    @Test
    void shouldKeepOnlyMostRecentThirtyMessages() {
        InMemoryThreadStore store = new InMemoryThreadStore(new ThreadStoreProperties());
        List<Message> messages = new ArrayList<>();
        for (int i = 0; i < 45; i++) {
            messages.add(i % 2 == 0 ? new UserMessage("q" + i) : new AssistantMessage("a" + i));
        }

        store.put("t1", messages);

        List<Message> stored = store.get("t1");
        assertThat(stored).hasSize(30);
        assertThat(stored.get(0).getText()).isEqualTo("a15");
        assertThat(stored.get(29).getText()).isEqualTo("q44");
    }

    @Test
    void shouldDropOrphanedToolResultsAtWindowStart() {
        ThreadStoreProperties properties = new ThreadStoreProperties();
        properties.setMaxMessages(3);
        InMemoryThreadStore store = new InMemoryThreadStore(properties);
        List<Message> messages = List.of(
                new UserMessage("delete E1"),
                new AssistantMessage("", Map.of(), List.of(
                        new AssistantMessage.ToolCall("call_1", "function", "delete_event", "{\"event_id\":\"E1\"}"))),
                new ToolResponseMessage(List.of(new ToolResponseMessage.ToolResponse("call_1", "delete_event", "{}"))),
                new AssistantMessage("Deleted."),
                new UserMessage("thanks"));

        store.put("t1", messages);

        assertThat(store.get("t1")).extracting(Message::getText).containsExactly("Deleted.", "thanks");
    }

    @Test
    void storedHistoryShouldBeImmutableSnapshot() {
        InMemoryThreadStore store = new InMemoryThreadStore(new ThreadStoreProperties());
        List<Message> messages = new ArrayList<>(List.of(new UserMessage("hi")));

        store.put("t1", messages);
        messages.add(new AssistantMessage("later"));

        assertThat(store.get("t1")).hasSize(1);
        assertThatThrownBy(() -> store.get("t1").add(new UserMessage("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void unknownOrBlankThreadShouldBeEmpty() {
        InMemoryThreadStore store = new InMemoryThreadStore(new ThreadStoreProperties());

        assertThat(store.get("missing")).isEmpty();
        assertThat(store.get(" ")).isEmpty();
        assertThatThrownBy(() -> store.put(" ", List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldEvictLeastRecentlyWrittenThreads() {
        ThreadStoreProperties properties = new ThreadStoreProperties();
        properties.setMaxThreads(2);
        InMemoryThreadStore store = new InMemoryThreadStore(properties);

        store.put("t1", List.of(new UserMessage("1")));
        store.put("t2", List.of(new UserMessage("2")));
        store.put("t1", List.of(new UserMessage("1b")));
        store.put("t3", List.of(new UserMessage("3")));

        assertThat(store.get("t2")).isEmpty();
        assertThat(store.get("t1")).extracting(Message::getText).containsExactly("1b");
        assertThat(store.evictOldest()).contains("t1");
        assertThat(store.evictOldest()).contains("t3");
        assertThat(store.evictOldest()).isEmpty();
    }
}
