package com.linlay.calendarassistant.service;

import com.linlay.calendarassistant.agent.runtime.ConversationOrchestrator;
import com.linlay.calendarassistant.agent.runtime.ConversationTurn;
import com.linlay.calendarassistant.calendar.CalendarProvider;
import com.linlay.calendarassistant.calendar.CalendarProviderFactory;
import com.linlay.calendarassistant.memory.ThreadStore;
import com.linlay.calendarassistant.model.api.ThreadSnapshotResponse;
import com.linlay.calendarassistant.security.CalendarSession;
import com.linlay.calendarassistant.stream.ChatChannelSet;
import com.linlay.calendarassistant.tool.ToolInvocationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
public class CalendarChatService {

    private static final Logger log = LoggerFactory.getLogger(CalendarChatService.class);

    private final ConversationOrchestrator orchestrator;
    private final CalendarProviderFactory providerFactory;
    private final ThreadStore threadStore;
    private final Scheduler scheduler;

    @Autowired
    public CalendarChatService(
            ConversationOrchestrator orchestrator,
            CalendarProviderFactory providerFactory,
            ThreadStore threadStore
    ) {
        this(orchestrator, providerFactory, threadStore, Schedulers.boundedElastic());
    }

    CalendarChatService(
            ConversationOrchestrator orchestrator,
            CalendarProviderFactory providerFactory,
            ThreadStore threadStore,
            Scheduler scheduler
    ) {
        this.orchestrator = orchestrator;
        this.providerFactory = providerFactory;
        this.threadStore = threadStore;
        this.scheduler = scheduler;
    }

    /**
     * Starts answering {@code question} in the background and returns at once. Without a session
     * carrying an access token nothing is started.
     */
    public SubmittedMessage submitMessage(String question, String threadId, CalendarSession session) {
        if (session == null || !session.hasAccessToken()) {
            log.info("Rejecting message without calendar session");
            return SubmittedMessage.notAuthenticated();
        }

        String effectiveThreadId = StringUtils.hasText(threadId) ? threadId.trim() : newThreadId();
        ChatChannelSet channels;
        try {
            CalendarProvider provider = providerFactory.forAccessToken(session.accessToken());
            ConversationTurn turn = new ConversationTurn(
                    effectiveThreadId,
                    question,
                    session.userName(),
                    new ToolInvocationContext(provider, session.userEmail())
            );
            channels = ChatChannelSet.open(effectiveThreadId);
            ChatChannelSet started = channels;
            Mono.fromRunnable(() -> orchestrator.run(turn, started))
                    .subscribeOn(scheduler)
                    .subscribe(
                            ignored -> {
                            },
                            ex -> {
                                log.warn("Conversation task failed threadId={}", effectiveThreadId, ex);
                                started.completeAll();
                            }
                    );
        } catch (RuntimeException ex) {
            log.warn("Failed to submit message threadId={}", effectiveThreadId, ex);
            String reason = StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
            return SubmittedMessage.failed(effectiveThreadId, reason);
        }
        log.info("Submitted message threadId={}", effectiveThreadId);
        return SubmittedMessage.started(effectiveThreadId, channels);
    }

    public ThreadSnapshotResponse snapshot(String threadId) {
        List<Message> messages = threadStore.get(threadId);
        if (messages.isEmpty()) {
            throw new ThreadNotFoundException(threadId);
        }
        List<ThreadSnapshotResponse.Entry> entries = new ArrayList<>();
        for (Message message : messages) {
            String role = message.getMessageType().getValue().toLowerCase(Locale.ROOT);
            if (message instanceof ToolResponseMessage toolResponse) {
                for (ToolResponseMessage.ToolResponse response : toolResponse.getResponses()) {
                    entries.add(new ThreadSnapshotResponse.Entry(role, response.responseData(), null, response.id()));
                }
            } else if (message instanceof AssistantMessage assistant && assistant.hasToolCalls()) {
                List<ThreadSnapshotResponse.ToolCallView> calls = assistant.getToolCalls().stream()
                        .map(call -> new ThreadSnapshotResponse.ToolCallView(call.id(), call.name(), call.arguments()))
                        .toList();
                entries.add(new ThreadSnapshotResponse.Entry(role, assistant.getText(), calls, null));
            } else {
                entries.add(new ThreadSnapshotResponse.Entry(role, message.getText(), null, null));
            }
        }
        return new ThreadSnapshotResponse(threadId, List.copyOf(entries));
    }

    private String newThreadId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
