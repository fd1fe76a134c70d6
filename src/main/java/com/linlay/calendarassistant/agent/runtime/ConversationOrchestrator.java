package com.linlay.calendarassistant.agent.runtime;

import com.linlay.calendarassistant.agent.AssistantConfiguration;
import com.linlay.calendarassistant.agent.AssistantConfigurationCache;
import com.linlay.calendarassistant.agent.ExtractedTimeRange;
import com.linlay.calendarassistant.agent.RequestedToolCall;
import com.linlay.calendarassistant.agent.TimeRangeExtractor;
import com.linlay.calendarassistant.agent.policy.ClarificationGate;
import com.linlay.calendarassistant.agent.policy.ClarificationPrompt;
import com.linlay.calendarassistant.config.AssistantLlmProperties;
import com.linlay.calendarassistant.memory.ThreadStore;
import com.linlay.calendarassistant.service.AssistantReply;
import com.linlay.calendarassistant.service.LlmCallSpec;
import com.linlay.calendarassistant.service.LlmReply;
import com.linlay.calendarassistant.service.LlmService;
import com.linlay.calendarassistant.stream.ChatChannelSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The per-request state machine:
 * {@code init -> extract_range -> model_round_1..N -> final | clarification | round_limit | error}.
 * <p>
 * Blocking: {@link #run} is meant for a worker thread and waits on every model and calendar
 * call. Whatever happens, all channels are completed before it returns.
 */
@Component
public class ConversationOrchestrator {

    public static final String STATUS_EXTRACT_RANGE = "conversation.extract_range";
    public static final String STATUS_ROUND_PREFIX = "conversation.model_round_";
    public static final String STATUS_CLARIFICATION = "conversation.clarification";
    public static final String STATUS_ROUND_LIMIT = "conversation.round_limit";
    public static final String STATUS_ERROR = "conversation.error";

    public static final String NO_RESPONSE_TEXT = "No response from model.";
    public static final String ROUND_LIMIT_TEXT =
            "I couldn't finish this request within the allowed number of steps. Please try rephrasing or narrowing it down.";
    public static final String ERROR_TEXT = "Error: Failed to process the request.";

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final LlmService llmService;
    private final TimeRangeExtractor timeRangeExtractor;
    private final AssistantConfigurationCache configurationCache;
    private final ClarificationGate clarificationGate;
    private final ToolDispatcher toolDispatcher;
    private final ThreadStore threadStore;
    private final AssistantLlmProperties properties;

    public ConversationOrchestrator(
            LlmService llmService,
            TimeRangeExtractor timeRangeExtractor,
            AssistantConfigurationCache configurationCache,
            ClarificationGate clarificationGate,
            ToolDispatcher toolDispatcher,
            ThreadStore threadStore,
            AssistantLlmProperties properties
    ) {
        this.llmService = llmService;
        this.timeRangeExtractor = timeRangeExtractor;
        this.configurationCache = configurationCache;
        this.clarificationGate = clarificationGate;
        this.toolDispatcher = toolDispatcher;
        this.threadStore = threadStore;
        this.properties = properties;
    }

    public void run(ConversationTurn turn, ChatChannelSet channels) {
        try {
            channels.status(STATUS_EXTRACT_RANGE);
            ExtractedTimeRange range = timeRangeExtractor.extract(turn.question(), Instant.now()).block();
            channels.extractedRange(range);

            AssistantConfiguration configuration = configurationCache.load().block();
            if (configuration == null) {
                throw new IllegalStateException("Assistant configuration is unavailable");
            }

            List<Message> history = new ArrayList<>(threadStore.get(turn.threadId()));
            history.add(new UserMessage(turn.question()));
            runRounds(turn, range, configuration, history, channels);
            threadStore.put(turn.threadId(), history);
        } catch (Exception ex) {
            log.warn("Conversation on thread {} failed", turn.threadId(), ex);
            channels.status(STATUS_ERROR);
            channels.appendText(ERROR_TEXT);
        } finally {
            channels.completeAll();
        }
    }

    private void runRounds(
            ConversationTurn turn,
            ExtractedTimeRange range,
            AssistantConfiguration configuration,
            List<Message> history,
            ChatChannelSet channels
    ) {
        int maxRounds = Math.max(1, properties.getMaxToolRounds());
        int mutationCount = 0;

        for (int round = 1; round <= maxRounds; round++) {
            channels.status(STATUS_ROUND_PREFIX + round);
            LlmReply reply = llmService.complete(roundSpec(turn, configuration, history, round)).block();
            AssistantReply message = reply == null ? null : reply.message();
            if (message == null) {
                channels.appendText(NO_RESPONSE_TEXT);
                return;
            }

            log.info("[calendar-ai] tool-dispatch round={}, toolCalls={}, legacyFunctionCall={}",
                    round,
                    message.legacyFunctionCall() ? List.of() : toolNames(message.toolCalls()),
                    message.legacyFunctionCall() ? message.toolCalls().get(0).name() : null);

            if (!message.hasToolCalls()) {
                String content = StringUtils.hasText(message.content()) ? message.content() : NO_RESPONSE_TEXT;
                channels.appendText(content);
                history.add(new AssistantMessage(content));
                return;
            }

            if (clarificationGate.shouldDefer(turn.question(), range, message.toolCalls())) {
                // the requested calls are dropped unanswered and never enter history
                channels.status(STATUS_CLARIFICATION);
                channels.appendText(ClarificationPrompt.TEXT);
                history.add(new AssistantMessage(ClarificationPrompt.TEXT));
                return;
            }

            history.add(toAssistantMessage(message));
            for (RequestedToolCall call : message.toolCalls()) {
                ToolExecutionResult result = toolDispatcher.execute(call, turn.toolContext(), channels::gui).block();
                if (result == null) {
                    result = ToolExecutionResult.failure("{\"error\":\"Tool execution failed\"}");
                }
                history.add(new ToolResponseMessage(List.of(
                        new ToolResponseMessage.ToolResponse(call.id(), call.name(), result.output())
                )));
                if (result.didMutate()) {
                    mutationCount++;
                    channels.mutationCount(mutationCount);
                }
            }
        }

        log.info("Thread {} reached the round limit of {}", turn.threadId(), maxRounds);
        channels.status(STATUS_ROUND_LIMIT);
        channels.appendText(ROUND_LIMIT_TEXT);
        history.add(new AssistantMessage(ROUND_LIMIT_TEXT));
    }

    private LlmCallSpec roundSpec(
            ConversationTurn turn,
            AssistantConfiguration configuration,
            List<Message> history,
            int round
    ) {
        return new LlmCallSpec(
                properties.getModel(),
                properties.getTemperature(),
                systemPrompt(configuration, turn),
                history,
                configuration.tools(),
                false,
                properties.getRequestTimeoutMs(),
                "conversation-round-" + round
        );
    }

    String systemPrompt(AssistantConfiguration configuration, ConversationTurn turn) {
        return configuration.instructions()
                + "\n<current_time>" + Instant.now() + "</current_time>"
                + "<current_user>" + (turn.userName() == null ? "" : turn.userName()) + "</current_user>";
    }

    /**
     * Legacy single function calls are recorded in the modern shape, keyed by their synthesized id.
     */
    private AssistantMessage toAssistantMessage(AssistantReply message) {
        List<AssistantMessage.ToolCall> toolCalls = message.toolCalls().stream()
                .map(call -> new AssistantMessage.ToolCall(call.id(), "function", call.name(), call.rawArguments()))
                .toList();
        return new AssistantMessage(message.content() == null ? "" : message.content(), Map.of(), toolCalls);
    }

    private List<String> toolNames(List<RequestedToolCall> calls) {
        return calls.stream().map(RequestedToolCall::name).toList();
    }
}
