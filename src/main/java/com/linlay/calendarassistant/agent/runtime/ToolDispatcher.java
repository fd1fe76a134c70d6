package com.linlay.calendarassistant.agent.runtime;

import com.linlay.calendarassistant.agent.RequestedToolCall;
import com.linlay.calendarassistant.agent.ToolArgumentCodec;
import com.linlay.calendarassistant.calendar.CalendarProviderException;
import com.linlay.calendarassistant.stream.GuiEvent;
import com.linlay.calendarassistant.tool.CalendarTool;
import com.linlay.calendarassistant.tool.CalendarToolName;
import com.linlay.calendarassistant.tool.ToolInvocationContext;
import com.linlay.calendarassistant.tool.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Runs one requested tool call and folds every outcome into a {@link ToolExecutionResult}.
 * The returned Mono never errors: provider failures, bad arguments and unknown tool names all
 * become non-mutating error results so the rest of the round can go on.
 */
@Component
public class ToolDispatcher {

    static final String UNSUPPORTED_PREFIX = "Unsupported tool: ";
    static final String FAILED_LABEL = "Error on taking this action";

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolRegistry toolRegistry;
    private final ToolArgumentCodec argumentCodec;

    public ToolDispatcher(ToolRegistry toolRegistry, ToolArgumentCodec argumentCodec) {
        this.toolRegistry = toolRegistry;
        this.argumentCodec = argumentCodec;
    }

    public Mono<ToolExecutionResult> execute(
            RequestedToolCall call,
            ToolInvocationContext context,
            Consumer<GuiEvent> guiSink
    ) {
        Consumer<GuiEvent> gui = guiSink == null ? event -> { } : guiSink;
        String toolName = call.name();
        Optional<CalendarToolName> known = CalendarToolName.fromWireName(toolName);
        gui.accept(GuiEvent.pending(call.id(), toolName,
                known.map(CalendarToolName::pendingLabel).orElse(CalendarToolName.UNKNOWN_PENDING_LABEL)));

        Optional<CalendarTool> tool = toolRegistry.find(toolName);
        if (tool.isEmpty()) {
            log.warn("Model requested unsupported tool '{}' (call {})", toolName, call.id());
            gui.accept(GuiEvent.failed(call.id(), toolName, UNSUPPORTED_PREFIX + toolName));
            return Mono.just(ToolExecutionResult.failure(argumentCodec.error(UNSUPPORTED_PREFIX + toolName)));
        }

        CalendarToolName name = tool.get().name();
        return Mono.defer(() -> tool.get().invoke(call, context))
                .map(data -> {
                    gui.accept(GuiEvent.done(call.id(), toolName, name.doneLabel()));
                    return ToolExecutionResult.success(argumentCodec.data(data), name.mutating());
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    gui.accept(GuiEvent.done(call.id(), toolName, name.doneLabel()));
                    return ToolExecutionResult.success(argumentCodec.data(null), name.mutating());
                }))
                .onErrorResume(ex -> {
                    String diagnostic = describe(ex);
                    log.warn("Tool {} (call {}) failed: {}", toolName, call.id(), diagnostic);
                    gui.accept(GuiEvent.failed(call.id(), toolName, FAILED_LABEL));
                    return Mono.just(ToolExecutionResult.failure(argumentCodec.error(diagnostic)));
                });
    }

    String describe(Throwable ex) {
        if (ex instanceof CalendarProviderException providerException) {
            return providerException.diagnostic();
        }
        return StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : "Tool execution failed";
    }
}
