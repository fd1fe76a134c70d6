package com.linlay.calendarassistant.controller;

import com.linlay.calendarassistant.model.api.ApiResponse;
import com.linlay.calendarassistant.model.api.SubmitMessageRequest;
import com.linlay.calendarassistant.model.api.ThreadSnapshotResponse;
import com.linlay.calendarassistant.security.CalendarSession;
import com.linlay.calendarassistant.security.SessionWebFilter;
import com.linlay.calendarassistant.service.CalendarChatService;
import com.linlay.calendarassistant.service.SubmittedMessage;
import com.linlay.calendarassistant.stream.ChannelSseWriter;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/calendar")
public class CalendarChatController {

    private final CalendarChatService chatService;
    private final ChannelSseWriter sseWriter;

    public CalendarChatController(CalendarChatService chatService, ChannelSseWriter sseWriter) {
        this.chatService = chatService;
        this.sseWriter = sseWriter;
    }

    @PostMapping(value = "/messages", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<Void> submit(
            @Valid @RequestBody SubmitMessageRequest request,
            ServerHttpResponse response,
            ServerWebExchange exchange
    ) {
        CalendarSession session = SessionWebFilter.currentSession(exchange);
        SubmittedMessage submitted = chatService.submitMessage(request.question(), request.threadId(), session);
        if (!submitted.accepted()) {
            return sseWriter.write(response, sseWriter.singleMessage(summary(submitted)));
        }
        return sseWriter.write(response, sseWriter.channelEvents(submitted.channels(), submitted.threadId()));
    }

    @GetMapping("/threads/{threadId}")
    public ApiResponse<ThreadSnapshotResponse> thread(@PathVariable String threadId) {
        return ApiResponse.success(chatService.snapshot(threadId));
    }

    // gui stays in the body even when null
    private Map<String, Object> summary(SubmittedMessage submitted) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", submitted.status());
        body.put("text", submitted.text());
        body.put("gui", submitted.gui());
        return body;
    }
}
