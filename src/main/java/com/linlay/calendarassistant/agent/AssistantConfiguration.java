package com.linlay.calendarassistant.agent;

import com.linlay.calendarassistant.service.LlmService;

import java.util.List;

/**
 * Instruction text plus the ordered tool schemas offered to the model. Shared by all requests.
 */
public record AssistantConfiguration(
        String instructions,
        List<LlmService.LlmFunctionTool> tools
) {
    public AssistantConfiguration {
        instructions = instructions == null ? "" : instructions;
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
