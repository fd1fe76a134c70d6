package com.linlay.calendarassistant.agent.runtime;

import com.linlay.calendarassistant.tool.ToolInvocationContext;

/**
 * One user message on one thread, with everything the loop needs to answer it.
 */
public record ConversationTurn(
        String threadId,
        String question,
        String userName,
        ToolInvocationContext toolContext
) {
}
