package com.linlay.calendarassistant.agent.runtime;

/**
 * @param output    JSON text handed back to the model, {@code {"data":...}} or {@code {"error":"..."}}
 * @param didMutate whether calendar state changed; counted, never used for control flow
 */
public record ToolExecutionResult(String output, boolean didMutate) {

    public static ToolExecutionResult success(String output, boolean didMutate) {
        return new ToolExecutionResult(output, didMutate);
    }

    public static ToolExecutionResult failure(String output) {
        return new ToolExecutionResult(output, false);
    }
}
