package com.linlay.calendarassistant.agent.policy;

public final class ClarificationPrompt {

    public static final String TEXT = """
            Before I make changes to your calendar, could you confirm a few details?
            1. Which date range should I look at?
            2. How often should this happen, and how long should each session be?
            3. What time of day do you prefer?
            4. Should I avoid conflicts with your existing events?
            5. How long before each event would you like a reminder?""";

    private ClarificationPrompt() {
    }
}
