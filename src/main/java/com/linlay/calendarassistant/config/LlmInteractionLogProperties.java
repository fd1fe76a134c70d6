package com.linlay.calendarassistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Logging of model and calendar traffic. Transcript text longer than {@code maxLoggedChars}
 * is cut before it is written; zero or less disables the cut.
 */
@ConfigurationProperties(prefix = "assistant.llm.interaction-log")
public class LlmInteractionLogProperties {

    private boolean enabled = true;
    private boolean maskSensitive = true;
    private int maxLoggedChars = 4000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isMaskSensitive() {
        return maskSensitive;
    }

    public void setMaskSensitive(boolean maskSensitive) {
        this.maskSensitive = maskSensitive;
    }

    public int getMaxLoggedChars() {
        return maxLoggedChars;
    }

    public void setMaxLoggedChars(int maxLoggedChars) {
        this.maxLoggedChars = maxLoggedChars;
    }
}
