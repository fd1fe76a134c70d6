package com.linlay.calendarassistant.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "assistant.llm")
public class AssistantLlmProperties {

    @NotBlank
    private String baseUrl = "https://api.openai.com/v1";
    private String apiKey;
    @NotBlank
    private String model = "gpt-4o-mini";
    private String timeRangeModel;
    private double temperature = 0.2;
    @Min(1)
    private long requestTimeoutMs = 60_000L;
    @Min(1)
    private long timeRangeTimeoutMs = 10_000L;
    @Min(1)
    private int maxToolRounds = 8;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getTimeRangeModel() {
        return timeRangeModel;
    }

    public void setTimeRangeModel(String timeRangeModel) {
        this.timeRangeModel = timeRangeModel;
    }

    /**
     * Model used for range extraction, falling back to the chat model when unset.
     */
    public String resolveTimeRangeModel() {
        return StringUtils.hasText(timeRangeModel) ? timeRangeModel.trim() : model;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public long getTimeRangeTimeoutMs() {
        return timeRangeTimeoutMs;
    }

    public void setTimeRangeTimeoutMs(long timeRangeTimeoutMs) {
        this.timeRangeTimeoutMs = timeRangeTimeoutMs;
    }

    public int getMaxToolRounds() {
        return maxToolRounds;
    }

    public void setMaxToolRounds(int maxToolRounds) {
        this.maxToolRounds = maxToolRounds;
    }
}
