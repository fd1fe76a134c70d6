package com.linlay.calendarassistant.calendar;

import org.springframework.util.StringUtils;

import java.util.List;

public class CalendarProviderException extends RuntimeException {

    private final int status;
    private final String providerCode;
    private final List<String> reasons;

    public CalendarProviderException(int status, String providerCode, String message, List<String> reasons) {
        super(StringUtils.hasText(message) ? message : "Calendar request failed");
        this.status = status;
        this.providerCode = providerCode;
        this.reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public int status() {
        return status;
    }

    public String providerCode() {
        return providerCode;
    }

    public List<String> reasons() {
        return reasons;
    }

    /**
     * Human-readable form handed back to the model as a tool error.
     */
    public String diagnostic() {
        StringBuilder builder = new StringBuilder("Calendar request failed (status ").append(status);
        if (StringUtils.hasText(providerCode)) {
            builder.append(", code ").append(providerCode);
        }
        builder.append("): ").append(getMessage());
        if (!reasons.isEmpty()) {
            builder.append(". Reasons: ").append(String.join(", ", reasons));
        }
        return builder.toString();
    }
}
