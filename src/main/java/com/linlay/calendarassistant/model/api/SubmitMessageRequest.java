package com.linlay.calendarassistant.model.api;

import jakarta.validation.constraints.NotBlank;

public record SubmitMessageRequest(
        @NotBlank String question,
        String threadId
) {
}
