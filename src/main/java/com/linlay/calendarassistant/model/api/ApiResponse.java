package com.linlay.calendarassistant.model.api;

/**
 * Envelope for the non-streaming calendar endpoints. {@code code} is 0 on success and the HTTP
 * status otherwise.
 */
public record ApiResponse<T>(
        int code,
        String msg,
        T data
) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(0, "success", data);
    }

    public static <T> ApiResponse<T> failure(int code, String msg, T data) {
        return new ApiResponse<>(code, msg, data);
    }
}
