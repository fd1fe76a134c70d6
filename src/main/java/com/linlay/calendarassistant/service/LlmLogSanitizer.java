package com.linlay.calendarassistant.service;

import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Masks credentials before request headers or payload text reach the log.
 * <p>
 * Covers the model api key, the caller's calendar access token and any bearer token
 * embedded in free text. Stateless.
 */
public final class LlmLogSanitizer {

    private static final Pattern JSON_SECRET_VALUE_PATTERN = Pattern.compile(
            "(?i)(\"(?:authorization|api[_-]?key|(?:calendar[_-]?)?access[_-]?token|refresh[_-]?token|token|secret|password)\"\\s*:\\s*)\"([^\"]*)\""
    );
    private static final Pattern BEARER_TOKEN_PATTERN = Pattern.compile("(?i)(Bearer\\s+)[A-Za-z0-9._\\-+/=]+");
    private static final List<String> SECRET_HEADERS = List.of(
            HttpHeaders.AUTHORIZATION,
            "X-API-Key",
            "Api-Key",
            "X-Calendar-Access-Token"
    );

    private LlmLogSanitizer() {
    }

    public static HttpHeaders maskHeaders(HttpHeaders headers, boolean maskSensitive) {
        HttpHeaders safeHeaders = new HttpHeaders();
        if (headers == null) {
            return safeHeaders;
        }
        safeHeaders.putAll(headers);
        if (!maskSensitive) {
            return safeHeaders;
        }
        for (String key : SECRET_HEADERS) {
            if (safeHeaders.containsKey(key)) {
                safeHeaders.set(key, "***");
            }
        }
        return safeHeaders;
    }

    public static String maskText(String text, boolean maskSensitive) {
        if (text == null || text.isEmpty() || !maskSensitive) {
            return text == null ? "" : text;
        }
        String masked = JSON_SECRET_VALUE_PATTERN.matcher(text).replaceAll("$1\"***\"");
        return BEARER_TOKEN_PATTERN.matcher(masked).replaceAll("$1***");
    }

    /**
     * Cuts {@code text} to {@code maxChars}, noting how much was dropped.
     */
    public static String truncate(String text, int maxChars) {
        if (text == null || maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "...(" + (text.length() - maxChars) + " more chars)";
    }
}
