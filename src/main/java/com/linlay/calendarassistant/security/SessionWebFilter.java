package com.linlay.calendarassistant.security;

import com.linlay.calendarassistant.config.SessionAuthProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Resolves the caller's {@link CalendarSession} for {@code /api/calendar/**} and stores it as an
 * exchange attribute. Requests are never rejected here: a missing session is answered by the
 * chat flow itself with "Not authenticated".
 */
@Component
public class SessionWebFilter implements WebFilter {

    public static final String SESSION_ATTR = "CALENDAR_SESSION";
    public static final String ACCESS_TOKEN_HEADER = "X-Calendar-Access-Token";
    public static final String USER_NAME_HEADER = "X-User-Name";
    public static final String USER_EMAIL_HEADER = "X-User-Email";

    private static final String AUTH_PREFIX = "Bearer ";

    private final SessionAuthProperties authProperties;
    private final JwksJwtVerifier jwtVerifier;

    public SessionWebFilter(SessionAuthProperties authProperties, JwksJwtVerifier jwtVerifier) {
        this.authProperties = authProperties;
        this.jwtVerifier = jwtVerifier;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!StringUtils.hasText(path) || !path.startsWith("/api/calendar/")) {
            return chain.filter(exchange);
        }

        CalendarSession session = authProperties.isEnabled()
                ? jwtVerifier.verify(resolveBearerToken(exchange)).orElse(null)
                : resolveHeaderSession(exchange);
        if (session != null) {
            exchange.getAttributes().put(SESSION_ATTR, session);
        }
        return chain.filter(exchange);
    }

    public static CalendarSession currentSession(ServerWebExchange exchange) {
        Object session = exchange.getAttribute(SESSION_ATTR);
        return session instanceof CalendarSession calendarSession ? calendarSession : null;
    }

    private CalendarSession resolveHeaderSession(ServerWebExchange exchange) {
        HttpHeaders headers = exchange.getRequest().getHeaders();
        String accessToken = headers.getFirst(ACCESS_TOKEN_HEADER);
        if (!StringUtils.hasText(accessToken)) {
            return null;
        }
        return new CalendarSession(accessToken.trim(), headers.getFirst(USER_NAME_HEADER), headers.getFirst(USER_EMAIL_HEADER));
    }

    private String resolveBearerToken(ServerWebExchange exchange) {
        String authorization = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authorization) || !authorization.startsWith(AUTH_PREFIX)) {
            return null;
        }
        String token = authorization.substring(AUTH_PREFIX.length()).trim();
        return StringUtils.hasText(token) ? token : null;
    }
}
