package com.walkerbrain.portal.global.security;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * Locates the session token on a request: the bearer header first, then the {@code _session}
 * query parameter the dashboard keeps in its URL across refreshes.
 */
public final class SessionTokenResolver {

    public static final String SESSION_QUERY_PARAM = "_session";
    private static final String BEARER_PREFIX = "Bearer ";

    private SessionTokenResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (StringUtils.hasText(token)) {
                return token;
            }
        }
        String param = request.getParameter(SESSION_QUERY_PARAM);
        return StringUtils.hasText(param) ? param.trim() : null;
    }

    /**
     * Log-safe rendering of a token. Tokens travel in URLs, so the raw value must never reach a log line.
     */
    public static String mask(String token) {
        if (token == null) {
            return "<none>";
        }
        if (token.length() <= 4) {
            return "****(" + token.length() + ")";
        }
        return token.substring(0, 4) + "****(" + token.length() + ")";
    }
}
