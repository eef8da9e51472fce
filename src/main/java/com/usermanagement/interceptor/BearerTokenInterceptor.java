package com.usermanagement.interceptor;

import com.usermanagement.exception.UnauthorizedException;
import com.usermanagement.security.TokenValidator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Bearer token interceptor
 * Rejects requests whose Authorization header does not carry an accepted token.
 * A header without the "Bearer " scheme is taken as the raw token.
 */
@Component
@Slf4j
public class BearerTokenInterceptor implements HandlerInterceptor {

    private static final String BEARER_PREFIX = "Bearer ";

    @Autowired
    private TokenValidator tokenValidator;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null) {
            throw new UnauthorizedException("Missing Authorization header for " + request.getRequestURI());
        }

        String token = extractToken(header);
        if (!tokenValidator.isValid(token)) {
            throw new UnauthorizedException("Invalid token for " + request.getRequestURI());
        }

        log.debug("Authenticated request: {} {}", request.getMethod(), request.getRequestURI());
        return true;
    }

    static String extractToken(String header) {
        if (header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return header.substring(BEARER_PREFIX.length()).trim();
        }
        return header.trim();
    }
}
