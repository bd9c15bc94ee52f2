package com.agrilink.community.infrastructure.ratelimit;

import com.agrilink.community.api.dto.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Counts credential requests per client address and answers 429 once the window is used up.
 * Every response carries X-RateLimit-Limit and X-RateLimit-Remaining.
 *
 * @author AgriLink Team
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitInterceptor.class);

    static final String SCOPE = "auth";

    private final RateLimitService rateLimitService;
    private final ObjectMapper objectMapper;

    public RateLimitInterceptor(RateLimitService rateLimitService, ObjectMapper objectMapper) {
        this.rateLimitService = rateLimitService;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        String client = clientAddress(request);
        RateLimitResult result = rateLimitService.checkRateLimit(SCOPE, client);

        response.setHeader("X-RateLimit-Limit", Integer.toString(result.limit()));
        response.setHeader("X-RateLimit-Remaining", Integer.toString(result.remaining()));
        if (result.allowed()) {
            return true;
        }

        logger.warn("Throttled {} {} for client {}", request.getMethod(), request.getRequestURI(), client);

        HttpStatus status = HttpStatus.TOO_MANY_REQUESTS;
        ErrorResponse body = new ErrorResponse(
                status.value(), status.getReasonPhrase(), result.message(), request.getRequestURI())
                .addDetail("retry_after", result.retryAfterSeconds());

        response.setStatus(status.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(result.retryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
        return false;
    }

    /**
     * Client address the window is counted against. Forwarding headers are client-controlled and
     * are only honoured through server.forward-headers-strategy, which rewrites the remote address.
     */
    static String clientAddress(HttpServletRequest request) {
        return request.getRemoteAddr();
    }
}
