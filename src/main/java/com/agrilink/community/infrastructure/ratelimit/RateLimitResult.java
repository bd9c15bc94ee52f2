package com.agrilink.community.infrastructure.ratelimit;

/**
 * Outcome of counting one request against a fixed window.
 *
 * @param allowed whether the request may proceed
 * @param limit requests permitted per window
 * @param remaining requests left in the current window
 * @param retryAfterSeconds seconds until the window resets, zero when allowed
 */
public record RateLimitResult(boolean allowed, int limit, int remaining, long retryAfterSeconds) {

    static RateLimitResult permit(int limit, int remaining) {
        return new RateLimitResult(true, limit, Math.max(remaining, 0), 0L);
    }

    static RateLimitResult deny(int limit, long retryAfterSeconds) {
        return new RateLimitResult(false, limit, 0, retryAfterSeconds);
    }

    public String message() {
        return allowed ? null : "Too many requests. Please retry after " + retryAfterSeconds + " seconds";
    }
}
