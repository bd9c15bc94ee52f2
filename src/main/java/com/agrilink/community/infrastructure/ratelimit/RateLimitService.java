package com.agrilink.community.infrastructure.ratelimit;

import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Fixed-window rate limiter backed by Redis.
 *
 * Cache Keys:
 * - rate_limit:{scope}:{client}:{window} -> request count in the current window
 *
 * @author AgriLink Team
 */
@Service
public class RateLimitService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitService.class);

    private static final String KEY_PREFIX = "rate_limit:";

    private final RedisTemplate<String, String> redisTemplate;
    private final CloudWatchMetricsService metricsService;
    private final int maxRequests;
    private final long windowSeconds;

    public RateLimitService(
            RedisTemplate<String, String> redisTemplate,
            CloudWatchMetricsService metricsService,
            @Value("${agrilink.rate-limiting.max-requests:10}") int maxRequests,
            @Value("${agrilink.rate-limiting.window-seconds:60}") long windowSeconds
    ) {
        this.redisTemplate = redisTemplate;
        this.metricsService = metricsService;
        this.maxRequests = maxRequests;
        this.windowSeconds = windowSeconds;
    }

    /**
     * Count a request against the client's current window.
     *
     * @param scope Endpoint group (e.g. "auth")
     * @param clientId Client identifier, usually the IP address
     * @return Allow/reject decision
     */
    public RateLimitResult checkRateLimit(String scope, String clientId) {
        long nowSeconds = System.currentTimeMillis() / 1000;
        long window = nowSeconds / windowSeconds;
        String key = KEY_PREFIX + scope + ":" + clientId + ":" + window;

        try {
            Long count = redisTemplate.opsForValue().increment(key);
            if (count != null && count == 1L) {
                redisTemplate.expire(key, Duration.ofSeconds(windowSeconds));
            }

            if (count == null || count <= maxRequests) {
                int remaining = count == null ? maxRequests : (int) (maxRequests - count);
                logger.debug("Rate limit check passed for {} on {}, remaining: {}", clientId, scope, remaining);
                return RateLimitResult.permit(maxRequests, remaining);
            }

            long retryAfter = (window + 1) * windowSeconds - nowSeconds;
            logger.warn("Rate limit exceeded for {} on {}", clientId, scope);
            metricsService.recordRateLimitRejection(scope);
            return RateLimitResult.deny(maxRequests, retryAfter);

        } catch (Exception e) {
            logger.error("Error checking rate limit for {}, defaulting to ALLOW", clientId, e);
            metricsService.recordError("RATE_LIMIT_CHECK_ERROR", "checkRateLimit");
            return RateLimitResult.permit(maxRequests, maxRequests);
        }
    }
}
