package com.agrilink.community.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics service for monitoring and observability.
 * Publishes custom metrics via Micrometer; the registry is CloudWatch when enabled.
 *
 * Key Metrics:
 * - Order creations, failures and status changes
 * - Consultation transitions
 * - Likes, uploads and logins
 * - Error rates
 *
 * @author AgriLink Team
 */
@Service
public class CloudWatchMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "agrilink.";
    private static final String ORDER_PREFIX = METRIC_PREFIX + "order.";
    private static final String CONSULTATION_PREFIX = METRIC_PREFIX + "consultation.";
    private static final String AUTH_PREFIX = METRIC_PREFIX + "auth.";

    public CloudWatchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record successful order creation.
     *
     * @param itemCount Number of order lines
     * @param durationMs Time spent placing the order
     */
    public void recordOrderCreated(int itemCount, long durationMs) {
        Counter.builder(ORDER_PREFIX + "created")
                .description("Orders placed")
                .register(meterRegistry)
                .increment();
        DistributionSummary.builder(ORDER_PREFIX + "items")
                .description("Lines per order")
                .register(meterRegistry)
                .record(itemCount);
        Timer.builder(ORDER_PREFIX + "create.latency")
                .description("Order placement latency")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        logger.debug("Recorded order creation with {} items", itemCount);
    }

    /**
     * Record failed order creation.
     *
     * @param reason Failure reason (e.g. "OUT_OF_STOCK", "PRODUCT_NOT_FOUND")
     */
    public void recordOrderFailure(String reason) {
        Counter.builder(ORDER_PREFIX + "failure")
                .tag("reason", reason)
                .description("Failed order creations")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded order failure, reason: {}", reason);
    }

    public void recordOrderStatusChange(String status) {
        Counter.builder(ORDER_PREFIX + "status.change")
                .tag("status", status)
                .description("Order status changes")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a consultation status change.
     *
     * @param status New status
     */
    public void recordConsultationTransition(String status) {
        Counter.builder(CONSULTATION_PREFIX + "transition")
                .tag("status", status)
                .description("Consultation status changes")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded consultation transition to {}", status);
    }

    /**
     * Record a like toggle.
     *
     * @param targetType "tip", "story", "message" or "reply"
     * @param liked true when the toggle added a like
     */
    public void recordLikeToggle(String targetType, boolean liked) {
        Counter.builder(METRIC_PREFIX + "like.toggle")
                .tag("target", targetType)
                .tag("action", liked ? "like" : "unlike")
                .description("Like toggles")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a stored upload.
     *
     * @param folder Storage folder
     * @param sizeBytes File size
     */
    public void recordUpload(String folder, long sizeBytes) {
        DistributionSummary.builder(METRIC_PREFIX + "upload.size")
                .tag("folder", folder)
                .baseUnit("bytes")
                .description("Stored upload sizes")
                .register(meterRegistry)
                .record(sizeBytes);
    }

    public void recordLogin(boolean success) {
        Counter.builder(AUTH_PREFIX + "login")
                .tag("outcome", success ? "success" : "failure")
                .description("Login attempts")
                .register(meterRegistry)
                .increment();
    }

    public void recordPasswordResetRequested() {
        Counter.builder(AUTH_PREFIX + "password.reset.requested")
                .description("Password reset requests")
                .register(meterRegistry)
                .increment();
    }

    public void recordRateLimitRejection(String scope) {
        Counter.builder(METRIC_PREFIX + "ratelimit.rejected")
                .tag("scope", scope)
                .description("Requests rejected by the rate limiter")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an error.
     *
     * @param errorType Error type (e.g. "UNEXPECTED_ERROR")
     * @param operation Operation where the error happened
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "errors")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Application errors")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error: {} in operation: {}", errorType, operation);
    }
}
