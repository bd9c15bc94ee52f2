package com.agrilink.community.infrastructure.scheduler;

import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import com.agrilink.community.repository.PasswordResetOtpRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Scheduled job that purges password reset OTPs which can no longer be redeemed
 * (used, or past their expiry).
 *
 * @author AgriLink Team
 */
@Service
public class OtpCleanupScheduler {

    private static final Logger logger = LoggerFactory.getLogger(OtpCleanupScheduler.class);

    private final PasswordResetOtpRepository otpRepository;
    private final CloudWatchMetricsService metricsService;

    @Value("${agrilink.otp.cleanup.enabled:true}")
    private boolean schedulerEnabled;

    public OtpCleanupScheduler(PasswordResetOtpRepository otpRepository, CloudWatchMetricsService metricsService) {
        this.otpRepository = otpRepository;
        this.metricsService = metricsService;
    }

    /**
     * Delete expired and used OTPs.
     *
     * @return Number of deleted rows
     */
    @Scheduled(fixedDelayString = "${agrilink.otp.cleanup.fixed-delay-ms:3600000}")
    @Transactional
    public int cleanupOtps() {
        if (!schedulerEnabled) {
            logger.debug("OTP cleanup scheduler is disabled");
            return 0;
        }

        long startTime = System.currentTimeMillis();

        try {
            int deleted = otpRepository.deleteExpiredOrUsed(Instant.now());
            long duration = System.currentTimeMillis() - startTime;

            if (deleted > 0) {
                logger.info("OTP cleanup completed: {} deleted, duration: {}ms", deleted, duration);
            } else {
                logger.debug("No expired or used OTPs found");
            }
            return deleted;

        } catch (Exception e) {
            logger.error("Error in OTP cleanup scheduler", e);
            metricsService.recordError("OTP_CLEANUP_ERROR", "cleanupOtps");
            return 0;
        }
    }
}
