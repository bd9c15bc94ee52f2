package com.agrilink.community.service;

import com.agrilink.community.api.dto.PasswordResetConfirmRequest;
import com.agrilink.community.domain.model.PasswordResetOtp;
import com.agrilink.community.domain.model.User;
import com.agrilink.community.exception.FieldValidationException;
import com.agrilink.community.infrastructure.messaging.KafkaProducerService;
import com.agrilink.community.infrastructure.messaging.events.NotificationEvent;
import com.agrilink.community.infrastructure.messaging.events.NotificationEvent.NotificationType;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import com.agrilink.community.repository.PasswordResetOtpRepository;
import com.agrilink.community.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Password reset by one-time code.
 *
 * <p>Requesting a reset issues a numeric OTP, invalidates the user's earlier unused codes and
 * asks the notification service to mail it. Requests for unknown addresses look identical to
 * the caller.
 *
 * @author AgriLink Team
 */
@Service
public class PasswordResetService {

    private static final Logger logger = LoggerFactory.getLogger(PasswordResetService.class);

    private final UserRepository userRepository;
    private final PasswordResetOtpRepository otpRepository;
    private final PasswordEncoder passwordEncoder;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;
    private final SecureRandom random = new SecureRandom();

    private final int otpLength;
    private final Duration otpTtl;
    private final int maxAttempts;

    public PasswordResetService(
            UserRepository userRepository,
            PasswordResetOtpRepository otpRepository,
            PasswordEncoder passwordEncoder,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService,
            @Value("${agrilink.otp.length:6}") int otpLength,
            @Value("${agrilink.otp.ttl-minutes:10}") long otpTtlMinutes,
            @Value("${agrilink.otp.max-attempts:5}") int maxAttempts
    ) {
        this.userRepository = userRepository;
        this.otpRepository = otpRepository;
        this.passwordEncoder = passwordEncoder;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
        this.otpLength = otpLength;
        this.otpTtl = Duration.ofMinutes(otpTtlMinutes);
        this.maxAttempts = maxAttempts;
    }

    /**
     * Issue a reset code for the address if it belongs to an account.
     *
     * @param email Address the user typed
     */
    @Transactional
    public void requestReset(String email) {
        Optional<User> found = userRepository.findByEmailIgnoreCase(email.trim());
        if (found.isEmpty()) {
            logger.info("Password reset requested for unknown address");
            return;
        }
        User user = found.get();

        int invalidated = otpRepository.invalidateUnusedForUser(user.getId());
        if (invalidated > 0) {
            logger.debug("Invalidated {} earlier reset codes for user {}", invalidated, user.getId());
        }

        PasswordResetOtp otp = PasswordResetOtp.builder()
                .userId(user.getId())
                .otp(generateOtp())
                .expiresAt(Instant.now().plus(otpTtl))
                .build();
        otpRepository.save(otp);

        kafkaProducerService.publishNotification(
                new NotificationEvent(NotificationType.PASSWORD_RESET_OTP, user.getId(), user.getEmail(), user.getName())
                        .withAttribute("otp", otp.getOtp())
                        .withAttribute("expiresAt", otp.getExpiresAt().toString())
                        .withAttribute("expiresInMinutes", otpTtl.toMinutes()));

        metricsService.recordPasswordResetRequested();
        logger.info("Issued password reset code for user {}", user.getId());
    }

    /**
     * Redeem a reset code and set the new password. Each wrong guess is counted against the
     * user's current code, which stops working after the configured number of failures.
     *
     * @throws FieldValidationException if the code is wrong, used, burnt or expired
     */
    @Transactional(noRollbackFor = FieldValidationException.class)
    public void resetPassword(PasswordResetConfirmRequest request) {
        User user = userRepository.findByEmailIgnoreCase(request.getEmail().trim())
                .orElseThrow(() -> invalidOtp());

        PasswordResetOtp otp = otpRepository
                .findFirstByUserIdAndUsedFalseOrderByCreatedAtDesc(user.getId())
                .filter(PasswordResetOtp::isValid)
                .orElseThrow(() -> {
                    logger.warn("No redeemable reset code for user {}", user.getId());
                    return invalidOtp();
                });

        if (!otp.matches(request.getOtp())) {
            boolean burnt = otp.recordFailedAttempt(maxAttempts);
            otpRepository.save(otp);
            if (burnt) {
                logger.warn("Reset code of user {} invalidated after {} wrong attempts", user.getId(), otp.getFailedAttempts());
            } else {
                logger.warn("Wrong reset code for user {} ({} of {} attempts)", user.getId(), otp.getFailedAttempts(), maxAttempts);
            }
            throw invalidOtp();
        }

        otp.markUsed();
        otpRepository.save(otp);

        user.setPassword(passwordEncoder.encode(request.getPassword()));
        userRepository.save(user);

        logger.info("Password reset completed for user {}", user.getId());
    }

    String generateOtp() {
        int bound = (int) Math.pow(10, otpLength);
        return String.format("%0" + otpLength + "d", random.nextInt(bound));
    }

    private static FieldValidationException invalidOtp() {
        return new FieldValidationException("otp", "Invalid or expired OTP");
    }
}
