package com.agrilink.community.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;

/**
 * One-time password issued for a password reset request.
 * An OTP can be redeemed once and only before it expires.
 *
 * @author AgriLink Team
 */
@Entity
@Table(name = "otps", indexes = {
    @Index(name = "idx_otps_user_id", columnList = "user_id"),
    @Index(name = "idx_otps_expires_at", columnList = "expires_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PasswordResetOtp {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "otp", nullable = false, length = 6)
    private String otp;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "is_used", nullable = false)
    @Builder.Default
    private Boolean used = false;

    @Column(name = "failed_attempts", nullable = false)
    @Builder.Default
    private Integer failedAttempts = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        if (used == null) {
            used = false;
        }
        if (failedAttempts == null) {
            failedAttempts = 0;
        }
    }

    /**
     * Check if the OTP can still be redeemed.
     *
     * @return true if not used and not yet expired
     */
    public boolean isValid() {
        return !Boolean.TRUE.equals(used) && expiresAt != null && expiresAt.isAfter(Instant.now());
    }

    public void markUsed() {
        this.used = true;
    }

    /**
     * Count a wrong guess against this code. The code is burnt once the limit is reached.
     *
     * @param maxAttempts Wrong guesses allowed per code
     * @return true if the code is now unusable
     */
    public boolean recordFailedAttempt(int maxAttempts) {
        failedAttempts = (failedAttempts == null ? 0 : failedAttempts) + 1;
        if (failedAttempts >= maxAttempts) {
            used = true;
        }
        return Boolean.TRUE.equals(used);
    }

    /**
     * Compare a submitted code in constant time.
     */
    public boolean matches(String candidate) {
        if (otp == null || candidate == null) {
            return false;
        }
        return MessageDigest.isEqual(otp.getBytes(StandardCharsets.UTF_8), candidate.getBytes(StandardCharsets.UTF_8));
    }
}
