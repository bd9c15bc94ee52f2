package com.agrilink.community.repository;

import com.agrilink.community.domain.model.PasswordResetOtp;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for password reset OTPs.
 *
 * @author AgriLink Team
 */
@Repository
public interface PasswordResetOtpRepository extends JpaRepository<PasswordResetOtp, Long> {

    /**
     * Find the newest unused OTP of a user. Issuing a code invalidates older ones, so this is
     * the only code that can be redeemed.
     *
     * @param userId User ID
     * @return Optional containing the OTP if found
     */
    Optional<PasswordResetOtp> findFirstByUserIdAndUsedFalseOrderByCreatedAtDesc(Long userId);

    /**
     * Mark all unused OTPs of a user as used, so only the newest one can be redeemed.
     *
     * @param userId User ID
     * @return Number of invalidated OTPs
     */
    @Modifying
    @Query("UPDATE PasswordResetOtp o SET o.used = true WHERE o.userId = :userId AND o.used = false")
    int invalidateUnusedForUser(@Param("userId") Long userId);

    /**
     * Delete OTPs that can no longer be redeemed.
     *
     * @param now Current time
     * @return Number of deleted rows
     */
    @Modifying
    @Query("DELETE FROM PasswordResetOtp o WHERE o.used = true OR o.expiresAt < :now")
    int deleteExpiredOrUsed(@Param("now") Instant now);
}
