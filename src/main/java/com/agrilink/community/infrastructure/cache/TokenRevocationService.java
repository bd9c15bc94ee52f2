package com.agrilink.community.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Redis-backed deny list of logged-out access tokens.
 *
 * Cache Keys:
 * - revoked_token:{jti} -> "1", expiring together with the token
 *
 * Redis failures are logged and treated as "not revoked" so an outage does not lock every user out.
 *
 * @author AgriLink Team
 */
@Service
public class TokenRevocationService {

    private static final Logger logger = LoggerFactory.getLogger(TokenRevocationService.class);

    private static final String REVOKED_PREFIX = "revoked_token:";

    private final RedisTemplate<String, String> redisTemplate;

    public TokenRevocationService(RedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Revoke a token until its natural expiry.
     *
     * @param tokenId Token id (jti)
     * @param expiresAt Token expiry
     * @return true if the revocation was stored
     */
    public boolean revoke(String tokenId, Instant expiresAt) {
        if (tokenId == null) {
            return false;
        }
        Duration ttl = Duration.between(Instant.now(), expiresAt);
        if (ttl.isNegative() || ttl.isZero()) {
            logger.debug("Token {} already expired, nothing to revoke", tokenId);
            return true;
        }
        try {
            redisTemplate.opsForValue().set(REVOKED_PREFIX + tokenId, "1", ttl);
            logger.debug("Revoked token {} for {}s", tokenId, ttl.getSeconds());
            return true;
        } catch (Exception e) {
            logger.error("Error revoking token {}", tokenId, e);
            return false;
        }
    }

    /**
     * Check if a token has been revoked.
     *
     * @param tokenId Token id (jti)
     * @return true if revoked
     */
    public boolean isRevoked(String tokenId) {
        if (tokenId == null) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(REVOKED_PREFIX + tokenId));
        } catch (Exception e) {
            logger.error("Error checking revocation for token {}, treating as valid", tokenId, e);
            return false;
        }
    }
}
