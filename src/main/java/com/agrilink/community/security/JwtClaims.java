package com.agrilink.community.security;

import java.time.Instant;

/**
 * Claims extracted from a verified access token.
 *
 * @param userId Subject user id
 * @param email E-mail at issue time
 * @param role Role name at issue time
 * @param tokenId Unique token id (jti), used for revocation
 * @param expiresAt Expiry of the token
 */
public record JwtClaims(Long userId, String email, String role, String tokenId, Instant expiresAt) {
}
