package com.agrilink.community.security;

import com.agrilink.community.domain.model.User.Role;
import com.agrilink.community.infrastructure.cache.TokenRevocationService;
import com.agrilink.community.repository.UserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Authentication filter that resolves the user from an {@code Authorization: Bearer} token.
 *
 * <p>A missing, invalid, expired or revoked token leaves the request unauthenticated; the security
 * chain then decides whether the route needs a user. The role is read from the user record rather
 * than the token, so a role change takes effect on the next request; a token for a deleted user is
 * ignored. Authorities are {@code ROLE_<role>}.
 *
 * @author AgriLink Team
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider tokenProvider;
    private final TokenRevocationService revocationService;
    private final UserRepository userRepository;

    public JwtAuthenticationFilter(
            JwtTokenProvider tokenProvider,
            TokenRevocationService revocationService,
            UserRepository userRepository
    ) {
        this.tokenProvider = tokenProvider;
        this.revocationService = revocationService;
        this.userRepository = userRepository;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String token = extractToken(request);

        if (token != null) {
            Optional<JwtClaims> claims = tokenProvider.parseToken(token);

            if (claims.isPresent() && !revocationService.isRevoked(claims.get().tokenId())) {
                authenticate(claims.get());
            } else {
                logger.debug("Bearer token rejected for {} {}", request.getMethod(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }

    private void authenticate(JwtClaims claims) {
        Optional<Role> currentRole = userRepository.findRoleById(claims.userId());
        if (currentRole.isEmpty()) {
            logger.debug("Token for user {} ignored, user no longer exists", claims.userId());
            return;
        }
        Role role = currentRole.get();
        if (!role.name().equalsIgnoreCase(claims.role())) {
            logger.debug("User {} role changed from {} to {} since token issue", claims.userId(), claims.role(), role);
        }

        AuthenticatedUser principal = new AuthenticatedUser(
                claims.userId(), claims.email(), role, claims.tokenId(), claims.expiresAt());

        List<SimpleGrantedAuthority> authorities = Collections.singletonList(
                new SimpleGrantedAuthority("ROLE_" + role.name())
        );

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, null, authorities);

        SecurityContextHolder.getContext().setAuthentication(authentication);

        logger.debug("Authenticated user: {} with role: {}", claims.userId(), role);
    }

    private String extractToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}
