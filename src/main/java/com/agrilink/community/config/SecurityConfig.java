package com.agrilink.community.config;

import com.agrilink.community.api.dto.ErrorResponse;
import com.agrilink.community.infrastructure.cache.TokenRevocationService;
import com.agrilink.community.repository.UserRepository;
import com.agrilink.community.security.JwtAuthenticationFilter;
import com.agrilink.community.security.JwtTokenProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import java.io.IOException;

/**
 * Security configuration for the AgriLink API.
 *
 * Authentication Strategy:
 * - Bearer JWT issued by /api/login and /api/register
 * - Stateless session management (no server-side sessions)
 * - Logged-out tokens are rejected through the Redis deny list
 *
 * Authorization:
 * - Route rules below decide which requests need a user
 * - Role rules use @PreAuthorize; ownership rules live in the services
 *
 * @author AgriLink Team
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity(prePostEnabled = true)
public class SecurityConfig {

    private final ObjectMapper objectMapper;

    public SecurityConfig(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            JwtAuthenticationFilter jwtAuthenticationFilter
    ) throws Exception {
        http
            .csrf(csrf -> csrf.disable())

            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health/**", "/actuator/info").permitAll()
                .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                .requestMatchers("/productImages/**", "/userImage/**", "/success_stories/**",
                        "/communityfiles/**").permitAll()

                .requestMatchers(HttpMethod.POST, "/api/register", "/api/login",
                        "/api/password/request-reset", "/api/password/reset").permitAll()

                // Personal listings that share a prefix with public reads
                .requestMatchers(HttpMethod.GET, "/api/tips/saved", "/api/tips/my-tips",
                        "/api/success-stories/my-stories").authenticated()

                .requestMatchers(HttpMethod.GET, "/api/experts", "/api/categories/**",
                        "/api/products/**", "/api/tip-categories/**", "/api/tips/**",
                        "/api/success-stories/**", "/api/community/**").permitAll()

                .anyRequest().authenticated()
            )

            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint((request, response, ex) ->
                        writeError(request, response, HttpStatus.UNAUTHORIZED, "Authentication required"))
                .accessDeniedHandler((request, response, ex) ->
                        writeError(request, response, HttpStatus.FORBIDDEN, "Access denied"))
            )

            .addFilterBefore(jwtAuthenticationFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }

    /**
     * Bearer token authentication filter bean.
     */
    @Bean
    public JwtAuthenticationFilter jwtAuthenticationFilter(
            JwtTokenProvider tokenProvider,
            TokenRevocationService revocationService,
            UserRepository userRepository
    ) {
        return new JwtAuthenticationFilter(tokenProvider, revocationService, userRepository);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    private void writeError(HttpServletRequest request, HttpServletResponse response,
                            HttpStatus status, String message) throws IOException {
        ErrorResponse error = new ErrorResponse(
                status.value(), status.getReasonPhrase(), message, request.getRequestURI());
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
