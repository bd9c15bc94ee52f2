package com.agrilink.community.infrastructure.ratelimit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Puts the credential endpoints behind {@link RateLimitInterceptor}.
 * Disabled with agrilink.rate-limiting.enabled=false.
 *
 * @author AgriLink Team
 */
@Configuration
@ConditionalOnProperty(name = "agrilink.rate-limiting.enabled", havingValue = "true", matchIfMissing = true)
public class RateLimitConfig implements WebMvcConfigurer {

    private final RateLimitInterceptor rateLimitInterceptor;
    private final List<String> paths;

    public RateLimitConfig(
            RateLimitInterceptor rateLimitInterceptor,
            @Value("${agrilink.rate-limiting.paths:/api/login,/api/password/**}") List<String> paths
    ) {
        this.rateLimitInterceptor = rateLimitInterceptor;
        this.paths = paths;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(rateLimitInterceptor).addPathPatterns(paths);
    }
}
