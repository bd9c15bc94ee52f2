package com.agrilink.community;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the AgriLink farming community.
 *
 * System Overview:
 * - Marketplace: categories, products with images, multi-item orders with stock control
 * - Expert consultations booked by farmers
 * - Expert tips, success stories and a community discussion board with threaded replies
 * - JWT authentication with logout revocation and OTP password reset
 *
 * Architecture:
 * - API Layer: REST controllers with validation
 * - Service Layer: business rules, authorization by ownership and role
 * - Data Access Layer: JPA repositories with atomic counter and stock updates
 * - Infrastructure Layer: local file storage, Redis (token deny list, rate limiting),
 *   Kafka domain events, CloudWatch metrics
 *
 * @author AgriLink Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class AgriLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgriLinkApplication.class, args);
    }
}
