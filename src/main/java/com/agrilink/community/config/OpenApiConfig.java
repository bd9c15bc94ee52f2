package com.agrilink.community.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI document served by springdoc at /v3/api-docs and /swagger-ui.html.
 *
 * @author AgriLink Team
 */
@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "AgriLink Community API",
        version = "1.0.0",
        description = "Farming community back end: marketplace, expert consultations, tips, "
            + "success stories and the community discussion board.\n\n"
            + "Protected operations expect `Authorization: Bearer <token>` as returned by "
            + "POST /api/login or POST /api/register."),
    servers = {
        @Server(url = "http://localhost:8080", description = "Local Development")
    })
@SecurityScheme(
    name = "bearerAuth",
    type = SecuritySchemeType.HTTP,
    scheme = "bearer",
    bearerFormat = "JWT",
    description = "Access token issued by POST /api/login")
public class OpenApiConfig {
}
