package com.layeredapi.backend.global.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger UI metadata. Every operation advertises the bearer scheme; public routes simply ignore it.
 */
@Configuration
public class OpenApiConfig {

    static final String BEARER_SCHEME = "BearerAuth";

    @Bean
    public OpenAPI layeredApiOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Layered API")
                        .version("1.0")
                        .description("User registration, login and user management over a layered architecture")
                        .license(new License().name("MIT").url("https://opensource.org/licenses/MIT")))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT")))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
    }
}
