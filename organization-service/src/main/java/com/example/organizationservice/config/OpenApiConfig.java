package com.example.organizationservice.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration for the Organization Service.
 */
@Configuration
public class OpenApiConfig {

    private static final String SECURITY_SCHEME_NAME = "apiToken";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Organization Directory API")
                        .version("1.0.0")
                        .description("""
                            API for organizations, the buildings they occupy and the
                            activity taxonomy they are tagged with.

                            ## Authentication
                            Activity and building endpoints require the static API token in the
                            Authorization header: `Bearer <token>`. Organization endpoints are public.

                            ## Listing
                            - `page` (default 1), `perPage` (default 10, max 100, 0 = all rows)
                            - repeated `sort=field,asc|desc`
                            """))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME,
                                new SecurityScheme()
                                        .name(SECURITY_SCHEME_NAME)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .description("Static API token (app.auth.token)")));
    }
}
