package com.example.organizationservice.security;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * API token settings bound from {@code app.auth.*}.
 */
@Data
@ConfigurationProperties(prefix = "app.auth")
public class AuthProperties {

    /**
     * When true every endpoint is public.
     */
    private boolean disabled = false;

    /**
     * Static bearer token expected in the Authorization header.
     */
    private String token;
}
