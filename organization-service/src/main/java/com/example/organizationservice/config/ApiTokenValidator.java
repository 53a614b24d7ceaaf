package com.example.organizationservice.config;

import com.example.organizationservice.security.AuthProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Validates the API token configuration at startup.
 * A blank token with authentication enabled would lock every protected
 * endpoint, so startup is aborted instead.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiTokenValidator implements ApplicationListener<ApplicationReadyEvent> {

    private static final int RECOMMENDED_MIN_LENGTH = 32;

    private final AuthProperties authProperties;

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (authProperties.isDisabled()) {
            log.warn("API token authentication disabled (app.auth.disabled=true)");
            return;
        }

        try {
            validate();
            log.info("API token validation: PASSED");
        } catch (IllegalStateException e) {
            log.error("API TOKEN VALIDATION FAILED: {}", e.getMessage());
            throw e;
        }
    }

    void validate() {
        String token = authProperties.getToken();
        if (token == null || token.isBlank()) {
            throw new IllegalStateException(
                "API token is not configured! " +
                "Set environment variable APP_AUTH_TOKEN or application property app.auth.token"
            );
        }
        if (token.length() < RECOMMENDED_MIN_LENGTH) {
            log.warn("API token is shorter than {} characters; consider a stronger token", RECOMMENDED_MIN_LENGTH);
        }
    }
}
