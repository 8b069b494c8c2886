package com.example.studio.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bearer token settings shared with the identity service that issues the tokens.
 *
 * @param jwtSecret   HMAC secret for HS256 signatures, at least 32 bytes
 * @param userIdClaim claim carrying the user id
 */
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        String jwtSecret,
        String userIdClaim
) {
    public AuthProperties {
        if (userIdClaim == null || userIdClaim.isBlank()) {
            userIdClaim = "user_id";
        }
    }
}
