package com.openforge.dnd.auth;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Session token and cookie settings.
 *
 * application.yml:
 *
 * dnd:
 *   session:
 *     ttl: 360m
 *     clock-skew: 30s
 *     secret:                 # optional Base64 32-byte AES key; random per process when unset
 *     cookie-name: login-token
 *     revoke-on-logout: true
 */
@ConfigurationProperties(prefix = "dnd.session")
public record SessionProperties(
        @DefaultValue("360m")        Duration ttl,
        @DefaultValue("30s")         Duration clockSkew,
                                     String   secret,
        @DefaultValue("login-token") String   cookieName,
        @DefaultValue("true")        boolean  revokeOnLogout
) {}
