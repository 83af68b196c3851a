package com.openforge.dnd.auth;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Argon2id cost parameters, fixed per deployment.
 *
 * Defaults are the Argon2id parameters recommended by OWASP (19 MiB, 2 passes, 1 lane).
 * Existing hashes keep verifying after a change because each PHC string carries its own
 * parameters.
 */
@ConfigurationProperties(prefix = "dnd.password")
public record PasswordProperties(
        @DefaultValue("16")    int saltLength,
        @DefaultValue("32")    int hashLength,
        @DefaultValue("1")     int parallelism,
        @DefaultValue("19456") int memoryKib,
        @DefaultValue("2")     int iterations
) {}
