package com.openforge.dnd.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * PEM certificate chain and private key for the HTTPS listener.
 * The same paths feed {@code server.ssl.certificate} / {@code server.ssl.certificate-private-key}.
 */
@ConfigurationProperties(prefix = "dnd.tls")
public record TlsProperties(
        @DefaultValue("true")                    boolean enabled,
        @DefaultValue("./config/cert.pem")       Path    certificate,
        @DefaultValue("./config/key.pem")        Path    privateKey
) {}
