package com.openforge.dnd.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.server.ConfigurableWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Checks the PEM files before the embedded server is created so a bad path fails with a
 * clear message. Spring Boot's own SSL setup (server.ssl.*, wired to the same paths in
 * application.yml) rejects material that exists but does not parse.
 */
@Slf4j
@Configuration
public class TlsConfig {

    @Bean
    public WebServerFactoryCustomizer<ConfigurableWebServerFactory> tlsMaterialCheck(TlsProperties props) {
        return factory -> {
            if (!props.enabled()) {
                log.warn("[TLS] HTTPS disabled (dnd.tls.enabled=false); session cookies are Secure and will not be sent over plain HTTP");
                return;
            }
            requireReadable("certificate", props.certificate());
            requireReadable("private key", props.privateKey());
            log.info("[TLS] Serving HTTPS with certificate={} key={}", props.certificate(), props.privateKey());
        };
    }

    static void requireReadable(String what, Path path) {
        if (path == null) {
            throw new TlsConfigException("No TLS " + what + " path configured");
        }
        if (!Files.isRegularFile(path)) {
            throw new TlsConfigException("TLS " + what + " '" + path + "' does not exist or is not a file");
        }
        if (!Files.isReadable(path)) {
            throw new TlsConfigException("TLS " + what + " '" + path + "' is not readable");
        }
    }
}
