package com.openforge.dnd.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.dnd.auth.PasswordProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Core infrastructure beans:
 *  - Clock              → one time source for tokens and audit stamps, replaceable in tests
 *  - Jackson ObjectMapper → camelCase JSON, ISO-8601 dates, tolerant deserialization
 *  - TomlMapper         → reads the root credential descriptor
 *  - PasswordEncoder    → Argon2id with the deployment's fixed cost parameters
 *  - accountIoExecutor  → finishes logins and account creation once the hash is done
 */
@Configuration
@EnableScheduling
public class AppConfig {

    public static final String ACCOUNT_IO_EXECUTOR = "accountIoExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared ObjectMapper for request and response bodies:
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Database writes and token minting that follow a password check.
     * Keeps that work off the hashing lane, whose threads are sized for Argon2 only.
     */
    @Bean(name = ACCOUNT_IO_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService accountIoExecutor() {
        return Executors.newFixedThreadPool(2, new CustomizableThreadFactory("account-io-"));
    }

    @Bean
    public TomlMapper tomlMapper() {
        TomlMapper mapper = new TomlMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Password encoder used for account creation and login.
     * Argon2id is memory-hard; the encoded form embeds salt and parameters.
     */
    @Bean
    public PasswordEncoder passwordEncoder(PasswordProperties props) {
        return new Argon2PasswordEncoder(
                props.saltLength(),
                props.hashLength(),
                props.parallelism(),
                props.memoryKib(),
                props.iterations());
    }
}
