package com.openforge.dnd.config;

import com.openforge.dnd.auth.HashingLaneProperties;
import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import io.github.resilience4j.bulkhead.ThreadPoolBulkheadConfig;
import io.github.resilience4j.bulkhead.ThreadPoolBulkheadRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named thread-pool bulkhead, "passwordHashing", is the dedicated worker lane for
 * Argon2. Request threads hand the work over and never run the hash themselves; once the
 * queue is full new logins fail fast with BulkheadFullException instead of piling up.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    public static final String PASSWORD_HASHING = "passwordHashing";

    @Bean
    public ThreadPoolBulkheadRegistry threadPoolBulkheadRegistry(HashingLaneProperties props) {
        int threads = props.effectiveThreads();
        ThreadPoolBulkheadConfig config = ThreadPoolBulkheadConfig.custom()
                .coreThreadPoolSize(threads)
                .maxThreadPoolSize(threads)
                .queueCapacity(props.queueCapacity())
                .keepAliveDuration(Duration.ofSeconds(30))
                .build();

        log.info("[Hashing] Worker lane '{}' threads={} queue={}", PASSWORD_HASHING, threads, props.queueCapacity());
        return ThreadPoolBulkheadRegistry.of(config);
    }

    @Bean(destroyMethod = "close")
    public ThreadPoolBulkhead passwordHashingBulkhead(ThreadPoolBulkheadRegistry registry) {
        return registry.bulkhead(PASSWORD_HASHING);
    }
}
