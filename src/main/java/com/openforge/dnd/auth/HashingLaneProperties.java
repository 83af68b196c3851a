package com.openforge.dnd.auth;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Size of the worker lane that runs Argon2 off the request threads.
 * A non-positive thread count means "number of available processors".
 */
@ConfigurationProperties(prefix = "dnd.hashing-lane")
public record HashingLaneProperties(
        @DefaultValue("0")  int threads,
        @DefaultValue("64") int queueCapacity
) {

    public int effectiveThreads() {
        return threads > 0 ? threads : Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
