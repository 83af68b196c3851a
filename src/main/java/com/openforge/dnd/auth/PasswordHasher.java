package com.openforge.dnd.auth;

import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Argon2id hashing and verification.
 *
 * The synchronous methods do the work on the calling thread. Request handlers use the
 * async variants, which run on the "passwordHashing" bulkhead so the CPU-heavy hash never
 * ties up a Tomcat worker.
 *
 * Verification compares digests in constant time; the plaintext is never logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PasswordHasher {

    private final PasswordEncoder    passwordEncoder;
    private final ThreadPoolBulkhead passwordHashingBulkhead;

    /** Hash with a fresh random salt; the result is a PHC string with embedded parameters. */
    public String hash(CharSequence password) {
        if (password == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        return passwordEncoder.encode(password);
    }

    /**
     * @return true only if {@code password} produces the digest stored in {@code stored};
     *         false for a mismatch or for a stored value that is not a valid Argon2 hash
     */
    public boolean verify(CharSequence password, String stored) {
        if (password == null || stored == null || stored.isEmpty()) {
            return false;
        }
        try {
            return passwordEncoder.matches(password, stored);
        } catch (IllegalArgumentException e) {
            log.warn("[Hashing] Stored password hash is malformed: {}", e.getMessage());
            return false;
        }
    }

    public CompletableFuture<String> hashAsync(CharSequence password) {
        return passwordHashingBulkhead.executeSupplier(() -> hash(password)).toCompletableFuture();
    }

    public CompletableFuture<Boolean> verifyAsync(CharSequence password, String stored) {
        return passwordHashingBulkhead.executeSupplier(() -> verify(password, stored)).toCompletableFuture();
    }
}
