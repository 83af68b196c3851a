package com.openforge.dnd.auth;

import com.openforge.dnd.account.CredentialStore;
import com.openforge.dnd.config.AppConfig;
import com.openforge.dnd.domain.Account;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Login, per-request session checks and logout.
 *
 * Login always runs one Argon2 verification, against a throwaway hash when the username
 * is unknown, and fails with the same {@link InvalidCredentialsException} either way, so
 * neither the response nor its timing reveals which usernames exist.
 */
@Slf4j
@Service
public class AuthService {

    private final CredentialStore        credentialStore;
    private final PasswordHasher         passwordHasher;
    private final SessionCodec           sessionCodec;
    private final RevokedSessionRegistry revokedSessions;
    private final SessionProperties      sessionProperties;
    private final Executor               accountIoExecutor;
    private final String                 decoyHash;

    public AuthService(CredentialStore credentialStore,
                       PasswordHasher passwordHasher,
                       SessionCodec sessionCodec,
                       RevokedSessionRegistry revokedSessions,
                       SessionProperties sessionProperties,
                       @Qualifier(AppConfig.ACCOUNT_IO_EXECUTOR) Executor accountIoExecutor) {
        this.credentialStore   = credentialStore;
        this.passwordHasher    = passwordHasher;
        this.sessionCodec      = sessionCodec;
        this.revokedSessions   = revokedSessions;
        this.sessionProperties = sessionProperties;
        this.accountIoExecutor = accountIoExecutor;
        this.decoyHash         = passwordHasher.hash(UUID.randomUUID().toString());
    }

    /**
     * Check the credentials on the hashing lane, then record the login and mint a session
     * on the account I/O executor.
     *
     * The future fails with {@link InvalidCredentialsException} on a bad username or
     * password, with {@link com.openforge.dnd.account.StorageUnavailableException} if the
     * database fails, and with {@code BulkheadFullException} if the lane is saturated.
     */
    public CompletableFuture<LoginResult> login(String username, String password) {
        Optional<Account> account = credentialStore.getAccount(username);
        String stored = account.map(Account::getPasswordHash).orElse(decoyHash);

        return passwordHasher.verifyAsync(password, stored).thenApplyAsync(matches -> {
            if (account.isEmpty()) {
                log.debug("[Auth] Login for unknown user '{}' rejected", username);
                throw new InvalidCredentialsException();
            }
            if (!matches) {
                log.debug("[Auth] Wrong password for user '{}'", username);
                throw new InvalidCredentialsException();
            }

            Account found = account.get();
            credentialStore.recordLogin(found.getUsername());
            IssuedSession session = sessionCodec.issue(found.getUsername(), found.getRole());
            log.info("[Auth] User '{}' logged in, session expires {}", found.getUsername(), session.claims().expiresAt());
            return new LoginResult(found.getUsername(), found.getRole(), session);
        }, accountIoExecutor);
    }

    /**
     * Resolve a session token to an identity.
     *
     * Empty for an invalid, expired or revoked token, for a token whose user no longer
     * exists, and for one whose role disagrees with the database.
     */
    public Optional<AuthenticatedAccount> authenticate(String token) {
        SessionClaims claims;
        try {
            claims = sessionCodec.validate(token);
        } catch (InvalidSessionException e) {
            log.debug("[Auth] {} session: {}", e.getReason(), e.getMessage());
            return Optional.empty();
        }

        if (revokedSessions.isRevoked(claims.tokenId())) {
            log.debug("[Auth] Session of '{}' was logged out", claims.subject());
            return Optional.empty();
        }

        Optional<Account> account = credentialStore.getAccount(claims.subject());
        if (account.isEmpty()) {
            log.debug("[Auth] Session names unknown user '{}'", claims.subject());
            return Optional.empty();
        }
        if (account.get().getRole() != claims.role()) {
            log.debug("[Auth] Session role {} of '{}' does not match stored role {}",
                    claims.role(), claims.subject(), account.get().getRole());
            return Optional.empty();
        }

        return Optional.of(new AuthenticatedAccount(claims.subject(), claims.role(), claims));
    }

    /**
     * End a session. The cookie is cleared by the caller regardless; here the token id
     * is additionally denylisted until expiry when revocation is enabled.
     */
    public void logout(String token) {
        if (token == null || token.isBlank()) {
            return;
        }
        try {
            SessionClaims claims = sessionCodec.validate(token);
            if (sessionProperties.revokeOnLogout()) {
                revokedSessions.revoke(claims);
            }
            log.info("[Auth] User '{}' logged out", claims.subject());
        } catch (InvalidSessionException e) {
            log.debug("[Auth] Logout with {} session, nothing to revoke", e.getReason());
        }
    }
}
