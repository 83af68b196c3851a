package com.openforge.dnd.auth;

import com.openforge.dnd.account.CredentialStore;
import com.openforge.dnd.account.StorageUnavailableException;
import com.openforge.dnd.domain.Account;
import com.openforge.dnd.domain.Account.Role;
import com.openforge.dnd.support.MutableClock;
import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AuthService.
 *
 * CredentialStore is mocked; hashing and the codec are real (with cheap Argon2 settings).
 */
@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    @Mock
    private CredentialStore credentialStore;

    private ThreadPoolBulkhead     bulkhead;
    private ExecutorService        accountIo;
    private PasswordHasher         passwordHasher;
    private MutableClock           clock;
    private SessionCodec           sessionCodec;
    private RevokedSessionRegistry revokedSessions;
    private AuthService            authService;

    @BeforeEach
    void setup() {
        bulkhead        = ThreadPoolBulkhead.ofDefaults("test-hashing");
        accountIo       = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("account-io-"));
        passwordHasher  = new PasswordHasher(new Argon2PasswordEncoder(16, 32, 1, 1024, 1), bulkhead);
        clock           = new MutableClock(Instant.parse("2024-04-09T12:00:00Z"));
        SessionProperties props = new SessionProperties(
                Duration.ofMinutes(360), Duration.ofSeconds(30), null, "login-token", true);
        sessionCodec    = new SessionCodec(props, clock);
        revokedSessions = new RevokedSessionRegistry(clock);
        authService     = new AuthService(credentialStore, passwordHasher, sessionCodec, revokedSessions, props, accountIo);
    }

    @AfterEach
    void teardown() throws Exception {
        bulkhead.close();
        accountIo.shutdownNow();
    }

    // ── Helper ───────────────────────────────────────────────────────────────

    private Account account(String username, String password, Role role) {
        Account account = new Account();
        account.setUsername(username);
        account.setPasswordHash(passwordHasher.hash(password));
        account.setRole(role);
        return account;
    }

    private LoginResult login(String username, String password) throws Exception {
        return authService.login(username, password).get(10, TimeUnit.SECONDS);
    }

    // ── Login ────────────────────────────────────────────────────────────────

    @Test
    void loginWithCorrectPasswordIssuesSession() throws Exception {
        when(credentialStore.getAccount("root")).thenReturn(Optional.of(account("root", "s3cr3t", Role.ROOT)));

        LoginResult result = login("root", "s3cr3t");

        assertThat(result.username()).isEqualTo("root");
        assertThat(result.role()).isEqualTo(Role.ROOT);
        assertThat(sessionCodec.validate(result.session().token()).subject()).isEqualTo("root");
        verify(credentialStore).recordLogin("root");
    }

    @Test
    void loginBookkeepingRunsOffTheHashingLane() throws Exception {
        when(credentialStore.getAccount("root")).thenReturn(Optional.of(account("root", "s3cr3t", Role.ROOT)));
        AtomicReference<String> recordedOn = new AtomicReference<>();
        doAnswer(invocation -> {
            recordedOn.set(Thread.currentThread().getName());
            return null;
        }).when(credentialStore).recordLogin("root");

        login("root", "s3cr3t");

        assertThat(recordedOn.get()).startsWith("account-io-");
    }

    @Test
    void wrongPasswordAndUnknownUserFailIdentically() {
        when(credentialStore.getAccount("root")).thenReturn(Optional.of(account("root", "s3cr3t", Role.ROOT)));
        when(credentialStore.getAccount("ghost")).thenReturn(Optional.empty());

        Throwable wrongPassword = causeOf(() -> login("root", "wrong"));
        Throwable unknownUser   = causeOf(() -> login("ghost", "s3cr3t"));

        assertThat(wrongPassword).isInstanceOf(InvalidCredentialsException.class);
        assertThat(unknownUser).isInstanceOf(InvalidCredentialsException.class);
        assertThat(wrongPassword.getMessage()).isEqualTo(unknownUser.getMessage());
        verify(credentialStore, never()).recordLogin(anyString());
    }

    @Test
    void storageFailureSurfacesAsStorageError() {
        when(credentialStore.getAccount("root"))
                .thenThrow(new StorageUnavailableException("boom", new RuntimeException()));

        assertThatThrownBy(() -> authService.login("root", "s3cr3t"))
                .isInstanceOf(StorageUnavailableException.class);
    }

    // ── Authenticate ─────────────────────────────────────────────────────────

    @Test
    void validSessionResolvesToIdentity() {
        when(credentialStore.getAccount("root")).thenReturn(Optional.of(account("root", "pw", Role.ROOT)));
        String token = sessionCodec.issue("root", Role.ROOT).token();

        Optional<AuthenticatedAccount> account = authService.authenticate(token);

        assertThat(account).isPresent();
        assertThat(account.get().username()).isEqualTo("root");
        assertThat(account.get().role()).isEqualTo(Role.ROOT);
    }

    @Test
    void expiredSessionIsAnonymous() {
        String token = sessionCodec.issue("root", Role.ROOT).token();
        clock.advance(Duration.ofHours(7));

        assertThat(authService.authenticate(token)).isEmpty();
    }

    @Test
    void sessionOfDeletedUserIsAnonymous() {
        when(credentialStore.getAccount("gone")).thenReturn(Optional.empty());
        String token = sessionCodec.issue("gone", Role.USER).token();

        assertThat(authService.authenticate(token)).isEmpty();
    }

    @Test
    void sessionWhoseRoleDisagreesWithDatabaseIsAnonymous() {
        when(credentialStore.getAccount("mallory")).thenReturn(Optional.of(account("mallory", "pw", Role.USER)));
        String token = sessionCodec.issue("mallory", Role.ROOT).token();

        assertThat(authService.authenticate(token)).isEmpty();
    }

    @Test
    void garbageSessionIsAnonymous() {
        assertThat(authService.authenticate("not-a-token")).isEmpty();
    }

    // ── Logout ───────────────────────────────────────────────────────────────

    @Test
    void loggedOutSessionIsRevokedUntilExpiry() {
        when(credentialStore.getAccount("root")).thenReturn(Optional.of(account("root", "pw", Role.ROOT)));
        String token = sessionCodec.issue("root", Role.ROOT).token();
        assertThat(authService.authenticate(token)).isPresent();

        authService.logout(token);

        assertThat(authService.authenticate(token)).isEmpty();
        assertThat(revokedSessions.size()).isEqualTo(1);

        clock.advance(Duration.ofHours(7));
        revokedSessions.sweep();
        assertThat(revokedSessions.size()).isZero();
    }

    @Test
    void logoutWithGarbageTokenIsHarmless() {
        authService.logout("garbage");
        authService.logout(null);

        assertThat(revokedSessions.size()).isZero();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private interface Attempt {
        Object run() throws Exception;
    }

    private static Throwable causeOf(Attempt attempt) {
        try {
            attempt.run();
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (Exception e) {
            return e;
        }
        throw new AssertionError("expected a failure");
    }
}
