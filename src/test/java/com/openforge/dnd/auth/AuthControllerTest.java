package com.openforge.dnd.auth;

import com.openforge.dnd.account.CredentialStore;
import com.openforge.dnd.auth.dto.ErrorResponse;
import com.openforge.dnd.auth.dto.LoginRequest;
import com.openforge.dnd.domain.Account;
import com.openforge.dnd.domain.Account.Role;
import com.openforge.dnd.support.MutableClock;
import com.openforge.dnd.support.SaturatedHashingLane;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Login status mapping when the hashing lane has no room left.
 */
@ExtendWith(MockitoExtension.class)
class AuthControllerTest {

    @Mock
    private CredentialStore credentialStore;

    private SaturatedHashingLane lane;
    private AuthController       controller;

    @BeforeEach
    void setup() {
        lane = new SaturatedHashingLane();
        MutableClock clock = new MutableClock(Instant.parse("2024-04-09T12:00:00Z"));
        SessionProperties props = new SessionProperties(
                Duration.ofMinutes(360), Duration.ofSeconds(30), null, "login-token", true);
        PasswordHasher hasher = new PasswordHasher(new Argon2PasswordEncoder(16, 32, 1, 1024, 1), lane.bulkhead());
        AuthService authService = new AuthService(credentialStore, hasher, new SessionCodec(props, clock),
                new RevokedSessionRegistry(clock), props, Runnable::run);
        controller = new AuthController(authService, new SessionCookies(props, clock));
    }

    @AfterEach
    void teardown() throws Exception {
        lane.close();
    }

    @Test
    void saturatedLaneAnswersServiceUnavailable() throws Exception {
        Account root = new Account();
        root.setUsername("root");
        root.setPasswordHash("$argon2id$v=19$m=1024,t=1,p=1$c2FsdHNhbHRzYWx0$aGFzaGhhc2hoYXNo");
        root.setRole(Role.ROOT);
        when(credentialStore.getAccount("root")).thenReturn(Optional.of(root));

        ResponseEntity<?> response = controller.login(new LoginRequest("root", "s3cr3t")).get(10, TimeUnit.SECONDS);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isInstanceOf(ErrorResponse.class);
        assertThat(response.getHeaders().get("Set-Cookie")).isNull();
        verify(credentialStore, never()).recordLogin(anyString());
    }
}
