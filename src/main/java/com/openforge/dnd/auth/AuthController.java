package com.openforge.dnd.auth;

import com.openforge.dnd.account.StorageUnavailableException;
import com.openforge.dnd.auth.dto.AuthResponse;
import com.openforge.dnd.auth.dto.ErrorResponse;
import com.openforge.dnd.auth.dto.IdentityResponse;
import com.openforge.dnd.auth.dto.LoginRequest;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Session endpoints.
 *
 *   POST /v1/login  : check credentials, set the session cookie
 *   POST /v1/logout : clear the session cookie (and denylist the token)
 *   GET  /v1/me     : who the current session belongs to
 *
 * Login completes asynchronously: the Tomcat thread is released while Argon2 runs on the
 * hashing lane.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService    authService;
    private final SessionCookies sessionCookies;

    // ── Login ────────────────────────────────────────────────────────────────

    @PostMapping("/login")
    public CompletableFuture<ResponseEntity<?>> login(@Valid @RequestBody LoginRequest req) {
        CompletableFuture<LoginResult> pending;
        try {
            pending = authService.login(req.username(), req.password());
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }

        return pending.<ResponseEntity<?>>handle((result, error) -> {
            if (error == null) {
                return ResponseEntity.ok()
                        .header(HttpHeaders.SET_COOKIE, sessionCookies.issue(result.session()).toString())
                        .body(new AuthResponse(result.username(), result.role(), result.session().claims().expiresAt()));
            }
            return loginFailure(req.username(), error);
        });
    }

    // ── Logout ───────────────────────────────────────────────────────────────

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(HttpServletRequest request) {
        sessionCookies.read(request).ifPresent(authService::logout);
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, sessionCookies.clear().toString())
                .build();
    }

    // ── Identity ─────────────────────────────────────────────────────────────

    @GetMapping("/me")
    public IdentityResponse me(@AuthenticationPrincipal AuthenticatedAccount account) {
        return new IdentityResponse(account.username(), account.role(), account.session().expiresAt());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private ResponseEntity<?> loginFailure(String username, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;

        if (cause instanceof InvalidCredentialsException) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(ErrorResponse.unauthorized(InvalidCredentialsException.MESSAGE));
        }
        if (cause instanceof BulkheadFullException) {
            log.warn("[Auth] Hashing lane saturated, shedding login of '{}'", username);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ErrorResponse("Service Unavailable", "Too many concurrent logins, retry shortly"));
        }
        if (!(cause instanceof StorageUnavailableException)) {
            log.error("[Auth] Login of '{}' failed unexpectedly", username, cause);
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Internal Server Error", "Login failed"));
    }
}
