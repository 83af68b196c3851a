package com.openforge.dnd.account;

import com.openforge.dnd.auth.PasswordHasher;
import com.openforge.dnd.config.AppConfig;
import com.openforge.dnd.domain.Account;
import com.openforge.dnd.domain.Account.Role;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Account provisioning for the root user.
 *
 * Base path: /v1/accounts (ROOT only, enforced in SecurityConfig)
 */
@Slf4j
@RestController
@RequestMapping("/v1/accounts")
public class AccountController {

    private final CredentialStore credentialStore;
    private final PasswordHasher  passwordHasher;
    private final Executor        accountIoExecutor;

    public AccountController(CredentialStore credentialStore,
                             PasswordHasher passwordHasher,
                             @Qualifier(AppConfig.ACCOUNT_IO_EXECUTOR) Executor accountIoExecutor) {
        this.credentialStore   = credentialStore;
        this.passwordHasher    = passwordHasher;
        this.accountIoExecutor = accountIoExecutor;
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    public record CreateAccountRequest(
            @NotBlank @Size(max = 64) @Pattern(regexp = "\\S+") String username,
            @NotBlank @Size(min = 8, max = 1024)                 String password
    ) {
        @Override
        public String toString() {
            return "CreateAccountRequest[username=" + username + ", password=***]";
        }
    }

    public record AccountResponse(
            String        username,
            Role          role,
            LocalDateTime createTime
    ) {}

    // ── Create ────────────────────────────────────────────────────────────────

    @PostMapping
    public CompletableFuture<ResponseEntity<AccountResponse>> create(@Valid @RequestBody CreateAccountRequest req) {
        CompletableFuture<String> hashing;
        try {
            hashing = passwordHasher.hashAsync(req.password());
        } catch (BulkheadFullException e) {
            log.warn("[Accounts] Hashing lane saturated, shedding creation of '{}'", req.username());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Too many concurrent requests, retry shortly");
        }

        return hashing.thenApplyAsync(hash -> {
            try {
                Account account = credentialStore.createAccount(req.username(), hash);
                return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(account));
            } catch (AccountConflictException e) {
                throw new ResponseStatusException(HttpStatus.CONFLICT, "Account already exists");
            } catch (StorageUnavailableException e) {
                throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to create account");
            }
        }, accountIoExecutor);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private AccountResponse toResponse(Account account) {
        return new AccountResponse(account.getUsername(), account.getRole(), account.getCreateTime());
    }
}
