package com.openforge.dnd.account;

import com.openforge.dnd.domain.Account;
import com.openforge.dnd.domain.Account.Role;
import com.openforge.dnd.repository.AccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owner of the accounts table.
 *
 * SQLite connections must not be used by two threads at once, so every operation runs
 * behind one fair lock that is held for the whole transaction. The lock is taken before
 * the transaction opens and released after it commits or rolls back, which gives all
 * reads and writes a single total order.
 */
@Slf4j
@Service
public class CredentialStore {

    private final AccountRepository   accountRepository;
    private final TransactionTemplate tx;
    private final Clock               clock;
    private final ReentrantLock       gate = new ReentrantLock(true);

    public CredentialStore(AccountRepository accountRepository,
                           PlatformTransactionManager transactionManager,
                           Clock clock) {
        this.accountRepository = accountRepository;
        this.tx                = new TransactionTemplate(transactionManager);
        this.clock             = clock;
    }

    /**
     * Insert a new {@link Role#USER} account.
     *
     * @throws AccountConflictException    if the username is taken
     * @throws StorageUnavailableException if the database fails
     */
    public Account createAccount(String username, String passwordHash) {
        return createAccount(username, passwordHash, Role.USER);
    }

    /**
     * Insert a new account in one transaction. A failed attempt leaves any existing row
     * with the same username untouched.
     *
     * @throws AccountConflictException    if the username is taken
     * @throws StorageUnavailableException if the database fails
     */
    public Account createAccount(String username, String passwordHash, Role role) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username must not be blank");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalArgumentException("passwordHash must not be blank");
        }

        Account created = guarded("create account '" + username + "'", () -> {
            if (accountRepository.existsByUsername(username)) {
                throw new AccountConflictException(username);
            }
            Account account = new Account();
            account.setUsername(username);
            account.setPasswordHash(passwordHash);
            account.setRole(role);
            try {
                return accountRepository.saveAndFlush(account);
            } catch (DataIntegrityViolationException e) {
                // The unique index caught a duplicate the existence check did not see.
                log.debug("[Accounts] Unique index rejected username={}", username, e);
                throw new AccountConflictException(username);
            }
        });
        log.info("[Accounts] Created account username={} role={}", created.getUsername(), created.getRole());
        return created;
    }

    /** Look up an account; empty when absent. */
    public Optional<Account> getAccount(String username) {
        if (username == null || username.isEmpty()) {
            return Optional.empty();
        }
        return guarded("read account '" + username + "'",
                () -> accountRepository.findByUsername(username));
    }

    public boolean exists(String username) {
        return guarded("check account '" + username + "'",
                () -> accountRepository.existsByUsername(username));
    }

    /** Whether at least one account holds {@code role}. */
    public boolean existsWithRole(Role role) {
        return guarded("check for " + role + " account",
                () -> accountRepository.existsByRole(role));
    }

    /** Stamp the last successful login. A vanished account is ignored. */
    public void recordLogin(String username) {
        guarded("record login of '" + username + "'", () -> {
            accountRepository.findByUsername(username).ifPresent(account -> {
                account.setLastLoginTime(LocalDateTime.now(clock));
                accountRepository.save(account);
            });
            return null;
        });
    }

    public long count() {
        return guarded("count accounts", accountRepository::count);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private <T> T guarded(String what, Supplier<T> work) {
        gate.lock();
        try {
            return tx.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("[Accounts] Storage failure during {}", what, e);
            throw new StorageUnavailableException("Failed to " + what, e);
        } finally {
            gate.unlock();
        }
    }
}
