package com.openforge.dnd.config;

import com.openforge.dnd.account.CredentialStore;
import com.openforge.dnd.account.StorageUnavailableException;
import com.openforge.dnd.auth.HashingLaneProperties;
import com.openforge.dnd.auth.PasswordProperties;
import com.openforge.dnd.auth.SessionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - SQLite: counts accounts through the credential store, which proves the file is usable
 *     (root was seeded before this runs)
 *   - TLS, session and Argon2 settings (never the key or any password)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final CredentialStore       credentialStore;
    private final TlsProperties         tlsProperties;
    private final SessionProperties     sessionProperties;
    private final PasswordProperties    passwordProperties;
    private final HashingLaneProperties hashingLaneProperties;
    private final Environment           env;

    @Override
    public void run(ApplicationArguments args) {
        String port        = env.getProperty("local.server.port", env.getProperty("server.port", "8443"));
        String clientPath  = env.getProperty("dnd.client-path", "(none)");
        String version     = env.getProperty("dnd.version", "?");

        log.info("""

                ==============================================================
                  dnd-server {}  -  Startup Summary
                --------------------------------------------------------------
                  Server
                    Port           : {}
                    TLS            : {}
                    Client files   : {}
                    Java Version   : {}
                --------------------------------------------------------------
                  Database (SQLite)
                    URL            : {}
                    Accounts       : {}
                --------------------------------------------------------------
                  Sessions
                    Cookie         : {}  ttl={}  skew={}
                    Key            : {}
                    Revoke on logout: {}
                --------------------------------------------------------------
                  Password hashing (Argon2id)
                    m={}KiB t={} p={}  lane threads={} queue={}
                ==============================================================
                """,
                version,
                port,
                tlsProperties.enabled() ? "enabled (" + tlsProperties.certificate() + ")" : "DISABLED",
                clientPath,
                System.getProperty("java.version"),

                env.getProperty("spring.datasource.url"),
                countAccounts(),

                sessionProperties.cookieName(), sessionProperties.ttl(), sessionProperties.clockSkew(),
                sessionProperties.secret() == null || sessionProperties.secret().isBlank() ? "generated at startup" : "configured",
                sessionProperties.revokeOnLogout(),

                passwordProperties.memoryKib(), passwordProperties.iterations(), passwordProperties.parallelism(),
                hashingLaneProperties.effectiveThreads(), hashingLaneProperties.queueCapacity()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String countAccounts() {
        try {
            return String.valueOf(credentialStore.count());
        } catch (StorageUnavailableException e) {
            return "unknown (" + e.getMessage() + ")";
        }
    }
}
