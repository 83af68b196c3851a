package com.openforge.dnd.auth;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory denylist of logged-out token ids.
 *
 * An entry only needs to live until the token would have expired anyway, so the sweep
 * drops everything whose expiry has passed. The list is process-local like the session
 * key itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RevokedSessionRegistry {

    private final ConcurrentHashMap<String, Instant> revoked = new ConcurrentHashMap<>();
    private final Clock clock;

    public void revoke(SessionClaims claims) {
        if (claims.expiresAt().isAfter(clock.instant())) {
            revoked.put(claims.tokenId(), claims.expiresAt());
        }
    }

    public boolean isRevoked(String tokenId) {
        return tokenId != null && revoked.containsKey(tokenId);
    }

    public int size() {
        return revoked.size();
    }

    @Scheduled(fixedDelayString = "${dnd.session.revocation-sweep:PT5M}")
    public void sweep() {
        Instant now = clock.instant();
        int before = revoked.size();
        revoked.values().removeIf(expiresAt -> !expiresAt.isAfter(now));
        int removed = before - revoked.size();
        if (removed > 0) {
            log.debug("[Session] Swept {} expired revocations, {} remain", removed, revoked.size());
        }
    }
}
