package com.openforge.dnd.auth;

import com.openforge.dnd.auth.InvalidSessionException.Reason;
import com.openforge.dnd.domain.Account.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and validates session tokens.
 *
 * A token is a compact JWE (alg=dir, enc=A256GCM): the claims are encrypted and the whole
 * token, header included, is covered by the GCM tag. JJWT checks the tag before it
 * deserializes the payload, so nothing an attacker wrote is interpreted unless it came
 * from this key.
 *
 * Every segment must be in canonical unpadded base64url. The decoder ignores the unused
 * low bits of a segment's last character, so without this check a few altered tokens
 * would decode to the original bytes and still pass the tag.
 *
 * The key is read from {@code dnd.session.secret} when present, otherwise generated at
 * startup and lost on restart (all sessions end with the process).
 */
@Slf4j
@Component
public class SessionCodec {

    static final String ROLE_CLAIM = "role";

    private static final int KEY_BYTES = 32;

    private static final Base64.Decoder SEGMENT_DECODER = Base64.getUrlDecoder();
    private static final Base64.Encoder SEGMENT_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecretKey key;
    private final Duration  ttl;
    private final Duration  clockSkew;
    private final Clock     clock;
    private final JwtParser parser;

    public SessionCodec(SessionProperties props, Clock clock) {
        this.key       = resolveKey(props.secret());
        this.ttl       = props.ttl();
        this.clockSkew = props.clockSkew();
        this.clock     = clock;
        this.parser    = Jwts.parser()
                .decryptWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    /** Issue a token with the configured lifetime. */
    public IssuedSession issue(String subject, Role role) {
        return issue(subject, role, ttl);
    }

    public IssuedSession issue(String subject, Role role, Duration lifetime) {
        if (subject == null || subject.isEmpty()) {
            throw new IllegalArgumentException("subject must not be empty");
        }
        // JWT NumericDate has second precision
        Instant issuedAt  = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(lifetime);
        String  tokenId   = UUID.randomUUID().toString();

        String token = Jwts.builder()
                .subject(subject)
                .claim(ROLE_CLAIM, role.name())
                .id(tokenId)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .encryptWith(key, Jwts.ENC.A256GCM)
                .compact();

        return new IssuedSession(token, new SessionClaims(subject, role, tokenId, issuedAt, expiresAt));
    }

    /**
     * Authenticate, decrypt and check a token.
     *
     * @throws InvalidSessionException with {@link Reason#EXPIRED} past expiry, otherwise
     *         {@link Reason#INVALID} for anything that is not a well-formed token from this key
     */
    public SessionClaims validate(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidSessionException(Reason.INVALID, "Empty session token");
        }
        requireCanonicalSegments(token);

        Claims claims;
        try {
            claims = parser.parseEncryptedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new InvalidSessionException(Reason.EXPIRED,
                    "Session for '" + e.getClaims().getSubject() + "' expired at " + e.getClaims().getExpiration().toInstant(), e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidSessionException(Reason.INVALID, "Session token rejected: " + e.getMessage(), e);
        }

        String subject = claims.getSubject();
        Date   issued  = claims.getIssuedAt();
        Date   expires = claims.getExpiration();
        String tokenId = claims.getId();
        String role    = claims.get(ROLE_CLAIM, String.class);
        if (subject == null || subject.isEmpty() || issued == null || expires == null
                || tokenId == null || role == null) {
            throw new InvalidSessionException(Reason.INVALID, "Session token is missing required claims");
        }

        Instant issuedAt = issued.toInstant();
        if (issuedAt.isAfter(clock.instant().plus(clockSkew))) {
            throw new InvalidSessionException(Reason.INVALID,
                    "Session for '" + subject + "' issued in the future (" + issuedAt + ")");
        }

        Role parsedRole;
        try {
            parsedRole = Role.valueOf(role);
        } catch (IllegalArgumentException e) {
            throw new InvalidSessionException(Reason.INVALID, "Session carries unknown role '" + role + "'", e);
        }

        return new SessionClaims(subject, parsedRole, tokenId, issuedAt, expires.toInstant());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static void requireCanonicalSegments(String token) {
        for (String segment : token.split("\\.", -1)) {
            String canonical;
            try {
                canonical = SEGMENT_ENCODER.encodeToString(SEGMENT_DECODER.decode(segment));
            } catch (IllegalArgumentException e) {
                throw new InvalidSessionException(Reason.INVALID, "Session token segment is not base64url", e);
            }
            if (!canonical.equals(segment)) {
                throw new InvalidSessionException(Reason.INVALID, "Session token segment is not canonically encoded");
            }
        }
    }

    private static SecretKey resolveKey(String secret) {
        if (secret == null || secret.isBlank()) {
            log.info("[Session] No dnd.session.secret configured, generating a process-local key");
            return Jwts.ENC.A256GCM.key().build();
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(secret.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("dnd.session.secret is not valid Base64", e);
        }
        if (raw.length != KEY_BYTES) {
            throw new IllegalStateException(
                    "dnd.session.secret must decode to " + KEY_BYTES + " bytes, got " + raw.length);
        }
        log.info("[Session] Using configured session key");
        return new SecretKeySpec(raw, "AES");
    }
}
