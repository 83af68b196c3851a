package com.openforge.dnd.auth;

import com.openforge.dnd.domain.Account.Role;

import java.time.Instant;

/**
 * The authenticated contents of a session token.
 */
public record SessionClaims(
        String  subject,
        Role    role,
        String  tokenId,
        Instant issuedAt,
        Instant expiresAt
) {}
