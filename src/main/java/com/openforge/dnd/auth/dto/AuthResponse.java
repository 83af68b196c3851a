package com.openforge.dnd.auth.dto;

import com.openforge.dnd.domain.Account.Role;

import java.time.Instant;

/**
 * Body of a successful login. The token itself only travels in the cookie.
 */
public record AuthResponse(
        String  username,
        Role    role,
        Instant expiresAt
) {
}
