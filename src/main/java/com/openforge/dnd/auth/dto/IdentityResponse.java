package com.openforge.dnd.auth.dto;

import com.openforge.dnd.domain.Account.Role;

import java.time.Instant;

public record IdentityResponse(
        String  username,
        Role    role,
        Instant sessionExpiresAt
) {
}
