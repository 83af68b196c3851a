package com.openforge.dnd.auth;

import com.openforge.dnd.domain.Account.Role;

/**
 * Outcome of a successful login: who logged in and the session minted for them.
 */
public record LoginResult(String username, Role role, IssuedSession session) {}
