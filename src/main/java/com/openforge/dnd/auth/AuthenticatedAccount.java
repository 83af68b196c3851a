package com.openforge.dnd.auth;

import com.openforge.dnd.domain.Account.Role;

/**
 * Principal placed in the SecurityContext for a request that carried a valid session.
 */
public record AuthenticatedAccount(String username, Role role, SessionClaims session) {}
