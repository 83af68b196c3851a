package com.openforge.dnd.auth;

/**
 * A freshly minted token together with what it asserts.
 */
public record IssuedSession(String token, SessionClaims claims) {}
