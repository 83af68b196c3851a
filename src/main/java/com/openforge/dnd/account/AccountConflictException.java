package com.openforge.dnd.account;

import lombok.Getter;

/**
 * Thrown when an account with the requested username already exists.
 */
@Getter
public class AccountConflictException extends RuntimeException {

    private final String username;

    public AccountConflictException(String username) {
        super("Account already exists: " + username);
        this.username = username;
    }
}
