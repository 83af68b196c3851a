package com.openforge.dnd.auth;

/**
 * Login failed. Deliberately carries no detail: unknown user and wrong password look the same.
 */
public class InvalidCredentialsException extends RuntimeException {

    public static final String MESSAGE = "Invalid credentials";

    public InvalidCredentialsException() {
        super(MESSAGE);
    }
}
