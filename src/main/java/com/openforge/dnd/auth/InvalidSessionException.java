package com.openforge.dnd.auth;

import lombok.Getter;

/**
 * A presented session token is not acceptable. Callers treat the request as anonymous.
 */
@Getter
public class InvalidSessionException extends RuntimeException {

    public enum Reason {
        /** Tag did not verify, token malformed, or its fields make no sense. */
        INVALID,
        /** Authentic, but past its expiry. */
        EXPIRED
    }

    private final Reason reason;

    public InvalidSessionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidSessionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
