package com.openforge.dnd.bootstrap;

/**
 * No root account exists and none could be created. The server must not start.
 */
public class BootstrapException extends RuntimeException {

    public BootstrapException(String message) {
        super(message);
    }

    public BootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
