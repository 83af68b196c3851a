package com.openforge.dnd.account;

/**
 * The embedded database failed underneath a credential store operation.
 * Fatal to the current request only; the message is for the server log, not the client.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
