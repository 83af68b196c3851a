package com.openforge.dnd.config;

/**
 * TLS is enabled but the certificate or key cannot be used. Fatal at startup.
 */
public class TlsConfigException extends RuntimeException {

    public TlsConfigException(String message) {
        super(message);
    }
}
