package com.dikit.core.migrate;

/**
 * Raised when the connection string is absent, malformed or uses an unsupported scheme.
 */
public class ConnectionSettingsException extends RuntimeException {

    public ConnectionSettingsException(String message) {
        super(message);
    }

    public ConnectionSettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
