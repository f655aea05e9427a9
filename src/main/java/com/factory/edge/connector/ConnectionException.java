package com.factory.edge.connector;

/**
 * The automation server could not be reached, or a session/subscription could
 * not be established within the allowed reconnect attempts.
 */
public class ConnectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
