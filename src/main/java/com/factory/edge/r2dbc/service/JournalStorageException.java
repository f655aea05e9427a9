package com.factory.edge.r2dbc.service;

/**
 * The embedded store failed to persist or read journal state. Propagated to
 * the caller; never swallowed.
 */
public class JournalStorageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public JournalStorageException(String message) {
        super(message);
    }

    public JournalStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
