package com.factory.edge.connector;

/**
 * Server certificate failed trust-list validation, or a secured endpoint was
 * requested without trust material. Never retried.
 */
public class CertificateRejectedException extends ConnectionException {

    private static final long serialVersionUID = 1L;

    public CertificateRejectedException(String message) {
        super(message);
    }

    public CertificateRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
