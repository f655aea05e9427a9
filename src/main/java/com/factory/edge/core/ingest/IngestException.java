package com.factory.edge.core.ingest;

/**
 * A batch could not be delivered to the remote ingestion endpoint (transport
 * error, non-2xx response, malformed response). Recoverable: the worker
 * records a failed attempt for every event in the batch.
 */
public class IngestException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
