package com.factory.edge.connector;

/** The server did not answer within the request timeout. */
public class OperationTimeoutException extends PointAccessException {

    private static final long serialVersionUID = 1L;

    public OperationTimeoutException(String nodeId, String message) {
        super(nodeId, message);
    }

    public OperationTimeoutException(String nodeId, String message, Throwable cause) {
        super(nodeId, message, cause);
    }
}
