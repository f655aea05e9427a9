package com.factory.edge.connector;

/** No active session, or the server closed it. */
public class SessionInvalidException extends PointAccessException {

    private static final long serialVersionUID = 1L;

    public SessionInvalidException(String nodeId, String message) {
        super(nodeId, message);
    }

    public SessionInvalidException(String nodeId, String message, Throwable cause) {
        super(nodeId, message, cause);
    }
}
