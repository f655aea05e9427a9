package com.factory.edge.connector;

/** The node does not exist in the server address space. */
public class NodeNotFoundException extends PointAccessException {

    private static final long serialVersionUID = 1L;

    public NodeNotFoundException(String nodeId, String message) {
        super(nodeId, message);
    }

    public NodeNotFoundException(String nodeId, String message, Throwable cause) {
        super(nodeId, message, cause);
    }
}
