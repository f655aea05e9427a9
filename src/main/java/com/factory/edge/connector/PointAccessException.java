package com.factory.edge.connector;

/**
 * Base type for failures of a single read/write/browse against a data point.
 */
public class PointAccessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String nodeId;

    public PointAccessException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public PointAccessException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
