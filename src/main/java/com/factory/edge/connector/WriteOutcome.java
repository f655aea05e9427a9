package com.factory.edge.connector;

/** Result of a point write; {@code status} is the server's StatusCode. */
public record WriteOutcome(String nodeId, boolean success, QualityCode status) {
}
