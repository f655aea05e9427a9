package com.factory.edge.connector;

import java.time.Instant;

/**
 * Snapshot of the connector for health checks and the ops surface.
 */
public record ConnectorStatus(
        String state,
        boolean healthy,
        String endpointUrl,
        int subscribedPoints,
        long reconnectAttempts,
        long eventsEmitted,
        long appendFailures,
        String lastError,
        Instant lastStateChange) {
}
