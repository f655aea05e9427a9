package com.factory.edge.connector;

import java.time.Instant;

/**
 * One value-change notification from a monitored data point.
 *
 * @param value           already normalized to a JSON-friendly Java type
 * @param sourceTimestamp may be null when the server does not report one
 */
public record DataChange(String nodeId, Object value, QualityCode quality, Instant sourceTimestamp) {
}
