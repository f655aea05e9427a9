package com.factory.edge.connector;

import java.time.Instant;

/**
 * Result of a synchronous point read.
 */
public record PointReading(String nodeId, boolean success, Object value, QualityCode quality,
        Instant sourceTimestamp) {

    public static PointReading of(DataChange change) {
        QualityCode q = change.quality() == null ? QualityCode.GOOD : change.quality();
        return new PointReading(change.nodeId(), !q.isBad(), change.value(), q, change.sourceTimestamp());
    }
}
