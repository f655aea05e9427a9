package com.factory.edge.connector;

import java.time.Duration;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.factory.edge.config.FlexibleDurationDeserializer;

/**
 * Binds one data point on the automation server to the asset/metric it
 * reports. Loaded from the tag-map file; validated by {@link TagMappingTable}.
 *
 * @param scaleFactor      multiplied into numeric values; null means 1
 * @param samplingInterval null means the connector's publishing interval
 */
public record TagMapping(
        String nodeId,
        String assetId,
        String metricName,
        Double scaleFactor,
        String unit,
        String lineId,
        @JsonDeserialize(using = FlexibleDurationDeserializer.class) Duration samplingInterval) {

    public boolean scaled() {
        return scaleFactor != null && scaleFactor != 1.0d;
    }

    /** Applies the scale factor to numbers; other values pass through. */
    public Object scale(Object value) {
        if (!scaled() || !(value instanceof Number n)) {
            return value;
        }
        return n.doubleValue() * scaleFactor;
    }
}
