package com.factory.edge.core.model;

import java.time.Instant;

/**
 * One consultation of a trusted time source.
 *
 * @param localTime     local clock at the time of the check
 * @param serverTime    time reported by the trusted source
 * @param offsetMs      {@code serverTime - localTime} in milliseconds
 * @param driftExceeded whether {@code |offsetMs|} is above the configured threshold
 */
public record ClockSample(Instant localTime, Instant serverTime, long offsetMs, boolean driftExceeded) {
}
