package com.factory.edge.sync;

import com.factory.edge.core.model.ClockSample;

/**
 * Published when the local clock is further from the trusted time source than
 * {@code edge.journal.drift-threshold}.
 */
public record ClockDriftDetectedEvent(ClockSample sample) {
}
