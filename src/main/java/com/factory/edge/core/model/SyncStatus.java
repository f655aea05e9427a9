package com.factory.edge.core.model;

import java.time.Instant;

/**
 * Singleton delivery aggregate. Written only through the journal's
 * {@code markSynced} / {@code markFailed}; read by health and ops tooling.
 *
 * @param lastSyncedLocalId highest local id ever marked synced (never decreases)
 * @param lastSyncAt        time of the last successful mark, null before the first
 * @param totalSynced       events newly marked synced, cumulative
 * @param totalFailed       failed delivery attempts recorded, cumulative
 * @param updatedAt         last time any counter changed
 */
public record SyncStatus(
        long lastSyncedLocalId,
        Instant lastSyncAt,
        long totalSynced,
        long totalFailed,
        Instant updatedAt) {
}
