package com.factory.edge.core.model;

import java.time.Instant;

/**
 * =====================================================================
 * SyncState
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The **mutable / operational** half of a journal event. These fields are
 * excluded from the hash-chain signature so that legitimate delivery
 * bookkeeping never invalidates the chain.
 *
 * STATE MACHINE
 * -------------
 *
 *   PENDING ──markSynced──▶ SYNCED   (terminal, immutable)
 *      │
 *      └─markFailed × maxRetries──▶ DEAD LETTER  (kept for audit,
 *                                                 operator may requeue)
 *
 * {@code synced} is monotonic: once true it never reverts.
 */
public record SyncState(boolean synced, Instant syncedAt, int retryCount, String lastError) {

    public static final SyncState PENDING = new SyncState(false, null, 0, null);

    /**
     * @param maxRetries configured retry cap
     * @return true when the event is excluded from sync candidates
     */
    public boolean isDeadLettered(int maxRetries) {
        return !synced && retryCount >= maxRetries;
    }
}
