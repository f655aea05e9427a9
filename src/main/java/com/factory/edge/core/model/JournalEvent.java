package com.factory.edge.core.model;

import java.util.Objects;

/**
 * A persisted journal row: the signed {@link EventRecord}, its position in the
 * hash chain, and the operational {@link SyncState}.
 *
 * <p>{@code localId} is assigned by the journal's single writer and gives the
 * total order used for replay, sync and chain verification.</p>
 */
public record JournalEvent(
        long localId,
        EventRecord record,
        String signature,
        String previousSignature,
        SyncState sync) {

    public JournalEvent {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(previousSignature, "previousSignature");
        sync = sync == null ? SyncState.PENDING : sync;
    }

    public String eventId() {
        return record.eventId();
    }
}
