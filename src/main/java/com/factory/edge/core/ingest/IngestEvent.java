package com.factory.edge.core.ingest;

import java.time.format.DateTimeFormatter;
import java.util.Map;

import com.factory.edge.core.model.JournalEvent;

/**
 * Wire form of a journal event: the full signed record, so the remote side
 * can re-verify the chain.
 *
 * {@code timestamp} is rendered exactly as it was signed (ISO-8601 UTC).
 */
public record IngestEvent(
        String eventId,
        long localId,
        String timestamp,
        String assetId,
        String lineId,
        String type,
        Map<String, Object> data,
        String signature,
        String previousSignature) {

    public static IngestEvent of(JournalEvent e) {
        return new IngestEvent(e.eventId(), e.localId(), DateTimeFormatter.ISO_INSTANT.format(e.record().timestamp()),
                e.record().assetId(), e.record().lineId(), e.record().type(), e.record().data(), e.signature(),
                e.previousSignature());
    }
}
