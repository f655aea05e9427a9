package com.factory.edge.core.ingest;

/**
 * Remote verdict for one event.
 *
 * @param reason rejection reason; null when accepted
 */
public record IngestResult(String eventId, boolean accepted, String reason) {

    public static IngestResult accepted(String eventId) {
        return new IngestResult(eventId, true, null);
    }

    public static IngestResult rejected(String eventId, String reason) {
        return new IngestResult(eventId, false, reason);
    }
}
