package com.factory.edge.core.ingest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-event outcomes of one batch.
 */
public record IngestResponse(List<IngestResult> results) {

    public IngestResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }

    /** Last verdict wins when the remote side repeats an eventId. */
    public Map<String, IngestResult> byEventId() {
        Map<String, IngestResult> out = new LinkedHashMap<>();
        for (IngestResult r : results) {
            if (r != null && r.eventId() != null) {
                out.put(r.eventId(), r);
            }
        }
        return out;
    }

    public Optional<IngestResult> find(String eventId) {
        return Optional.ofNullable(byEventId().get(eventId));
    }
}
