package com.factory.edge.core.ingest;

import java.util.List;

import com.factory.edge.core.model.JournalEvent;

import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * IngestionClient
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Transport-agnostic port to the remote ingestion endpoint.
 *
 * The sync worker depends ONLY on this interface. Implementations:
 *  - HTTP (WebClient, default)
 *  - JetStream (Msg-Id deduplication)
 *
 * CONTRACT
 * --------
 * - Events are submitted in the given (ascending localId) order
 * - The remote side is idempotent on eventId; re-delivery is expected
 * - The returned Mono emits per-event outcomes, or errors when the batch as
 *   a whole could not be delivered
 * - An event missing from the response counts as rejected
 */
public interface IngestionClient {

    Mono<IngestResponse> ingest(List<JournalEvent> batch);
}
