package com.factory.edge.jetstream.publisher;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.factory.edge.core.ingest.IngestEvent;
import com.factory.edge.core.ingest.IngestResponse;
import com.factory.edge.core.ingest.IngestResult;
import com.factory.edge.core.ingest.IngestionClient;
import com.factory.edge.core.model.JournalEvent;
import com.factory.edge.jetstream.naming.IngestSubject;

import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.Message;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsMessage;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * =====================================================================
 * JetStreamIngestionClient
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Delivers journal events into a JetStream stream that the central system
 * consumes.
 *
 * IDEMPOTENCY
 * -----------
 * Every message carries {@code Nats-Msg-Id = eventId}. A redelivered event
 * inside the stream's duplicate window is acknowledged as a duplicate and not
 * stored twice; it still counts as accepted.
 *
 * ORDERING
 * --------
 * Events are published one by one in ascending localId. The first failure
 * rejects the rest of the batch so that a later event is never accepted ahead
 * of an earlier one.
 */
public class JetStreamIngestionClient implements IngestionClient {

    private static final Logger log = LoggerFactory.getLogger(JetStreamIngestionClient.class);

    static final String HDR_NODE_ID = "Edge-Node-Id";
    static final String HDR_LOCAL_ID = "Edge-Local-Id";

    private final JetStream js;
    private final IngestSubject subjects;
    private final String nodeId;
    private final String stream;
    private final ObjectMapper mapper;

    public JetStreamIngestionClient(JetStream js, IngestSubject subjects, String nodeId, String stream,
                                    ObjectMapper mapper) {
        this.js = js;
        this.subjects = subjects;
        this.nodeId = nodeId;
        this.stream = stream;
        this.mapper = mapper;
    }

    @Override
    public Mono<IngestResponse> ingest(List<JournalEvent> batch) {
        return Mono.fromCallable(() -> publishInOrder(batch))
                // blocking publish + ack wait
                .subscribeOn(Schedulers.boundedElastic());
    }

    private IngestResponse publishInOrder(List<JournalEvent> batch) {
        List<IngestResult> results = new ArrayList<>(batch.size());
        String failure = null;

        for (JournalEvent event : batch) {
            if (failure != null) {
                results.add(IngestResult.rejected(event.eventId(), "not attempted: " + failure));
                continue;
            }
            try {
                PublishAck ack = js.publish(toMessage(event), PublishOptions.builder()
                        .messageId(event.eventId())
                        .expectedStream(stream)
                        .build());
                if (ack.isDuplicate()) {
                    log.debug("Event {} already in stream {} (duplicate seq={})", event.eventId(), ack.getStream(),
                            ack.getSeqno());
                }
                results.add(IngestResult.accepted(event.eventId()));
            } catch (IOException | JetStreamApiException e) {
                failure = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.warn("Publish of event {} (localId={}) failed: {}", event.eventId(), event.localId(), failure);
                results.add(IngestResult.rejected(event.eventId(), failure));
            }
        }
        return new IngestResponse(results);
    }

    private Message toMessage(JournalEvent event) throws JsonProcessingException {
        Headers headers = new Headers();
        headers.add(HDR_NODE_ID, nodeId);
        headers.add(HDR_LOCAL_ID, String.valueOf(event.localId()));

        return NatsMessage.builder()
                .subject(subjects.forAsset(event.record().assetId()))
                .headers(headers)
                .data(mapper.writeValueAsBytes(IngestEvent.of(event)))
                .build();
    }
}
