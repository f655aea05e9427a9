package com.factory.edge.sync;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.factory.edge.config.EdgeNodeProperties;
import com.factory.edge.config.SyncWorkerProperties;
import com.factory.edge.core.ingest.IngestBatch;
import com.factory.edge.core.ingest.IngestEvent;
import com.factory.edge.core.ingest.IngestException;
import com.factory.edge.core.ingest.IngestResponse;
import com.factory.edge.core.ingest.IngestionClient;
import com.factory.edge.core.model.JournalEvent;

import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * HttpIngestionClient
 * =====================================================================
 *
 * POST {base-url}{ingest-path}
 *
 * <pre>
 * request:  { "nodeId": "...", "siteId": "...",
 *             "events": [ { eventId, localId, timestamp, assetId, lineId,
 *                           type, data, signature, previousSignature } ] }
 * response: { "results": [ { "eventId": "...", "accepted": true,
 *                            "reason": null } ] }
 * </pre>
 *
 * Non-2xx responses and transport errors surface as {@link IngestException};
 * the caller applies the request timeout.
 */
public class HttpIngestionClient implements IngestionClient {

    private static final Logger log = LoggerFactory.getLogger(HttpIngestionClient.class);

    private static final int MAX_BODY_IN_ERROR = 300;

    private final WebClient webClient;
    private final EdgeNodeProperties node;
    private final SyncWorkerProperties props;

    public HttpIngestionClient(WebClient webClient, EdgeNodeProperties node, SyncWorkerProperties props) {
        this.webClient = webClient;
        this.node = node;
        this.props = props;
    }

    @Override
    public Mono<IngestResponse> ingest(List<JournalEvent> batch) {
        if (batch.isEmpty()) {
            return Mono.just(new IngestResponse(List.of()));
        }
        IngestBatch body = new IngestBatch(node.getNodeId(), node.getSiteId(),
                batch.stream().map(IngestEvent::of).toList());

        return webClient.post()
                .uri(props.getIngestPath())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> new IngestException("Ingestion endpoint returned "
                                + response.statusCode().value() + ": " + abbreviate(text))))
                .bodyToMono(IngestResponse.class)
                .switchIfEmpty(Mono.error(() -> new IngestException("Ingestion endpoint returned an empty body")))
                .onErrorMap(e -> !(e instanceof IngestException),
                        e -> new IngestException("Ingestion request failed: " + e.getMessage(), e))
                .doOnNext(r -> log.debug("Ingestion answered {} verdict(s) for {} event(s)", r.results().size(),
                        batch.size()));
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_BODY_IN_ERROR ? text : text.substring(0, MAX_BODY_IN_ERROR) + "...";
    }
}
