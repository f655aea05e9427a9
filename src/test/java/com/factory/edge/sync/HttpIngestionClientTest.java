package com.factory.edge.sync;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import com.factory.edge.config.EdgeNodeProperties;
import com.factory.edge.config.SyncWorkerProperties;
import com.factory.edge.core.chain.ChainSigner;
import com.factory.edge.core.ingest.IngestException;
import com.factory.edge.core.ingest.IngestResponse;
import com.factory.edge.core.model.EventRecord;
import com.factory.edge.core.model.JournalEvent;
import com.factory.edge.core.model.SyncState;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class HttpIngestionClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private final SyncWorkerProperties props = new SyncWorkerProperties();
    private final EdgeNodeProperties node = new EdgeNodeProperties();

    private WebClient webClient(Mono<ClientResponse> response) {
        return WebClient.builder()
                .baseUrl("http://cloud.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return response;
                })
                .build();
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private static JournalEvent event(long localId, String eventId) {
        EventRecord r = new EventRecord(eventId, Instant.parse("2024-03-01T08:00:00.500Z"), "press-1", "line-1",
                EventRecord.TYPE_TELEMETRY, Map.of("temperature", 21.5));
        return new JournalEvent(localId, r, "ab".repeat(32), ChainSigner.GENESIS, SyncState.PENDING);
    }

    @Test
    void postsBatchAndParsesVerdicts() {
        String body = "{\"results\":[{\"eventId\":\"e-1\",\"accepted\":true},"
                + "{\"eventId\":\"e-2\",\"accepted\":false,\"reason\":\"bad signature\"}]}";
        HttpIngestionClient client = new HttpIngestionClient(webClient(Mono.just(json(HttpStatus.OK, body))), node,
                props);

        IngestResponse response = client.ingest(List.of(event(1, "e-1"), event(2, "e-2"))).block();

        assertThat(response.find("e-1")).hasValueSatisfying(r -> assertThat(r.accepted()).isTrue());
        assertThat(response.find("e-2")).hasValueSatisfying(r -> assertThat(r.reason()).isEqualTo("bad signature"));

        ClientRequest sent = requests.get(0);
        assertThat(sent.method()).isEqualTo(HttpMethod.POST);
        assertThat(sent.url().toString()).isEqualTo("http://cloud.test/api/v1/ingest/events");
        assertThat(bodyOf(sent))
                .contains("\"nodeId\":\"edge-01\"")
                .contains("\"siteId\":\"site-01\"")
                .contains("\"timestamp\":\"2024-03-01T08:00:00.500Z\"")
                .contains("\"previousSignature\":\"" + ChainSigner.GENESIS + "\"")
                .contains("\"localId\":2");
    }

    @Test
    void errorStatusBecomesIngestException() {
        HttpIngestionClient client = new HttpIngestionClient(
                webClient(Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "maintenance"))), node, props);

        StepVerifier.create(client.ingest(List.of(event(1, "e-1"))))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(IngestException.class)
                        .hasMessage("Ingestion endpoint returned 503: maintenance"))
                .verify();
    }

    @Test
    void longErrorBodiesAreAbbreviated() {
        HttpIngestionClient client = new HttpIngestionClient(
                webClient(Mono.just(json(HttpStatus.BAD_REQUEST, "x".repeat(1000)))), node, props);

        StepVerifier.create(client.ingest(List.of(event(1, "e-1"))))
                .expectErrorSatisfies(e -> assertThat(e.getMessage()).hasSize(
                        "Ingestion endpoint returned 400: ".length() + 300 + "...".length()))
                .verify();
    }

    @Test
    void emptyBodyIsAnError() {
        ClientResponse empty = ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        HttpIngestionClient client = new HttpIngestionClient(webClient(Mono.just(empty)), node, props);

        StepVerifier.create(client.ingest(List.of(event(1, "e-1"))))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(IngestException.class)
                        .hasMessageContaining("empty body"))
                .verify();
    }

    @Test
    void transportErrorIsWrapped() {
        HttpIngestionClient client = new HttpIngestionClient(
                webClient(Mono.error(new IllegalStateException("Connection refused"))), node, props);

        StepVerifier.create(client.ingest(List.of(event(1, "e-1"))))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(IngestException.class)
                        .hasMessageContaining("Connection refused"))
                .verify();
    }

    @Test
    void emptyBatchSendsNothing() {
        HttpIngestionClient client = new HttpIngestionClient(webClient(Mono.never()), node, props);

        assertThat(client.ingest(List.of()).block().results()).isEmpty();
        assertThat(requests).isEmpty();
    }

    @Test
    void timeSourceReadsDateHeader() {
        ZonedDateTime serverNow = ZonedDateTime.of(2024, 3, 1, 8, 1, 30, 0, ZoneOffset.UTC);
        ClientResponse response = ClientResponse.create(HttpStatus.OK)
                .headers(h -> h.setDate(serverNow))
                .build();
        HttpTimeSource source = new HttpTimeSource(webClient(Mono.just(response)), props);

        assertThat(source.serverTime().block()).isEqualTo(serverNow.toInstant());
        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/v1/time");
    }

    @Test
    void timeSourceWithoutDateHeaderFails() {
        HttpTimeSource source = new HttpTimeSource(webClient(Mono.just(ClientResponse.create(HttpStatus.OK).build())),
                props);

        StepVerifier.create(source.serverTime()).expectError(IngestException.class).verify();
    }

    private static String bodyOf(ClientRequest request) {
        MockClientHttpRequest target = new MockClientHttpRequest(request.method(), request.url());
        request.body().insert(target, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return target.getBodyAsString().block();
    }
}
