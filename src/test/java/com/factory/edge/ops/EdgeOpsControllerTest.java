package com.factory.edge.ops;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.factory.edge.connector.BrowseEntry;
import com.factory.edge.connector.ConnectorStatus;
import com.factory.edge.connector.NodeNotFoundException;
import com.factory.edge.connector.OperationTimeoutException;
import com.factory.edge.connector.PointReading;
import com.factory.edge.connector.ProtocolConnector;
import com.factory.edge.connector.QualityCode;
import com.factory.edge.connector.SessionInvalidException;
import com.factory.edge.connector.WriteOutcome;
import com.factory.edge.sync.SyncCycleResult;
import com.factory.edge.sync.SyncWorker;
import com.factory.edge.support.InMemoryJournal;

import reactor.core.publisher.Mono;

class EdgeOpsControllerTest {

    private static final String TEMP = "ns=2;s=Line1.Press1.Temperature";

    private final InMemoryJournal journal = new InMemoryJournal(3);
    private final ProtocolConnector connector = mock(ProtocolConnector.class);
    private final SyncWorker syncWorker = mock(SyncWorker.class);

    private WebTestClient client(Optional<ProtocolConnector> c, Optional<SyncWorker> w) {
        return WebTestClient.bindToController(new EdgeOpsController(journal.service, c, w)).build();
    }

    private WebTestClient client() {
        return client(Optional.of(connector), Optional.of(syncWorker));
    }

    @AfterEach
    void tearDown() {
        journal.close();
    }

    @Test
    void eventCountReflectsJournal() {
        journal.append(1);
        journal.append(2);
        journal.service.markSynced(List.of(1L)).block();

        client().get().uri("/ops/events/count").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total").isEqualTo(2)
                .jsonPath("$.synced").isEqualTo(1)
                .jsonPath("$.pending").isEqualTo(1)
                .jsonPath("$.deadLettered").isEqualTo(0);
    }

    @Test
    void healthShowsConnectorState() {
        when(connector.isHealthy()).thenReturn(false);
        when(connector.status()).thenReturn(new ConnectorStatus("CONNECTING", false, "opc.tcp://plc:4840", 0, 3, 0, 0,
                "connection refused", Instant.parse("2024-03-01T08:00:00Z")));

        client().get().uri("/ops/health").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("DEGRADED")
                .jsonPath("$.connector.state").isEqualTo("CONNECTING")
                .jsonPath("$.connector.reconnectAttempts").isEqualTo(3)
                .jsonPath("$.pending").isEqualTo(0);
    }

    @Test
    void healthWithoutConnectorIsUp() {
        client(Optional.empty(), Optional.empty()).get().uri("/ops/health").exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.status").isEqualTo("UP");
    }

    @Test
    void integrityReportIsExposed() {
        journal.append(1);

        client().get().uri("/ops/integrity").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.valid").isEqualTo(true)
                .jsonPath("$.checked").isEqualTo(1);
    }

    @Test
    void syncStatusAndClockAreExposed() {
        journal.service.recordClockSync(InMemoryJournal.START, InMemoryJournal.START.plusSeconds(90)).block();

        client().get().uri("/ops/clock").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.offsetMs").isEqualTo(90000)
                .jsonPath("$.history[0].driftExceeded").isEqualTo(true);

        client().get().uri("/ops/sync-status").exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.totalSynced").isEqualTo(0);
    }

    @Test
    void deadLettersCanBeListedAndRequeued() {
        long id = journal.append(1);
        for (int i = 0; i < 3; i++) {
            journal.service.markFailed(id, "rejected: schema").block();
        }

        client().get().uri("/ops/dead-letters").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].localId").isEqualTo(1)
                .jsonPath("$[0].sync.lastError").isEqualTo("rejected: schema");

        client().post().uri("/ops/dead-letters/{id}/requeue", id).exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.requeued").isEqualTo(true);

        client().post().uri("/ops/dead-letters/{id}/requeue", id).exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void syncCanBeTriggered() {
        when(syncWorker.triggerSync()).thenReturn(Mono.just(new SyncCycleResult(2, 2, 0, 0, null, false)));

        client().post().uri("/ops/sync").exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.accepted").isEqualTo(2);

        client(Optional.of(connector), Optional.empty()).post().uri("/ops/sync").exchange()
                .expectStatus().isEqualTo(503);
    }

    @Test
    void pointReadReturnsValue() {
        when(connector.read(TEMP)).thenReturn(new PointReading(TEMP, true, 21.5, QualityCode.GOOD,
                Instant.parse("2024-03-01T08:00:00Z")));

        client().get().uri(b -> b.path("/ops/points").queryParam("nodeId", TEMP).build()).exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.value").isEqualTo(21.5)
                .jsonPath("$.success").isEqualTo(true);
    }

    @Test
    void pointErrorsMapToHttpStatus() {
        when(connector.read("missing")).thenThrow(new NodeNotFoundException("missing", "Bad_NodeIdUnknown"));
        when(connector.read("slow")).thenThrow(new OperationTimeoutException("slow", "Bad_Timeout"));
        when(connector.read("gone")).thenThrow(new SessionInvalidException("gone", "No active session"));

        client().get().uri("/ops/points?nodeId=missing").exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.nodeId").isEqualTo("missing");
        client().get().uri("/ops/points?nodeId=slow").exchange().expectStatus().isEqualTo(504);
        client().get().uri("/ops/points?nodeId=gone").exchange().expectStatus().isEqualTo(503);
    }

    @Test
    void pointAccessWithoutConnectorIsUnavailable() {
        client(Optional.empty(), Optional.of(syncWorker)).get().uri("/ops/points?nodeId=x").exchange()
                .expectStatus().isEqualTo(503);
    }

    @Test
    void writeAndBrowseDelegateToConnector() {
        when(connector.write(TEMP, 42)).thenReturn(new WriteOutcome(TEMP, true, QualityCode.GOOD));
        when(connector.browse(anyString())).thenReturn(List.of(new BrowseEntry(TEMP, "2:Temperature",
                "Temperature", "Variable")));

        client().post().uri("/ops/points/write")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("nodeId", TEMP, "value", 42))
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.success").isEqualTo(true);

        client().get().uri("/ops/points/browse").exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$[0].displayName").isEqualTo("Temperature");
    }

    @Test
    void writeWithoutNodeIdIsBadRequest() {
        client().post().uri("/ops/points/write")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("value", 42))
                .exchange()
                .expectStatus().isBadRequest();
    }
}
