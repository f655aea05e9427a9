package com.factory.edge.ops;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.factory.edge.connector.BrowseEntry;
import com.factory.edge.connector.ConnectorStatus;
import com.factory.edge.connector.NodeNotFoundException;
import com.factory.edge.connector.OperationTimeoutException;
import com.factory.edge.connector.PointAccessException;
import com.factory.edge.connector.PointReading;
import com.factory.edge.connector.ProtocolConnector;
import com.factory.edge.connector.SessionInvalidException;
import com.factory.edge.connector.WriteOutcome;
import com.factory.edge.core.model.EventCounts;
import com.factory.edge.core.model.IntegrityReport;
import com.factory.edge.core.model.JournalEvent;
import com.factory.edge.core.model.SyncStatus;
import com.factory.edge.r2dbc.service.JournalService;
import com.factory.edge.sync.SyncCycleResult;
import com.factory.edge.sync.SyncWorker;

import jakarta.validation.Valid;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Operational endpoints for dashboards and health checks.
 *
 * Enabled by default; disable via:
 *   edge.ops.enabled=false
 */
@RestController
@RequestMapping(path = "/ops", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "edge.ops", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EdgeOpsController {

    private static final int DEFAULT_LIMIT = 100;

    private final JournalService journal;
    private final Optional<ProtocolConnector> connector;
    private final Optional<SyncWorker> syncWorker;

    public EdgeOpsController(JournalService journal, Optional<ProtocolConnector> connector,
                             Optional<SyncWorker> syncWorker) {
        this.journal = journal;
        this.connector = connector;
        this.syncWorker = syncWorker;
    }

    @GetMapping("/health")
    public Mono<Map<String, Object>> health() {
        return journal.getEventCount().map(counts -> {
            Map<String, Object> out = new HashMap<>();
            out.put("status", connector.map(ProtocolConnector::isHealthy).orElse(true) ? "UP" : "DEGRADED");
            out.put("connector", connector.map(ProtocolConnector::status).orElse(null));
            out.put("pending", counts.pending());
            out.put("deadLettered", counts.deadLettered());
            out.put("lastSync", syncWorker.map(SyncWorker::getLastResult).orElse(null));
            return out;
        });
    }

    @GetMapping("/events/count")
    public Mono<EventCounts> eventCount() {
        return journal.getEventCount();
    }

    @GetMapping("/sync-status")
    public Mono<SyncStatus> syncStatus() {
        return journal.getSyncStatus();
    }

    @GetMapping("/integrity")
    public Mono<IntegrityReport> integrity() {
        return journal.verifyIntegrity();
    }

    @GetMapping("/clock")
    public Mono<Map<String, Object>> clock(@RequestParam(defaultValue = "10") int limit) {
        return journal.getClockOffset()
                .zipWith(journal.getClockHistory(limit).collectList())
                .map(t -> {
                    Map<String, Object> out = new HashMap<>();
                    out.put("offsetMs", t.getT1());
                    out.put("history", t.getT2());
                    return out;
                });
    }

    @GetMapping("/dead-letters")
    public Mono<List<JournalEvent>> deadLetters(@RequestParam(defaultValue = "" + DEFAULT_LIMIT) int limit) {
        return journal.findDeadLetters(limit).collectList();
    }

    @PostMapping("/dead-letters/{localId}/requeue")
    public Mono<ResponseEntity<Map<String, Object>>> requeue(@PathVariable long localId) {
        return journal.requeueDeadLetter(localId).map(requeued -> {
            Map<String, Object> out = Map.of("localId", localId, "requeued", requeued);
            return requeued ? ResponseEntity.ok(out) : ResponseEntity.status(HttpStatus.NOT_FOUND).body(out);
        });
    }

    @PostMapping("/sync")
    public Mono<ResponseEntity<SyncCycleResult>> triggerSync() {
        return syncWorker
                .map(w -> w.triggerSync().map(ResponseEntity::ok))
                .orElseGet(() -> Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build()));
    }

    @GetMapping("/points")
    public Mono<PointReading> read(@RequestParam String nodeId) {
        return blocking(() -> requireConnector().read(nodeId));
    }

    @PostMapping(path = "/points/write", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<WriteOutcome> write(@Valid @RequestBody PointWriteRequest req) {
        return blocking(() -> requireConnector().write(req.nodeId(), req.value()));
    }

    @GetMapping("/points/browse")
    public Mono<List<BrowseEntry>> browse(@RequestParam(defaultValue = "i=85") String nodeId) {
        return blocking(() -> requireConnector().browse(nodeId));
    }

    @GetMapping("/connector")
    public ResponseEntity<ConnectorStatus> connectorStatus() {
        return connector.map(c -> ResponseEntity.ok(c.status()))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
    }

    @ExceptionHandler(NodeNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(NodeNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(OperationTimeoutException.class)
    public ResponseEntity<Map<String, Object>> timeout(OperationTimeoutException e) {
        return error(HttpStatus.GATEWAY_TIMEOUT, e);
    }

    @ExceptionHandler(SessionInvalidException.class)
    public ResponseEntity<Map<String, Object>> sessionInvalid(SessionInvalidException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(PointAccessException.class)
    public ResponseEntity<Map<String, Object>> pointAccess(PointAccessException e) {
        return error(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        Map<String, Object> out = new HashMap<>();
        out.put("error", e.getMessage());
        return ResponseEntity.badRequest().body(out);
    }

    private ProtocolConnector requireConnector() {
        return connector.orElseThrow(() -> new SessionInvalidException(null, "Connector is disabled"));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, PointAccessException e) {
        Map<String, Object> out = new HashMap<>();
        out.put("error", e.getMessage());
        out.put("nodeId", e.getNodeId());
        return ResponseEntity.status(status).body(out);
    }
}
