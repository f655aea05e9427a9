package com.factory.edge.r2dbc.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.factory.edge.config.JournalProperties;
import com.factory.edge.core.chain.ChainSigner;
import com.factory.edge.core.model.ClockSample;
import com.factory.edge.core.model.EventCounts;
import com.factory.edge.core.model.EventRecord;
import com.factory.edge.core.model.FailureOutcome;
import com.factory.edge.core.model.IntegrityReport;
import com.factory.edge.core.model.IntegrityReport.IntegrityViolation;
import com.factory.edge.core.model.IntegrityReport.Kind;
import com.factory.edge.core.model.JournalEvent;
import com.factory.edge.core.model.SyncState;
import com.factory.edge.core.model.SyncStatus;
import com.factory.edge.r2dbc.store.ChainTail;
import com.factory.edge.r2dbc.store.JournalEventStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * JournalService
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The durable, tamper-evident, append-only event journal of this node. It is
 * the only component shared between the protocol connector (writer of new
 * events) and the sync worker (reader of pending events, writer of sync state).
 *
 * GUARANTEES
 * ----------
 * - localId strictly increases with insertion order, without gaps
 * - every event is signed over its own fields and its predecessor's signature
 * - only sync fields are ever updated; synced never reverts
 * - events at the retry cap are excluded from sync but kept
 *
 * CONCURRENCY
 * -----------
 * Every mutation goes through one {@link SerialWriteLane}. Reads hit the
 * engine directly and are not blocked by queued writes.
 */
@Service
public class JournalService implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(JournalService.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final JournalEventStore store;
    private final TransactionalOperator tx;
    private final ChainSigner signer;
    private final JournalProperties props;
    private final Clock clock;
    private final SerialWriteLane lane = new SerialWriteLane("journal-writer");

    public JournalService(JournalEventStore store, TransactionalOperator tx, ChainSigner signer,
                          JournalProperties props, Clock clock) {
        this.store = store;
        this.tx = tx;
        this.signer = signer;
        this.props = props;
        this.clock = clock;
    }

    /** Creates the tables and the singleton status row if they are missing. */
    public Mono<Void> initialize() {
        return store.createSchema(clock.instant())
                .onErrorMap(e -> new JournalStorageException("Failed to initialize journal schema", e))
                .doOnSuccess(v -> log.info("Journal schema ready (maxRetries={}, retention={})",
                        props.getMaxRetries(), props.getRetention()));
    }

    // ---------------------------------------------------------------------
    // Append
    // ---------------------------------------------------------------------

    /**
     * Signs {@code record} against the current chain tail and persists it.
     *
     * @return the assigned localId
     */
    public Mono<Long> append(EventRecord record) {
        Objects.requireNonNull(record, "record");
        return Mono.fromCallable(() -> normalize(record))
                .flatMap(normalized -> lane.submit(Mono.defer(() -> appendNow(normalized))))
                .onErrorMap(e -> !(e instanceof JournalStorageException) && !(e instanceof IllegalArgumentException),
                        e -> new JournalStorageException("Failed to append event " + record.eventId(), e));
    }

    private Mono<Long> appendNow(EventRecord record) {
        return store.findTail()
                .defaultIfEmpty(ChainTail.EMPTY)
                .flatMap(tail -> {
                    long localId = tail.localId() + 1;
                    String signature = signer.sign(record, tail.signature());
                    JournalEvent event = new JournalEvent(localId, record, signature, tail.signature(),
                            SyncState.PENDING);
                    return store.insert(event, clock.instant()).thenReturn(localId);
                })
                .doOnNext(localId -> log.debug("Appended event {} as localId={} (asset={}, type={})",
                        record.eventId(), localId, record.assetId(), record.type()));
    }

    /**
     * Signs over the payload exactly as it will be read back from storage.
     */
    private EventRecord normalize(EventRecord record) {
        return new EventRecord(record.eventId(), record.timestamp(), record.assetId(), record.lineId(),
                record.type(), signer.parsePayload(signer.canonicalPayload(record.data())));
    }

    // ---------------------------------------------------------------------
    // Sync bookkeeping
    // ---------------------------------------------------------------------

    /** Pending events below the retry cap, oldest first. */
    public Flux<JournalEvent> drainUnsynced(int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        return store.findUnsynced(props.getMaxRetries(), limit)
                .onErrorMap(e -> new JournalStorageException("Failed to read unsynced events", e));
    }

    /**
     * Marks the given events synced in one transaction. Unknown and already
     * synced ids are ignored.
     *
     * @return number of events newly marked synced
     */
    public Mono<Integer> markSynced(Collection<Long> localIds) {
        if (localIds == null || localIds.isEmpty()) {
            return Mono.just(0);
        }
        List<Long> ids = localIds.stream().filter(Objects::nonNull).distinct().toList();
        if (ids.isEmpty()) {
            return Mono.just(0);
        }

        Mono<Integer> work = Mono.defer(() -> {
            Instant now = clock.instant();
            return store.findPendingSlice(ids).flatMap(slice -> {
                if (slice.count() == 0) {
                    return Mono.just(0);
                }
                return store.updateSynced(ids, now)
                        .flatMap(updated -> store.recordSynced(slice.maxLocalId(), updated, now)
                                .thenReturn(updated.intValue()));
            });
        });

        return lane.submit(tx.transactional(work))
                .onErrorMap(e -> !(e instanceof JournalStorageException),
                        e -> new JournalStorageException("Failed to mark " + ids.size() + " event(s) synced", e))
                .doOnNext(n -> log.debug("Marked {} of {} event(s) synced", n, ids.size()));
    }

    /**
     * Records a failed delivery attempt. No-op for synced or unknown ids.
     */
    public Mono<FailureOutcome> markFailed(long localId, String reason) {
        String error = truncate(reason);
        int maxRetries = props.getMaxRetries();

        Mono<FailureOutcome> work = Mono.defer(() -> store.incrementRetry(localId, maxRetries, error)
                .flatMap(rows -> {
                    if (rows == 0) {
                        return Mono.just(FailureOutcome.ignored(localId));
                    }
                    return store.recordFailed(clock.instant())
                            .then(store.findSyncState(localId))
                            .map(state -> new FailureOutcome(localId, true, state.retryCount(),
                                    state.isDeadLettered(maxRetries)));
                }));

        return lane.submit(tx.transactional(work))
                .onErrorMap(e -> !(e instanceof JournalStorageException),
                        e -> new JournalStorageException("Failed to mark event " + localId + " failed", e))
                .doOnNext(outcome -> {
                    if (outcome.deadLettered()) {
                        log.warn("Event localId={} reached {} failed attempts and is now a dead letter: {}",
                                localId, outcome.retryCount(), error);
                    }
                });
    }

    /**
     * Operator action: makes a dead letter eligible for sync again. Signed fields
     * are untouched.
     *
     * @return true when the event was a dead letter and has been requeued
     */
    public Mono<Boolean> requeueDeadLetter(long localId) {
        return lane.submit(Mono.defer(() -> store.resetRetry(localId, props.getMaxRetries())))
                .map(rows -> rows > 0)
                .doOnNext(requeued -> {
                    if (requeued) {
                        log.info("Dead letter localId={} requeued by operator", localId);
                    }
                });
    }

    public Flux<JournalEvent> findDeadLetters(int limit) {
        return store.findDeadLetters(props.getMaxRetries(), Math.max(1, limit));
    }

    // ---------------------------------------------------------------------
    // Integrity
    // ---------------------------------------------------------------------

    /**
     * Walks the whole chain in localId order. Violations are reported, never
     * repaired.
     */
    public Mono<IntegrityReport> verifyIntegrity() {
        return Mono.defer(() -> {
            ChainWalker walker = new ChainWalker();
            return store.findAllOrdered()
                    .doOnNext(walker::accept)
                    .then(Mono.fromSupplier(walker::report));
        }).onErrorMap(e -> new JournalStorageException("Failed to read journal for verification", e))
                .doOnNext(report -> {
                    if (report.valid()) {
                        log.info("Journal integrity verified ({} events)", report.checked());
                    } else {
                        report.violations().forEach(v -> log.warn("Integrity violation: {}", v.describe()));
                    }
                });
    }

    private final class ChainWalker {

        private final List<IntegrityViolation> violations = new ArrayList<>();
        private String previous;
        private long checked;

        void accept(JournalEvent event) {
            checked++;
            String anchor;
            if (previous == null) {
                // after pruning the first surviving row anchors on itself
                anchor = event.previousSignature();
                if (event.localId() == 1 && !ChainSigner.GENESIS.equals(anchor)) {
                    violations.add(violation(event, Kind.CHAIN_BROKEN));
                }
            } else {
                anchor = previous;
                if (!previous.equals(event.previousSignature())) {
                    violations.add(violation(event, Kind.CHAIN_BROKEN));
                }
            }
            if (!signer.verify(event.record(), anchor, event.signature())) {
                violations.add(violation(event, Kind.SIGNATURE_MISMATCH));
            }
            previous = event.signature();
        }

        IntegrityReport report() {
            return IntegrityReport.of(checked, violations);
        }

        private IntegrityViolation violation(JournalEvent event, Kind kind) {
            return new IntegrityViolation(event.localId(), event.eventId(), kind);
        }
    }

    // ---------------------------------------------------------------------
    // Clock
    // ---------------------------------------------------------------------

    public Mono<ClockSample> recordClockSync(Instant localTime, Instant serverTime) {
        long offsetMs = Duration.between(localTime, serverTime).toMillis();
        boolean exceeded = Math.abs(offsetMs) > props.getDriftThreshold().toMillis();
        ClockSample sample = new ClockSample(localTime, serverTime, offsetMs, exceeded);

        return store.insertClockSample(sample, clock.instant())
                .onErrorMap(e -> new JournalStorageException("Failed to record clock sample", e))
                .thenReturn(sample)
                .doOnNext(s -> {
                    if (s.driftExceeded()) {
                        log.warn("Clock drift detected: offset={}ms exceeds threshold={}ms", s.offsetMs(),
                                props.getDriftThreshold().toMillis());
                    } else {
                        log.debug("Clock offset {}ms", s.offsetMs());
                    }
                });
    }

    /** Latest recorded offset, 0 when the clock was never checked. */
    public Mono<Long> getClockOffset() {
        return store.findLatestOffset().defaultIfEmpty(0L);
    }

    public Flux<ClockSample> getClockHistory(int limit) {
        return store.findClockSamples(Math.max(1, limit), props.getDriftThreshold().toMillis());
    }

    // ---------------------------------------------------------------------
    // Retention / status
    // ---------------------------------------------------------------------

    /**
     * Deletes synced events older than {@code retention}, oldest first. Pruning
     * stops at the first pending, dead-lettered or recent event and never
     * removes the chain tail, so the surviving rows form one unbroken chain.
     */
    public Mono<Long> pruneOldEvents(Duration retention) {
        Duration window = retention == null ? props.getRetention() : retention;
        return lane.submit(Mono.defer(() -> store.deleteSyncedPrefixBefore(clock.instant().minus(window))))
                .onErrorMap(e -> !(e instanceof JournalStorageException),
                        e -> new JournalStorageException("Failed to prune journal", e))
                .doOnNext(n -> {
                    if (n > 0) {
                        log.info("Pruned {} synced event(s) older than {}", n, window);
                    }
                });
    }

    public Mono<EventCounts> getEventCount() {
        return store.countEvents(props.getMaxRetries());
    }

    public Mono<SyncStatus> getSyncStatus() {
        return store.findSyncStatus();
    }

    public int getMaxRetries() {
        return props.getMaxRetries();
    }

    /**
     * Stops accepting writes and waits for queued ones to finish.
     */
    public void close() {
        if (!lane.isClosed()) {
            log.info("Closing journal (waiting up to {} for queued writes)", props.getShutdownTimeout());
            lane.close(props.getShutdownTimeout());
        }
    }

    @Override
    public void destroy() {
        close();
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return null;
        }
        return reason.length() <= MAX_ERROR_LENGTH ? reason : reason.substring(0, MAX_ERROR_LENGTH);
    }
}
