package com.factory.edge.sync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.factory.edge.config.SyncWorkerProperties;
import com.factory.edge.core.ingest.IngestResponse;
import com.factory.edge.core.ingest.IngestResult;
import com.factory.edge.core.ingest.IngestionClient;
import com.factory.edge.core.model.ClockSample;
import com.factory.edge.core.model.FailureOutcome;
import com.factory.edge.core.model.JournalEvent;
import com.factory.edge.r2dbc.bootstrap.JournalReadyEvent;
import com.factory.edge.r2dbc.service.JournalService;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * SyncWorker
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Store-and-forward: reconciles the journal with the remote ingestion
 * endpoint under unreliable connectivity.
 *
 * CYCLE (every edge.sync.interval, or on demand)
 * ----------------------------------------------
 * 1. drain up to batch-size pending events (ascending localId)
 * 2. nothing pending → idle
 * 3. submit the batch in one request (bounded by request-timeout)
 * 4. all accepted → markSynced(all)
 * 5. partial      → markSynced(accepted), markFailed(rejected, reason)
 * 6. failure      → markFailed(all, error)
 *
 * No journal lock is held across the network call: the drain is a read and
 * outcomes are applied afterwards as short writes.
 *
 * CLOCK (every edge.sync.clock-check-interval)
 * --------------------------------------------
 * Compares the local clock with the trusted time source, records the sample
 * and publishes {@link ClockDriftDetectedEvent} when over the threshold.
 *
 * Only one cycle runs at a time; an overlapping trigger is reported as
 * skipped.
 */
@Component
@ConditionalOnProperty(prefix = "edge.sync", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SyncWorker implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SyncWorker.class);

    private final JournalService journal;
    private final IngestionClient ingestion;
    private final TrustedTimeSource timeSource;
    private final SyncWorkerProperties props;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
    private final AtomicReference<Disposable> syncLoop = new AtomicReference<>();
    private final AtomicReference<Disposable> clockLoop = new AtomicReference<>();
    private final AtomicReference<SyncCycleResult> lastResult = new AtomicReference<>();

    public SyncWorker(JournalService journal, IngestionClient ingestion, TrustedTimeSource timeSource,
                      SyncWorkerProperties props, ApplicationEventPublisher events, Clock clock) {
        this.journal = journal;
        this.ingestion = ingestion;
        this.timeSource = timeSource;
        this.props = props;
        this.events = events;
        this.clock = clock;
    }

    @EventListener(JournalReadyEvent.class)
    public void onJournalReady() {
        start();
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Sync worker starting (interval={}, batchSize={}, clockCheck={}, transport={})",
                props.getInterval(), props.getBatchSize(), props.getClockCheckInterval(), props.getTransport());

        syncLoop.set(Flux.interval(Duration.ZERO, props.getInterval())
                .onBackpressureDrop()
                .concatMap(tick -> runCycle())
                .subscribe());

        clockLoop.set(Flux.interval(Duration.ZERO, props.getClockCheckInterval())
                .onBackpressureDrop()
                .concatMap(tick -> checkClock().onErrorResume(e -> {
                    log.warn("Clock check failed: {}", e.getMessage());
                    return Mono.empty();
                }))
                .subscribe());
    }

    /** Runs a cycle now, outside the schedule. */
    public Mono<SyncCycleResult> triggerSync() {
        return runCycle();
    }

    public SyncCycleResult getLastResult() {
        return lastResult.get();
    }

    Mono<SyncCycleResult> runCycle() {
        return Mono.defer(() -> {
            if (!cycleRunning.compareAndSet(false, true)) {
                log.debug("Sync cycle already running; trigger skipped");
                return Mono.just(SyncCycleResult.skippedCycle());
            }
            return doCycle()
                    .onErrorResume(e -> {
                        log.error("Sync cycle failed: {}", e.getMessage(), e);
                        return Mono.just(SyncCycleResult.failed(e.getMessage()));
                    })
                    .doOnNext(lastResult::set)
                    .doFinally(signal -> cycleRunning.set(false));
        });
    }

    private Mono<SyncCycleResult> doCycle() {
        return journal.drainUnsynced(props.getBatchSize())
                .collectList()
                .flatMap(batch -> {
                    if (batch.isEmpty()) {
                        log.debug("Sync cycle idle: nothing pending");
                        return Mono.just(SyncCycleResult.idle());
                    }
                    return deliver(batch).flatMap(delivery -> delivery.error() == null
                            ? applyVerdicts(batch, delivery.response())
                            : applyTotalFailure(batch, delivery.error()));
                });
    }

    private Mono<Delivery> deliver(List<JournalEvent> batch) {
        return ingestion.ingest(batch)
                .timeout(props.getRequestTimeout())
                .map(response -> new Delivery(response, null))
                .switchIfEmpty(Mono.fromSupplier(() -> new Delivery(null, "Ingestion returned no response")))
                .onErrorResume(e -> Mono.just(new Delivery(null, describe(e))));
    }

    private Mono<SyncCycleResult> applyVerdicts(List<JournalEvent> batch, IngestResponse response) {
        Map<String, IngestResult> verdicts = response.byEventId();
        List<Long> accepted = new ArrayList<>();
        Map<Long, String> rejected = new LinkedHashMap<>();

        for (JournalEvent event : batch) {
            IngestResult verdict = verdicts.get(event.eventId());
            if (verdict == null) {
                rejected.put(event.localId(), "missing from ingestion response");
            } else if (verdict.accepted()) {
                accepted.add(event.localId());
            } else {
                rejected.put(event.localId(), verdict.reason() == null ? "rejected" : verdict.reason());
            }
        }

        return journal.markSynced(accepted)
                .flatMap(synced -> Flux.fromIterable(rejected.entrySet())
                        .concatMap(r -> journal.markFailed(r.getKey(), r.getValue()))
                        .filter(FailureOutcome::deadLettered)
                        .count()
                        .map(dead -> new SyncCycleResult(batch.size(), synced, rejected.size(), dead.intValue(),
                                null, false)))
                .doOnNext(result -> {
                    if (result.rejected() == 0) {
                        log.info("Synced {} event(s) (localId {}..{})", result.accepted(),
                                batch.get(0).localId(), batch.get(batch.size() - 1).localId());
                    } else {
                        log.warn("Partial sync: accepted={}, rejected={}, deadLettered={}", result.accepted(),
                                result.rejected(), result.deadLettered());
                    }
                });
    }

    private Mono<SyncCycleResult> applyTotalFailure(List<JournalEvent> batch, String error) {
        log.warn("Sync of {} event(s) failed: {}", batch.size(), error);
        return Flux.fromIterable(batch)
                .concatMap(event -> journal.markFailed(event.localId(), error))
                .filter(FailureOutcome::deadLettered)
                .count()
                .map(dead -> new SyncCycleResult(batch.size(), 0, batch.size(), dead.intValue(), error, false));
    }

    private String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "Ingestion request timed out after " + props.getRequestTimeout();
        }
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    /**
     * Samples the trusted time source. The local time is taken at the midpoint
     * of the request.
     */
    public Mono<ClockSample> checkClock() {
        return Mono.defer(() -> {
            Instant before = clock.instant();
            return timeSource.serverTime()
                    .timeout(props.getRequestTimeout())
                    .flatMap(server -> {
                        Instant after = clock.instant();
                        Instant local = before.plus(Duration.between(before, after).dividedBy(2));
                        return journal.recordClockSync(local, server);
                    });
        }).doOnNext(sample -> {
            if (sample.driftExceeded()) {
                events.publishEvent(new ClockDriftDetectedEvent(sample));
            }
        });
    }

    @Override
    public void destroy() {
        dispose(syncLoop);
        dispose(clockLoop);
    }

    private static void dispose(AtomicReference<Disposable> ref) {
        Disposable d = ref.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }

    private record Delivery(IngestResponse response, String error) {
    }
}
