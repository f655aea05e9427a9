package com.factory.edge.connector;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.event.EventListener;

import com.factory.edge.config.ConnectorProperties;
import com.factory.edge.connector.ConnectorState.Connecting;
import com.factory.edge.connector.ConnectorState.Disconnected;
import com.factory.edge.connector.ConnectorState.SessionEstablished;
import com.factory.edge.connector.ConnectorState.Subscribed;
import com.factory.edge.core.model.EventRecord;
import com.factory.edge.r2dbc.bootstrap.JournalReadyEvent;
import com.factory.edge.r2dbc.service.JournalService;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

/**
 * =====================================================================
 * ProtocolConnector
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Keeps a session to the automation server, subscribes to every mapped data
 * point and turns each value change into a signed journal event.
 *
 * LIFECYCLE
 * ---------
 * - Starts after {@link JournalReadyEvent}
 * - Connects with bounded exponential backoff
 * - On connection loss: tears down, then reconnects after the initial delay
 * - When retries are exhausted: waits max-delay and starts over
 *
 * STATE
 * -----
 * A single {@link ConnectorState} value, changed only by
 * {@link #transition(ConnectorState)}.
 *
 * EVENT SHAPE
 * -----------
 *   type      = telemetry
 *   eventId   = random UUID
 *   timestamp = source timestamp (local clock when absent)
 *   data      = { <metric>: value, quality, qualityStatus, badQuality,
 *                 unit?, scale?, nodeId }
 *
 * Bad-quality readings are journaled like any other.
 */
public class ProtocolConnector implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ProtocolConnector.class);

    private final AutomationClient client;
    private final JournalService journal;
    private final TagMappingTable tags;
    private final EndpointConfig endpoint;
    private final ConnectorProperties.Reconnect reconnect;
    private final Duration readRetryDelay;
    private final Clock clock;

    private volatile ConnectorState state = new Disconnected("not started");
    private volatile Instant lastStateChange;
    private volatile String lastError;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<Disposable> pending = new AtomicReference<>();
    private final AtomicLong reconnectAttempts = new AtomicLong();
    private final AtomicLong eventsEmitted = new AtomicLong();
    private final AtomicLong appendFailures = new AtomicLong();

    public ProtocolConnector(AutomationClient client, JournalService journal, TagMappingTable tags,
                             EndpointConfig endpoint, ConnectorProperties props, Clock clock) {
        this.client = client;
        this.journal = journal;
        this.tags = tags;
        this.endpoint = endpoint;
        this.reconnect = props.getReconnect();
        this.readRetryDelay = props.getReadRetryDelay();
        this.clock = clock;
        this.lastStateChange = clock.instant();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @EventListener(JournalReadyEvent.class)
    public void onJournalReady() {
        log.info("Journal ready; starting connector for {} ({} mapped point(s))", endpoint.endpointUrl(),
                tags.size());
        start();
    }

    /** Connects in the background and keeps the connection supervised. */
    public void start() {
        running.set(true);
        scheduleConnect(Duration.ZERO);
    }

    /**
     * Connects synchronously.
     *
     * @throws ConnectionException when retries are exhausted
     */
    public ConnectorState connect() {
        running.set(true);
        cancelPending();
        if (isHealthy()) {
            return state;
        }
        return connectWithBackoff().block();
    }

    /**
     * Releases subscription, session and transport in that order and stops
     * reconnecting. Safe to call repeatedly.
     */
    public void disconnect() {
        running.set(false);
        cancelPending();
        ConnectorState previous = detach("disconnect requested");
        if (previous != null) {
            release(previous);
            log.info("Disconnected from {}", endpoint.endpointUrl());
        }
    }

    @Override
    public void destroy() {
        disconnect();
    }

    /** True iff the session and the subscription are both active. */
    public boolean isHealthy() {
        return state instanceof Subscribed s && s.session().isActive() && s.subscription().isActive();
    }

    public ConnectorState getState() {
        return state;
    }

    public ConnectorStatus status() {
        ConnectorState s = state;
        return new ConnectorStatus(s.name(), isHealthy(), endpoint.endpointUrl(),
                s instanceof Subscribed ? tags.size() : 0, reconnectAttempts.get(), eventsEmitted.get(),
                appendFailures.get(), lastError, lastStateChange);
    }

    Mono<ConnectorState> connectWithBackoff() {
        AtomicInteger attempt = new AtomicInteger();
        return Mono.fromCallable(() -> attemptOnce(attempt.incrementAndGet()))
                .subscribeOn(Schedulers.boundedElastic())
                .retryWhen(Retry.backoff(reconnect.getMaxRetries(), reconnect.getInitialDelay())
                        .maxBackoff(reconnect.getMaxDelay())
                        .filter(e -> running.get() && !(e instanceof CertificateRejectedException))
                        .doBeforeRetry(signal -> {
                            reconnectAttempts.incrementAndGet();
                            log.warn("Connect attempt {} to {} failed: {}; retrying", signal.totalRetries() + 1,
                                    endpoint.endpointUrl(), signal.failure().getMessage());
                        })
                        .onRetryExhaustedThrow((spec, signal) -> new ConnectionException(
                                "Unable to connect to " + endpoint.endpointUrl() + " after "
                                        + (signal.totalRetries() + 1) + " attempt(s)",
                                signal.failure())));
    }

    private ConnectorState attemptOnce(int attempt) {
        if (!transition(new Connecting(attempt))) {
            throw new ConnectionException("Cannot connect while " + state.name());
        }

        AutomationTransport transport = null;
        AutomationSession session = null;
        AutomationSubscription subscription = null;
        try {
            transport = client.open(endpoint);
            session = transport.createSession(this::onConnectionLost);
            if (!transition(new SessionEstablished(transport, session))) {
                throw new ConnectionException("Connect aborted");
            }

            subscription = session.subscribe(tags.all(), this::onDataChange);
            if (!transition(new Subscribed(transport, session, subscription))) {
                throw new ConnectionException("Connect aborted");
            }

            lastError = null;
            log.info("Subscribed to {} data point(s) on {}", tags.size(), endpoint.endpointUrl());
            return state;
        } catch (Exception e) {
            lastError = e.getMessage();
            detach("connect failed: " + e.getMessage());
            release(new Subscribed(transport, session, subscription));
            if (e instanceof ConnectionException ce) {
                throw ce;
            }
            throw new ConnectionException("Connect to " + endpoint.endpointUrl() + " failed: " + e.getMessage(), e);
        }
    }

    private void scheduleConnect(Duration delay) {
        if (!running.get()) {
            return;
        }
        Disposable next = Mono.delay(delay)
                .then(connectWithBackoff())
                .subscribe(
                        s -> log.debug("Connector supervisor reached {}", s.name()),
                        e -> {
                            lastError = e.getMessage();
                            if (!running.get()) {
                                return;
                            }
                            log.error("Connector could not reach {}: {}; next attempt in {}",
                                    endpoint.endpointUrl(), e.getMessage(), reconnect.getMaxDelay());
                            scheduleConnect(reconnect.getMaxDelay());
                        });
        Disposable previous = pending.getAndSet(next);
        if (previous != null) {
            previous.dispose();
        }
    }

    private void cancelPending() {
        Disposable p = pending.getAndSet(null);
        if (p != null) {
            p.dispose();
        }
    }

    void onConnectionLost(Throwable cause) {
        String reason = cause == null ? "connection lost" : "connection lost: " + cause.getMessage();
        ConnectorState previous = detach(reason);
        if (previous == null || previous instanceof Connecting) {
            return;
        }
        lastError = reason;
        log.warn("Connection to {} lost; reconnecting in {}", endpoint.endpointUrl(), reconnect.getInitialDelay());
        release(previous);
        scheduleConnect(reconnect.getInitialDelay());
    }

    // ---------------------------------------------------------------------
    // State control
    // ---------------------------------------------------------------------

    /**
     * The only place the state changes.
     *
     * @return false when {@code next} is not a legal successor
     */
    synchronized boolean transition(ConnectorState next) {
        ConnectorState current = state;
        if (!current.canMoveTo(next)) {
            if (!(current instanceof Disconnected && next instanceof Disconnected)) {
                log.warn("Rejected connector transition {} -> {}", current.name(), next.name());
            }
            return false;
        }
        state = next;
        lastStateChange = clock.instant();
        if (next instanceof Disconnected d) {
            log.info("Connector {} -> {} ({})", current.name(), next.name(), d.reason());
        } else {
            log.info("Connector {} -> {}", current.name(), next.name());
        }
        return true;
    }

    /** Moves to Disconnected and returns the state that owned the handles. */
    private synchronized ConnectorState detach(String reason) {
        ConnectorState current = state;
        if (current instanceof Disconnected) {
            return null;
        }
        return transition(new Disconnected(reason)) ? current : null;
    }

    private void release(ConnectorState previous) {
        AutomationTransport transport = null;
        AutomationSession session = null;
        AutomationSubscription subscription = null;

        if (previous instanceof Subscribed s) {
            transport = s.transport();
            session = s.session();
            subscription = s.subscription();
        } else if (previous instanceof SessionEstablished s) {
            transport = s.transport();
            session = s.session();
        }

        if (subscription != null) {
            try {
                subscription.terminate();
            } catch (Exception e) {
                log.warn("Failed to terminate subscription: {}", e.getMessage());
            }
        }
        if (session != null) {
            try {
                session.close();
            } catch (Exception e) {
                log.warn("Failed to close session: {}", e.getMessage());
            }
        }
        if (transport != null) {
            try {
                transport.close();
            } catch (Exception e) {
                log.warn("Failed to close transport: {}", e.getMessage());
            }
        }
    }

    // ---------------------------------------------------------------------
    // Data path
    // ---------------------------------------------------------------------

    void onDataChange(DataChange change) {
        Optional<TagMapping> mapping = tags.find(change.nodeId());
        if (mapping.isEmpty()) {
            log.debug("Ignoring change on unmapped node {}", change.nodeId());
            return;
        }

        EventRecord event = toEvent(mapping.get(), change);
        journal.append(event).subscribe(
                localId -> {
                    eventsEmitted.incrementAndGet();
                    log.debug("Journaled {} from {} as localId={}", event.eventId(), change.nodeId(), localId);
                },
                e -> {
                    appendFailures.incrementAndGet();
                    log.error("Failed to journal reading {}={} from {} (eventId={})", mapping.get().metricName(),
                            change.value(), change.nodeId(), event.eventId(), e);
                });
    }

    EventRecord toEvent(TagMapping mapping, DataChange change) {
        QualityCode quality = change.quality() == null ? QualityCode.GOOD : change.quality();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put(mapping.metricName(), mapping.scale(change.value()));
        data.put("quality", quality.code());
        data.put("qualityStatus", quality.status());
        data.put("badQuality", quality.isBad());
        if (mapping.unit() != null) {
            data.put("unit", mapping.unit());
        }
        if (mapping.scaled()) {
            data.put("scale", mapping.scaleFactor());
        }
        data.put("nodeId", change.nodeId());

        Instant timestamp = change.sourceTimestamp() != null ? change.sourceTimestamp() : clock.instant();
        return new EventRecord(UUID.randomUUID().toString(), timestamp, mapping.assetId(), mapping.lineId(),
                EventRecord.TYPE_TELEMETRY, data);
    }

    // ---------------------------------------------------------------------
    // Diagnostic point access
    // ---------------------------------------------------------------------

    public PointReading read(String nodeId) {
        return activeSession(nodeId).read(nodeId);
    }

    /**
     * Reads with up to {@code attempts} tries; the last error is re-thrown.
     * Unknown nodes are not retried.
     */
    public PointReading readWithRetry(String nodeId, int attempts) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1");
        }
        return Mono.fromCallable(() -> read(nodeId))
                .retryWhen(Retry.fixedDelay(attempts - 1L, readRetryDelay)
                        .filter(e -> !(e instanceof NodeNotFoundException))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block();
    }

    public WriteOutcome write(String nodeId, Object value) {
        WriteOutcome outcome = activeSession(nodeId).write(nodeId, value);
        log.info("Wrote {} to {} (status={})", value, nodeId, outcome.status().status());
        return outcome;
    }

    public List<BrowseEntry> browse(String nodeId) {
        return activeSession(nodeId).browse(nodeId);
    }

    private AutomationSession activeSession(String nodeId) {
        ConnectorState s = state;
        AutomationSession session = null;
        if (s instanceof Subscribed sub) {
            session = sub.session();
        } else if (s instanceof SessionEstablished est) {
            session = est.session();
        }
        if (session == null || !session.isActive()) {
            throw new SessionInvalidException(nodeId, "No active session (state=" + s.name() + ")");
        }
        return session;
    }
}
