package com.factory.edge.connector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.factory.edge.config.ConnectorProperties;
import com.factory.edge.connector.ConnectorState.Disconnected;
import com.factory.edge.connector.ConnectorState.Subscribed;
import com.factory.edge.core.model.EventRecord;
import com.factory.edge.core.model.JournalEvent;
import com.factory.edge.support.InMemoryJournal;

class ProtocolConnectorTest {

    private static final String TEMP = "ns=2;s=Line1.Press1.Temperature";
    private static final String STATE = "ns=2;s=Line1.Press1.State";
    private static final Instant SOURCE_TS = Instant.parse("2024-03-01T09:15:30.250Z");

    private final InMemoryJournal journal = new InMemoryJournal();
    private final FakeAutomationClient server = new FakeAutomationClient();
    private ProtocolConnector connector;

    @BeforeEach
    void setUp() {
        ConnectorProperties props = new ConnectorProperties();
        props.getReconnect().setInitialDelay(Duration.ofMillis(5));
        props.getReconnect().setMaxDelay(Duration.ofMillis(20));
        props.getReconnect().setMaxRetries(2);
        props.setReadRetryDelay(Duration.ofMillis(1));

        TagMappingTable tags = TagMappingTable.of(List.of(
                new TagMapping(TEMP, "press-1", "temperature", 0.1, "degC", "line-1", null),
                new TagMapping(STATE, "press-1", "state", null, null, null, null)));
        EndpointConfig endpoint = new EndpointConfig("opc.tcp://plc:4840", null, null, SecurityMode.NONE, "None",
                null, null, null, null, null, null);

        connector = new ProtocolConnector(server, journal.service, tags, endpoint, props, journal.clock);
    }

    @AfterEach
    void tearDown() {
        connector.disconnect();
        journal.close();
    }

    @Test
    void connectSubscribesEveryMappedPoint() {
        ConnectorState state = connector.connect();

        assertThat(state).isInstanceOf(Subscribed.class);
        assertThat(connector.isHealthy()).isTrue();
        assertThat(server.subscribed).extracting(TagMapping::nodeId).containsExactly(TEMP, STATE);

        ConnectorStatus status = connector.status();
        assertThat(status.state()).isEqualTo("SUBSCRIBED");
        assertThat(status.subscribedPoints()).isEqualTo(2);
        assertThat(status.endpointUrl()).isEqualTo("opc.tcp://plc:4840");
    }

    @Test
    void disconnectReleasesSubscriptionThenSessionThenTransport() {
        connector.connect();

        connector.disconnect();
        connector.disconnect();

        assertThat(connector.getState()).isInstanceOf(Disconnected.class);
        assertThat(connector.isHealthy()).isFalse();
        assertThat(server.calls).containsExactly("open", "subscription.terminate", "session.close",
                "transport.close");
    }

    @Test
    void valueChangeIsJournaledWithScaleAndQuality() {
        connector.connect();

        server.emit(new DataChange(TEMP, 215, QualityCode.GOOD, SOURCE_TS));
        awaitTrue(() -> journal.service.getEventCount().block().total() == 1);

        JournalEvent stored = journal.service.drainUnsynced(1).blockFirst();
        EventRecord r = stored.record();
        assertThat(r.assetId()).isEqualTo("press-1");
        assertThat(r.lineId()).isEqualTo("line-1");
        assertThat(r.type()).isEqualTo(EventRecord.TYPE_TELEMETRY);
        assertThat(r.timestamp()).isEqualTo(SOURCE_TS);
        assertThat(((Number) r.data().get("temperature")).doubleValue()).isCloseTo(21.5, within(1e-9));
        assertThat(r.data()).containsEntry("unit", "degC")
                .containsEntry("qualityStatus", "GOOD")
                .containsEntry("badQuality", false)
                .containsEntry("nodeId", TEMP);
        assertThat(((Number) r.data().get("scale")).doubleValue()).isEqualTo(0.1);
        awaitTrue(() -> connector.status().eventsEmitted() == 1);
    }

    @Test
    void badQualityReadingIsStillJournaled() {
        connector.connect();

        server.emit(new DataChange(STATE, null, new QualityCode(0x80340000L), SOURCE_TS));
        awaitTrue(() -> journal.service.getEventCount().block().total() == 1);

        EventRecord r = journal.service.drainUnsynced(1).blockFirst().record();
        assertThat(r.data()).containsEntry("state", null)
                .containsEntry("badQuality", true)
                .containsEntry("qualityStatus", "BAD")
                .doesNotContainKey("unit")
                .doesNotContainKey("scale");
        assertThat(((Number) r.data().get("quality")).longValue()).isEqualTo(0x80340000L);
    }

    @Test
    void changeOnUnmappedNodeIsIgnored() {
        connector.connect();

        server.emit(new DataChange("ns=2;s=Unmapped", 1, QualityCode.GOOD, SOURCE_TS));

        assertThat(journal.service.getEventCount().block().total()).isZero();
    }

    @Test
    void missingSourceTimestampFallsBackToLocalClock() {
        TagMapping mapping = new TagMapping(STATE, "press-1", "state", null, null, null, null);

        EventRecord a = connector.toEvent(mapping, new DataChange(STATE, "RUNNING", null, null));
        EventRecord b = connector.toEvent(mapping, new DataChange(STATE, "RUNNING", null, null));

        assertThat(a.timestamp()).isEqualTo(InMemoryJournal.START);
        assertThat(a.data()).containsEntry("state", "RUNNING").containsEntry("qualityStatus", "GOOD");
        assertThat(a.eventId()).isNotEqualTo(b.eventId());
    }

    @Test
    void reconnectsAfterConnectionLoss() {
        connector.connect();

        server.onLost.accept(new RuntimeException("socket closed"));

        assertThat(server.calls).contains("subscription.terminate", "session.close", "transport.close");
        awaitTrue(() -> server.opens.get() == 2 && connector.isHealthy());
        assertThat(connector.status().lastError()).isNull();
    }

    @Test
    void transientFailuresAreRetriedWithBackoff() {
        server.failFirst = 2;

        ConnectorState state = connector.connect();

        assertThat(state).isInstanceOf(Subscribed.class);
        assertThat(server.opens.get()).isEqualTo(3);
        assertThat(connector.status().reconnectAttempts()).isEqualTo(2L);
    }

    @Test
    void exhaustedRetriesRaiseConnectionException() {
        server.failFirst = Integer.MAX_VALUE;

        assertThatThrownBy(connector::connect)
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("opc.tcp://plc:4840");

        assertThat(server.opens.get()).isEqualTo(3);
        assertThat(connector.getState()).isInstanceOf(Disconnected.class);
    }

    @Test
    void rejectedCertificateIsNotRetried() {
        server.failFirst = Integer.MAX_VALUE;
        server.failure = new CertificateRejectedException("server certificate not trusted");

        assertThatThrownBy(connector::connect).isInstanceOf(CertificateRejectedException.class);
        assertThat(server.opens.get()).isEqualTo(1);
    }

    @Test
    void readWithRetryRetriesTimeoutsAndReturnsValue() {
        connector.connect();
        PointReading ok = new PointReading(TEMP, true, 215, QualityCode.GOOD, SOURCE_TS);
        server.readScript.add(new OperationTimeoutException(TEMP, "timeout"));
        server.readScript.add(new OperationTimeoutException(TEMP, "timeout"));
        server.readScript.add(ok);

        assertThat(connector.readWithRetry(TEMP, 3)).isEqualTo(ok);
        assertThat(server.reads.get()).isEqualTo(3);
    }

    @Test
    void readWithRetryGivesUpWithLastError() {
        connector.connect();
        server.readScript.add(new OperationTimeoutException(TEMP, "first"));
        server.readScript.add(new OperationTimeoutException(TEMP, "second"));

        assertThatThrownBy(() -> connector.readWithRetry(TEMP, 2))
                .isInstanceOf(OperationTimeoutException.class)
                .hasMessage("second");
    }

    @Test
    void unknownNodeIsNotRetried() {
        connector.connect();

        assertThatThrownBy(() -> connector.readWithRetry("ns=2;s=Nope", 5))
                .isInstanceOf(NodeNotFoundException.class);
        assertThat(server.reads.get()).isEqualTo(1);
    }

    @Test
    void pointAccessWithoutSessionFails() {
        assertThatThrownBy(() -> connector.read(TEMP)).isInstanceOf(SessionInvalidException.class);
    }

    @Test
    void writeAndBrowseGoThroughTheSession() {
        connector.connect();

        assertThat(connector.write(STATE, 1).success()).isTrue();
        assertThat(connector.browse("i=85")).extracting(BrowseEntry::browseName).containsExactly("2:Line1");
        assertThat(server.calls).contains("write " + STATE + "=1");
    }

    @Test
    void illegalTransitionsAreRejected() {
        assertThat(connector.transition(new Subscribed(null, null, null))).isFalse();
        assertThat(connector.transition(new Disconnected("again"))).isFalse();
        assertThat(connector.getState()).isInstanceOf(Disconnected.class);
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError(e);
            }
        }
    }
}
