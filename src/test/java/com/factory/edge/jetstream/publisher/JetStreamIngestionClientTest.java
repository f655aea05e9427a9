package com.factory.edge.jetstream.publisher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.factory.edge.config.JacksonConfig;
import com.factory.edge.core.chain.ChainSigner;
import com.factory.edge.core.ingest.IngestResponse;
import com.factory.edge.core.ingest.IngestResult;
import com.factory.edge.core.model.EventRecord;
import com.factory.edge.core.model.JournalEvent;
import com.factory.edge.core.model.SyncState;
import com.factory.edge.jetstream.naming.IngestSubject;

import io.nats.client.JetStream;
import io.nats.client.Message;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;

class JetStreamIngestionClientTest {

    private final JetStream js = mock(JetStream.class);
    private final ObjectMapper mapper = new JacksonConfig().objectMapper();
    private final JetStreamIngestionClient client = new JetStreamIngestionClient(js,
            new IngestSubject("telemetry.ingest", "site-01", "edge-01"), "edge-01", "TELEMETRY_INGEST", mapper);

    private static JournalEvent event(long localId, String assetId) {
        EventRecord r = new EventRecord("e-" + localId, Instant.parse("2024-03-01T08:00:00Z").plusSeconds(localId),
                assetId, null, EventRecord.TYPE_TELEMETRY, Map.of("v", localId));
        return new JournalEvent(localId, r, "cd".repeat(32), ChainSigner.GENESIS, SyncState.PENDING);
    }

    private static PublishAck ack(boolean duplicate) {
        PublishAck ack = mock(PublishAck.class);
        when(ack.isDuplicate()).thenReturn(duplicate);
        when(ack.getStream()).thenReturn("TELEMETRY_INGEST");
        return ack;
    }

    @Test
    void publishesEachEventWithItsIdAsMessageId() throws Exception {
        PublishAck ack = ack(false);
        when(js.publish(any(Message.class), any(PublishOptions.class))).thenReturn(ack);

        IngestResponse response = client.ingest(List.of(event(1, "press 1"), event(2, "press-2"))).block();

        assertThat(response.results()).extracting(IngestResult::accepted).containsExactly(true, true);

        ArgumentCaptor<Message> messages = ArgumentCaptor.forClass(Message.class);
        ArgumentCaptor<PublishOptions> options = ArgumentCaptor.forClass(PublishOptions.class);
        verify(js, times(2)).publish(messages.capture(), options.capture());

        Message first = messages.getAllValues().get(0);
        assertThat(first.getSubject()).isEqualTo("telemetry.ingest.site-01.edge-01.press_1");
        assertThat(first.getHeaders().getFirst("Edge-Local-Id")).isEqualTo("1");
        assertThat(first.getHeaders().getFirst("Edge-Node-Id")).isEqualTo("edge-01");
        assertThat(options.getAllValues()).extracting(PublishOptions::getMessageId).containsExactly("e-1", "e-2");
        assertThat(options.getValue().getExpectedStream()).isEqualTo("TELEMETRY_INGEST");

        JsonNode body = mapper.readTree(first.getData());
        assertThat(body.get("eventId").asText()).isEqualTo("e-1");
        assertThat(body.get("signature").asText()).isEqualTo("cd".repeat(32));
        assertThat(body.get("timestamp").asText()).isEqualTo("2024-03-01T08:00:01Z");
    }

    @Test
    void duplicateAckCountsAsAccepted() throws Exception {
        PublishAck ack = ack(true);
        when(js.publish(any(Message.class), any(PublishOptions.class))).thenReturn(ack);

        IngestResponse response = client.ingest(List.of(event(7, "press-1"))).block();

        assertThat(response.find("e-7")).hasValueSatisfying(r -> assertThat(r.accepted()).isTrue());
    }

    @Test
    void firstFailureRejectsTheRestOfTheBatch() throws Exception {
        PublishAck ok = ack(false);
        when(js.publish(any(Message.class), any(PublishOptions.class)))
                .thenReturn(ok)
                .thenThrow(new IOException("Timeout or no response waiting for NATS JetStream server"));

        IngestResponse response = client.ingest(List.of(event(1, "a"), event(2, "a"), event(3, "a"))).block();

        assertThat(response.find("e-1")).hasValueSatisfying(r -> assertThat(r.accepted()).isTrue());
        assertThat(response.find("e-2")).hasValueSatisfying(r -> assertThat(r.reason()).startsWith("Timeout"));
        assertThat(response.find("e-3")).hasValueSatisfying(r -> assertThat(r.reason()).startsWith("not attempted: "));
        verify(js, times(2)).publish(any(Message.class), any(PublishOptions.class));
    }
}
