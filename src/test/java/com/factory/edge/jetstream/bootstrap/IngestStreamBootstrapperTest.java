package com.factory.edge.jetstream.bootstrap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.factory.edge.jetstream.config.NatsProperties;
import com.factory.edge.jetstream.naming.IngestSubject;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;

class IngestStreamBootstrapperTest {

    private final JetStreamManagement jsm = mock(JetStreamManagement.class);
    private final NatsProperties props = new NatsProperties();
    private final IngestStreamBootstrapper bootstrapper = new IngestStreamBootstrapper(jsm, props,
            new IngestSubject("telemetry.ingest", "site-01", "edge-01"));

    @Test
    void createsMissingStream() throws Exception {
        JetStreamApiException notFound = mock(JetStreamApiException.class);
        when(notFound.getApiErrorCode()).thenReturn(10059);
        when(jsm.getStreamInfo("TELEMETRY_INGEST")).thenThrow(notFound);

        bootstrapper.run(null);

        ArgumentCaptor<StreamConfiguration> created = ArgumentCaptor.forClass(StreamConfiguration.class);
        verify(jsm).addStream(created.capture());
        assertThat(created.getValue().getSubjects()).containsExactly("telemetry.ingest.>");
        assertThat(created.getValue().getDuplicateWindow()).isEqualTo(Duration.ofHours(24));
        assertThat(created.getValue().getStorageType()).isEqualTo(StorageType.File);
    }

    @Test
    void otherApiErrorsPropagate() throws Exception {
        JetStreamApiException denied = mock(JetStreamApiException.class);
        when(denied.getApiErrorCode()).thenReturn(10100);
        when(jsm.getStreamInfo("TELEMETRY_INGEST")).thenThrow(denied);

        assertThatThrownBy(() -> bootstrapper.run(null)).isSameAs(denied);
        verify(jsm, never()).addStream(any());
    }

    @Test
    void matchingStreamIsLeftAlone() throws Exception {
        StreamInfo info = mock(StreamInfo.class);
        when(info.getConfiguration()).thenReturn(bootstrapper.desired());
        when(jsm.getStreamInfo("TELEMETRY_INGEST")).thenReturn(info);

        bootstrapper.run(null);

        verify(jsm, never()).addStream(any());
    }

    @Test
    void mismatchFailsOnlyInStrictMode() {
        StreamConfiguration shortWindow = StreamConfiguration.builder(bootstrapper.desired())
                .duplicateWindow(Duration.ofMinutes(2))
                .build();

        bootstrapper.validateExisting(bootstrapper.desired(), shortWindow);

        props.setFailOnMismatch(true);
        assertThatThrownBy(() -> bootstrapper.validateExisting(bootstrapper.desired(), shortWindow))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("duplicateWindow");
    }
}
