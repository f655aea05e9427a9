package com.factory.edge.jetstream.bootstrap;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;

import com.factory.edge.jetstream.config.NatsProperties;
import com.factory.edge.jetstream.naming.IngestSubject;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;

/**
 * =====================================================================
 * IngestStreamBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Ensures the ingest stream exists with the duplicate window the
 * at-least-once delivery relies on.
 *
 * WHEN THIS RUNS
 * --------------
 * - Once during startup, before the journal is declared ready (so the first
 *   sync cycle never publishes into a missing stream)
 * - Only with {@code edge.nats.bootstrap=true}
 *
 * FAILURE MODEL
 * -------------
 * - Auth / connectivity errors → startup fails
 * - Existing stream differs:
 *     → fail OR warn depending on {@code edge.nats.fail-on-mismatch}
 *
 * Existing streams are never modified.
 */
public class IngestStreamBootstrapper implements ApplicationRunner, Ordered {

    private static final Logger log = LoggerFactory.getLogger(IngestStreamBootstrapper.class);

    /** JetStream API error code for "stream not found". */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final JetStreamManagement jsm;
    private final NatsProperties props;
    private final IngestSubject subjects;

    public IngestStreamBootstrapper(JetStreamManagement jsm, NatsProperties props, IngestSubject subjects) {
        this.jsm = jsm;
        this.props = props;
        this.subjects = subjects;
    }

    @Override
    public int getOrder() {
        return 0;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        StreamConfiguration desired = desired();
        try {
            StreamInfo existing = jsm.getStreamInfo(desired.getName());
            validateExisting(desired, existing.getConfiguration());
            return;
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() != JS_STREAM_NOT_FOUND_ERR) {
                throw e;
            }
        }

        jsm.addStream(desired);
        log.info("Created JetStream stream {} (subjects={}, duplicateWindow={}, maxAge={})", desired.getName(),
                desired.getSubjects(), desired.getDuplicateWindow(), desired.getMaxAge());
    }

    StreamConfiguration desired() {
        String name = Objects.requireNonNull(props.getStream(), "edge.nats.stream is required");
        Duration window = Objects.requireNonNull(props.getDuplicateWindow(), "edge.nats.duplicate-window is required");
        return StreamConfiguration.builder()
                .name(name)
                .subjects(subjects.streamSubject())
                .retentionPolicy(RetentionPolicy.Limits)
                .storageType(StorageType.File)
                .maxAge(props.getMaxAge())
                .duplicateWindow(window)
                .build();
    }

    void validateExisting(StreamConfiguration desired, StreamConfiguration actual) {
        List<String> diffs = new ArrayList<>();

        if (!Objects.equals(actual.getStorageType(), desired.getStorageType())) {
            diffs.add("storageType actual=" + actual.getStorageType() + " expected=" + desired.getStorageType());
        }
        if (!Objects.equals(actual.getDuplicateWindow(), desired.getDuplicateWindow())) {
            diffs.add("duplicateWindow actual=" + actual.getDuplicateWindow() + " expected="
                    + desired.getDuplicateWindow());
        }
        if (!new HashSet<>(actual.getSubjects()).containsAll(desired.getSubjects())) {
            diffs.add("subjects actual=" + actual.getSubjects() + " expected to include " + desired.getSubjects());
        }

        if (diffs.isEmpty()) {
            log.info("JetStream stream {} exists and matches config", desired.getName());
            return;
        }

        String msg = "JetStream stream exists but differs from expected: " + desired.getName() + " :: "
                + String.join("; ", diffs);
        if (props.isFailOnMismatch()) {
            throw new IllegalStateException(msg);
        }
        log.warn(msg);
    }
}
