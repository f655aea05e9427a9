package com.factory.edge.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Store-and-forward settings. Prefix: {@code edge.sync}.
 */
@ConfigurationProperties(prefix = "edge.sync")
public class SyncWorkerProperties {

    public enum Transport {
        HTTP, JETSTREAM
    }

    private boolean enabled = true;

    /** Which ingestion client delivers batches. */
    private Transport transport = Transport.HTTP;

    private String baseUrl = "http://localhost:4000";
    private String ingestPath = "/api/v1/ingest/events";

    /** GET target whose {@code Date} header is the trusted time. */
    private String timePath = "/api/v1/time";

    private int batchSize = 100;
    private Duration interval = Duration.ofSeconds(60);
    private Duration clockCheckInterval = Duration.ofHours(1);

    /** A batch exceeding this is a total failure. */
    private Duration requestTimeout = Duration.ofSeconds(30);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Transport getTransport() { return transport; }
    public void setTransport(Transport transport) { this.transport = transport; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getIngestPath() { return ingestPath; }
    public void setIngestPath(String ingestPath) { this.ingestPath = ingestPath; }

    public String getTimePath() { return timePath; }
    public void setTimePath(String timePath) { this.timePath = timePath; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("edge.sync.batch-size must be >= 1");
        }
        this.batchSize = batchSize;
    }

    public Duration getInterval() { return interval; }
    public void setInterval(Duration interval) { this.interval = interval; }

    public Duration getClockCheckInterval() { return clockCheckInterval; }
    public void setClockCheckInterval(Duration clockCheckInterval) { this.clockCheckInterval = clockCheckInterval; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
}
