package com.factory.edge.jetstream.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection and stream settings of the JetStream ingestion path. Only read
 * when {@code edge.sync.transport=jetstream}.
 */
@ConfigurationProperties(prefix = "edge.nats")
public class NatsProperties {

    // ---------------------------------------------------------------------
    // NATS connectivity
    // ---------------------------------------------------------------------

    private String url = "nats://localhost:4222";

    // ---------------------------------------------------------------------
    // Optional authentication / TLS
    // ---------------------------------------------------------------------

    private String user;

    private String password;

    private String token;

    /** Path to a {@code .creds} file (JWT + NKey seed). */
    private String creds;

    private boolean tls = false;

    // ---------------------------------------------------------------------
    // Ingest stream
    // ---------------------------------------------------------------------

    /** Subjects are {@code <prefix>.<siteId>.<nodeId>.<assetId>}. */
    private String subjectPrefix = "telemetry.ingest";

    private String stream = "TELEMETRY_INGEST";

    /** JetStream deduplicates on Msg-Id inside this window. */
    private Duration duplicateWindow = Duration.ofHours(24);

    private Duration maxAge = Duration.ofDays(7);

    /** Create/validate the ingest stream on startup. */
    private boolean bootstrap = false;

    private boolean failOnMismatch = false;

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public String getCreds() { return creds; }
    public void setCreds(String creds) { this.creds = creds; }

    public boolean isTls() { return tls; }
    public void setTls(boolean tls) { this.tls = tls; }

    public String getSubjectPrefix() { return subjectPrefix; }
    public void setSubjectPrefix(String subjectPrefix) { this.subjectPrefix = subjectPrefix; }

    public String getStream() { return stream; }
    public void setStream(String stream) { this.stream = stream; }

    public Duration getDuplicateWindow() { return duplicateWindow; }
    public void setDuplicateWindow(Duration duplicateWindow) { this.duplicateWindow = duplicateWindow; }

    public Duration getMaxAge() { return maxAge; }
    public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

    public boolean isBootstrap() { return bootstrap; }
    public void setBootstrap(boolean bootstrap) { this.bootstrap = bootstrap; }

    public boolean isFailOnMismatch() { return failOnMismatch; }
    public void setFailOnMismatch(boolean failOnMismatch) { this.failOnMismatch = failOnMismatch; }
}
