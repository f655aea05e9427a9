package com.factory.edge.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * =====================================================================
 * JournalProperties
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Tuning and trust settings of the durable journal.
 *
 * CONFIGURATION PREFIX
 * --------------------
 * edge.journal.*
 *
 * The storage location itself is the regular {@code spring.r2dbc.url}.
 */
@ConfigurationProperties(prefix = "edge.journal")
public class JournalProperties {

	/** Default used by development setups only. */
	public static final String DEV_SIGNING_KEY = "dev-signing-key";

	/**
	 * HMAC key of the hash chain. Changing it invalidates every stored signature.
	 */
	private String signingKey = DEV_SIGNING_KEY;

	/** Failed delivery attempts before an event becomes a dead letter. */
	private int maxRetries = 5;

	/** Clock offset above which a drift warning is raised. */
	private Duration driftThreshold = Duration.ofSeconds(60);

	/** Synced events older than this are pruned. */
	private Duration retention = Duration.ofDays(30);

	private Duration pruneInterval = Duration.ofHours(6);

	/** Walk the chain once at startup. */
	private boolean verifyOnStartup = true;

	/**
	 * WHEN TRUE (STRICT MODE)
	 * -----------------------
	 * startup FAILS when the chain has violations.
	 *
	 * WHEN FALSE (PERMISSIVE MODE)
	 * ----------------------------
	 * violations are logged as WARN and startup continues.
	 *
	 * It only controls **reaction**, not **repair**.
	 */
	private boolean failOnViolation = false;

	/** How long shutdown waits for queued writes. */
	private Duration shutdownTimeout = Duration.ofSeconds(10);

	public String getSigningKey() { return signingKey; }
	public void setSigningKey(String signingKey) { this.signingKey = signingKey; }

	public int getMaxRetries() { return maxRetries; }
	public void setMaxRetries(int maxRetries) {
		if (maxRetries < 1) {
			throw new IllegalArgumentException("edge.journal.max-retries must be >= 1");
		}
		this.maxRetries = maxRetries;
	}

	public Duration getDriftThreshold() { return driftThreshold; }
	public void setDriftThreshold(Duration driftThreshold) { this.driftThreshold = driftThreshold; }

	public Duration getRetention() { return retention; }
	public void setRetention(Duration retention) { this.retention = retention; }

	public Duration getPruneInterval() { return pruneInterval; }
	public void setPruneInterval(Duration pruneInterval) { this.pruneInterval = pruneInterval; }

	public boolean isVerifyOnStartup() { return verifyOnStartup; }
	public void setVerifyOnStartup(boolean verifyOnStartup) { this.verifyOnStartup = verifyOnStartup; }

	public boolean isFailOnViolation() { return failOnViolation; }
	public void setFailOnViolation(boolean failOnViolation) { this.failOnViolation = failOnViolation; }

	public Duration getShutdownTimeout() { return shutdownTimeout; }
	public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
}
