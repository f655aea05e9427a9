package com.factory.edge.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.factory.edge.connector.SecurityMode;

/**
 * =====================================================================
 * ConnectorProperties
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Endpoint, security and reconnect settings of the OPC UA protocol connector.
 *
 * CONFIGURATION PREFIX
 * --------------------
 * edge.connector.*
 *
 * SECURITY
 * --------
 * Anything other than {@code security-mode: NONE} requires a keystore and a
 * trust-list directory. Missing trust material fails the connect closed;
 * there is no fallback to an unsecured endpoint.
 */
@ConfigurationProperties(prefix = "edge.connector")
public class ConnectorProperties {

	private boolean enabled = true;

	private String endpointUrl = "opc.tcp://localhost:4840";

	private String applicationName = "Edge Telemetry Gateway";
	private String applicationUri = "urn:factory:edge:gateway";

	private SecurityMode securityMode = SecurityMode.SIGN_AND_ENCRYPT;

	/** Policy name as in the OPC UA profile URI, e.g. {@code Basic256Sha256}. */
	private String securityPolicy = "Basic256Sha256";

	/** PKCS#12 keystore holding the client key pair and certificate. */
	private String keystorePath;
	private String keystorePassword;
	private String keyAlias = "client";

	/** Directory of trusted/rejected server certificates. */
	private String trustListDir;

	/** Location of the tag-map JSON (Spring resource syntax). */
	private String tagMap = "classpath:tag-map.json";

	private Duration publishingInterval = Duration.ofSeconds(1);
	private Duration requestTimeout = Duration.ofSeconds(5);

	/** Pause between attempts of {@code readWithRetry}. */
	private Duration readRetryDelay = Duration.ofMillis(500);

	private Reconnect reconnect = new Reconnect();

	public static class Reconnect {

		private Duration initialDelay = Duration.ofSeconds(1);
		private int maxRetries = 10;
		private Duration maxDelay = Duration.ofSeconds(10);

		public Duration getInitialDelay() { return initialDelay; }
		public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }

		public int getMaxRetries() { return maxRetries; }
		public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

		public Duration getMaxDelay() { return maxDelay; }
		public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
	}

	public boolean isEnabled() { return enabled; }
	public void setEnabled(boolean enabled) { this.enabled = enabled; }

	public String getEndpointUrl() { return endpointUrl; }
	public void setEndpointUrl(String endpointUrl) { this.endpointUrl = endpointUrl; }

	public String getApplicationName() { return applicationName; }
	public void setApplicationName(String applicationName) { this.applicationName = applicationName; }

	public String getApplicationUri() { return applicationUri; }
	public void setApplicationUri(String applicationUri) { this.applicationUri = applicationUri; }

	public SecurityMode getSecurityMode() { return securityMode; }
	public void setSecurityMode(SecurityMode securityMode) { this.securityMode = securityMode; }

	public String getSecurityPolicy() { return securityPolicy; }
	public void setSecurityPolicy(String securityPolicy) { this.securityPolicy = securityPolicy; }

	public String getKeystorePath() { return keystorePath; }
	public void setKeystorePath(String keystorePath) { this.keystorePath = keystorePath; }

	public String getKeystorePassword() { return keystorePassword; }
	public void setKeystorePassword(String keystorePassword) { this.keystorePassword = keystorePassword; }

	public String getKeyAlias() { return keyAlias; }
	public void setKeyAlias(String keyAlias) { this.keyAlias = keyAlias; }

	public String getTrustListDir() { return trustListDir; }
	public void setTrustListDir(String trustListDir) { this.trustListDir = trustListDir; }

	public String getTagMap() { return tagMap; }
	public void setTagMap(String tagMap) { this.tagMap = tagMap; }

	public Duration getPublishingInterval() { return publishingInterval; }
	public void setPublishingInterval(Duration publishingInterval) { this.publishingInterval = publishingInterval; }

	public Duration getRequestTimeout() { return requestTimeout; }
	public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

	public Duration getReadRetryDelay() { return readRetryDelay; }
	public void setReadRetryDelay(Duration readRetryDelay) { this.readRetryDelay = readRetryDelay; }

	public Reconnect getReconnect() { return reconnect; }
	public void setReconnect(Reconnect reconnect) { this.reconnect = reconnect; }
}
