package com.factory.edge.connector;

import java.time.Duration;

/**
 * Everything a transport needs to open a secure channel to the automation
 * server.
 *
 * @param securityPolicy policy name as in the OPC UA profile URI
 *                       ({@code None}, {@code Basic256Sha256}, ...)
 */
public record EndpointConfig(
        String endpointUrl,
        String applicationName,
        String applicationUri,
        SecurityMode securityMode,
        String securityPolicy,
        String keystorePath,
        String keystorePassword,
        String keyAlias,
        String trustListDir,
        Duration requestTimeout,
        Duration publishingInterval) {

    public EndpointConfig {
        if (endpointUrl == null || endpointUrl.isBlank()) {
            throw new IllegalArgumentException("endpointUrl is required");
        }
        securityMode = securityMode == null ? SecurityMode.SIGN_AND_ENCRYPT : securityMode;
        securityPolicy = securityPolicy == null || securityPolicy.isBlank() ? "Basic256Sha256" : securityPolicy;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(5) : requestTimeout;
        publishingInterval = publishingInterval == null ? Duration.ofSeconds(1) : publishingInterval;
    }

    public boolean secured() {
        return securityMode != SecurityMode.NONE && !"None".equalsIgnoreCase(securityPolicy);
    }
}
