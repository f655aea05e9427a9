package com.factory.edge.connector;

/**
 * =====================================================================
 * AutomationClient
 * =====================================================================
 *
 * Transport-neutral entry point to an industrial automation server. The
 * {@link ProtocolConnector} owns the state machine and reconnect policy; an
 * implementation only knows how to open one channel.
 *
 *   AutomationClient ──open──▶ AutomationTransport ──createSession──▶
 *   AutomationSession ──subscribe──▶ AutomationSubscription
 *
 * Implementations MUST fail closed: a certificate that does not validate
 * against the trust list raises {@link CertificateRejectedException} and never
 * falls back to an unsecured endpoint.
 */
public interface AutomationClient {

    AutomationTransport open(EndpointConfig endpoint) throws Exception;
}
