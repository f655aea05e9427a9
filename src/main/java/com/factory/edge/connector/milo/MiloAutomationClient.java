package com.factory.edge.connector.milo;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;

import java.io.File;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import org.eclipse.milo.opcua.sdk.client.OpcUaClient;
import org.eclipse.milo.opcua.sdk.client.SessionActivityListener;
import org.eclipse.milo.opcua.sdk.client.api.UaSession;
import org.eclipse.milo.opcua.sdk.client.api.config.OpcUaClientConfig;
import org.eclipse.milo.opcua.sdk.client.api.config.OpcUaClientConfigBuilder;
import org.eclipse.milo.opcua.sdk.client.api.identity.AnonymousProvider;
import org.eclipse.milo.opcua.sdk.client.api.subscriptions.UaMonitoredItem;
import org.eclipse.milo.opcua.sdk.client.api.subscriptions.UaSubscription;
import org.eclipse.milo.opcua.stack.client.security.DefaultClientCertificateValidator;
import org.eclipse.milo.opcua.stack.core.AttributeId;
import org.eclipse.milo.opcua.stack.core.Identifiers;
import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.UaException;
import org.eclipse.milo.opcua.stack.core.security.DefaultTrustListManager;
import org.eclipse.milo.opcua.stack.core.security.SecurityPolicy;
import org.eclipse.milo.opcua.stack.core.types.builtin.ByteString;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.DateTime;
import org.eclipse.milo.opcua.stack.core.types.builtin.ExpandedNodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.QualifiedName;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.Variant;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UNumber;
import org.eclipse.milo.opcua.stack.core.types.enumerated.BrowseDirection;
import org.eclipse.milo.opcua.stack.core.types.enumerated.BrowseResultMask;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MessageSecurityMode;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MonitoringMode;
import org.eclipse.milo.opcua.stack.core.types.enumerated.NodeClass;
import org.eclipse.milo.opcua.stack.core.types.enumerated.TimestampsToReturn;
import org.eclipse.milo.opcua.stack.core.types.structured.BrowseDescription;
import org.eclipse.milo.opcua.stack.core.types.structured.BrowseResult;
import org.eclipse.milo.opcua.stack.core.types.structured.EndpointDescription;
import org.eclipse.milo.opcua.stack.core.types.structured.MonitoredItemCreateRequest;
import org.eclipse.milo.opcua.stack.core.types.structured.MonitoringParameters;
import org.eclipse.milo.opcua.stack.core.types.structured.ReadValueId;
import org.eclipse.milo.opcua.stack.core.types.structured.ReferenceDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.factory.edge.connector.AutomationClient;
import com.factory.edge.connector.AutomationSession;
import com.factory.edge.connector.AutomationSubscription;
import com.factory.edge.connector.AutomationTransport;
import com.factory.edge.connector.BrowseEntry;
import com.factory.edge.connector.CertificateRejectedException;
import com.factory.edge.connector.ConnectionException;
import com.factory.edge.connector.DataChange;
import com.factory.edge.connector.DataChangeListener;
import com.factory.edge.connector.EndpointConfig;
import com.factory.edge.connector.NodeNotFoundException;
import com.factory.edge.connector.OperationTimeoutException;
import com.factory.edge.connector.PointAccessException;
import com.factory.edge.connector.PointReading;
import com.factory.edge.connector.QualityCode;
import com.factory.edge.connector.SecurityMode;
import com.factory.edge.connector.SessionInvalidException;
import com.factory.edge.connector.TagMapping;
import com.factory.edge.connector.WriteOutcome;

/**
 * =====================================================================
 * MiloAutomationClient
 * =====================================================================
 *
 * OPC UA transport on Eclipse Milo.
 *
 * SECURITY
 * --------
 * - Endpoint chosen by exact (policy, mode) match; never downgraded
 * - Client identity from a PKCS#12 keystore
 * - Server certificate checked against a trust-list directory
 *   ({@code trusted/}, {@code rejected/}, {@code issuers/})
 * - Secured endpoint without trust material → {@link CertificateRejectedException}
 *
 * STATUS MAPPING
 * --------------
 *   Bad_NodeIdUnknown                → NodeNotFoundException
 *   Bad_Timeout / client timeout     → OperationTimeoutException
 *   Bad_Session* / Bad_NotConnected  → SessionInvalidException
 *   Bad_Certificate* / SecurityChecks → CertificateRejectedException
 */
public class MiloAutomationClient implements AutomationClient {

    private static final Logger log = LoggerFactory.getLogger(MiloAutomationClient.class);

    private static final List<Long> CERTIFICATE_FAILURES = List.of(
            StatusCodes.Bad_SecurityChecksFailed,
            StatusCodes.Bad_CertificateUntrusted,
            StatusCodes.Bad_CertificateInvalid,
            StatusCodes.Bad_CertificateTimeInvalid,
            StatusCodes.Bad_CertificateHostNameInvalid,
            StatusCodes.Bad_CertificateUriInvalid,
            StatusCodes.Bad_CertificateRevoked,
            StatusCodes.Bad_CertificateIssuerRevoked,
            StatusCodes.Bad_CertificateRevocationUnknown,
            StatusCodes.Bad_CertificateUseNotAllowed);

    private static final List<Long> SESSION_FAILURES = List.of(
            StatusCodes.Bad_SessionIdInvalid,
            StatusCodes.Bad_SessionClosed,
            StatusCodes.Bad_SessionNotActivated,
            StatusCodes.Bad_NotConnected,
            StatusCodes.Bad_ConnectionClosed);

    @Override
    public AutomationTransport open(EndpointConfig endpoint) throws Exception {
        SecurityPolicy policy = endpoint.secured() ? policy(endpoint.securityPolicy()) : SecurityPolicy.None;
        MessageSecurityMode mode = endpoint.secured() ? mode(endpoint.securityMode()) : MessageSecurityMode.None;

        if (endpoint.secured() && (blank(endpoint.trustListDir()) || blank(endpoint.keystorePath()))) {
            throw new CertificateRejectedException("Security policy " + policy + " requires keystore-path and "
                    + "trust-list-dir; refusing to connect without certificate validation");
        }

        try {
            OpcUaClient client = OpcUaClient.create(
                    endpoint.endpointUrl(),
                    endpoints -> select(endpoints, policy, mode),
                    builder -> configure(builder, endpoint));
            log.info("Opened OPC UA channel to {} (policy={}, mode={})", endpoint.endpointUrl(), policy, mode);
            return new MiloTransport(client, endpoint);
        } catch (UaException e) {
            throw translateConnect(endpoint, e);
        }
    }

    private static Optional<EndpointDescription> select(List<EndpointDescription> endpoints, SecurityPolicy policy,
                                                        MessageSecurityMode mode) {
        return endpoints.stream()
                .filter(e -> policy.getUri().equals(e.getSecurityPolicyUri()))
                .filter(e -> e.getSecurityMode() == mode)
                .findFirst();
    }

    private static OpcUaClientConfig configure(OpcUaClientConfigBuilder builder, EndpointConfig endpoint) {

        builder.setApplicationName(LocalizedText.english(endpoint.applicationName()))
                .setApplicationUri(endpoint.applicationUri())
                .setIdentityProvider(new AnonymousProvider())
                .setRequestTimeout(uint(endpoint.requestTimeout().toMillis()));

        if (endpoint.secured()) {
            try {
                KeyStore keyStore = loadKeyStore(endpoint);
                char[] password = endpoint.keystorePassword() == null ? new char[0]
                        : endpoint.keystorePassword().toCharArray();
                PrivateKey key = (PrivateKey) keyStore.getKey(endpoint.keyAlias(), password);
                X509Certificate certificate = (X509Certificate) keyStore.getCertificate(endpoint.keyAlias());
                if (key == null || certificate == null) {
                    throw new CertificateRejectedException("Keystore has no key entry '" + endpoint.keyAlias() + "'");
                }
                Certificate[] chain = keyStore.getCertificateChain(endpoint.keyAlias());
                X509Certificate[] x509Chain = chain == null ? new X509Certificate[] { certificate }
                        : Arrays.stream(chain).map(X509Certificate.class::cast).toArray(X509Certificate[]::new);

                File pkiDir = Path.of(endpoint.trustListDir()).toFile();
                DefaultTrustListManager trustList = new DefaultTrustListManager(pkiDir);

                builder.setKeyPair(new KeyPair(certificate.getPublicKey(), key))
                        .setCertificate(certificate)
                        .setCertificateChain(x509Chain)
                        .setCertificateValidator(new DefaultClientCertificateValidator(trustList));
            } catch (CertificateRejectedException e) {
                throw e;
            } catch (Exception e) {
                throw new CertificateRejectedException("Cannot load client certificate material: " + e.getMessage(), e);
            }
        }
        return builder.build();
    }

    private static KeyStore loadKeyStore(EndpointConfig endpoint) throws Exception {
        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        char[] password = endpoint.keystorePassword() == null ? new char[0] : endpoint.keystorePassword().toCharArray();
        try (InputStream in = Files.newInputStream(Path.of(endpoint.keystorePath()))) {
            keyStore.load(in, password);
        }
        return keyStore;
    }

    static SecurityPolicy policy(String name) {
        for (SecurityPolicy p : SecurityPolicy.values()) {
            if (p.name().equalsIgnoreCase(name) || p.getUri().endsWith("#" + name)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unsupported security policy: " + name);
    }

    static MessageSecurityMode mode(SecurityMode mode) {
        return switch (mode) {
            case NONE -> MessageSecurityMode.None;
            case SIGN -> MessageSecurityMode.Sign;
            case SIGN_AND_ENCRYPT -> MessageSecurityMode.SignAndEncrypt;
        };
    }

    private static ConnectionException translateConnect(EndpointConfig endpoint, Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof ConnectionException ce) {
            return ce;
        }
        if (cause instanceof UaException ua && CERTIFICATE_FAILURES.contains(ua.getStatusCode().getValue())) {
            return new CertificateRejectedException("Server certificate rejected by " + endpoint.endpointUrl()
                    + " trust list: " + ua.getStatusCode(), ua);
        }
        return new ConnectionException("OPC UA connect to " + endpoint.endpointUrl() + " failed: "
                + cause.getMessage(), cause);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    static Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof UNumber n) {
            return n.longValue();
        }
        if (value instanceof Number || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof DateTime dt) {
            return dt.getJavaInstant().toString();
        }
        if (value instanceof LocalizedText text) {
            return text.getText();
        }
        if (value instanceof NodeId id) {
            return id.toParseableString();
        }
        if (value instanceof ByteString bytes) {
            return HexFormat.of().formatHex(bytes.bytesOrEmpty());
        }
        if (value instanceof Object[] array) {
            List<Object> out = new ArrayList<>(array.length);
            for (Object o : array) {
                out.add(normalize(o));
            }
            return out;
        }
        return String.valueOf(value);
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }

    // ---------------------------------------------------------------------
    // Transport / session
    // ---------------------------------------------------------------------

    /**
     * One {@link OpcUaClient}: the secure channel. The session is activated by
     * {@link #createSession(Consumer)}.
     */
    /**
     * Waits for a session-setup step, bounded by the endpoint's request timeout.
     */
    static <T> T awaitSetup(String what, EndpointConfig endpoint, CompletableFuture<T> future)
            throws ExecutionException {
        try {
            return future.get(endpoint.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ConnectionException("Creating " + what + " on " + endpoint.endpointUrl()
                    + " timed out after " + endpoint.requestTimeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while creating " + what + " on " + endpoint.endpointUrl(), e);
        }
    }

    private static final class MiloTransport implements AutomationTransport {

        private final OpcUaClient client;
        private final EndpointConfig endpoint;

        MiloTransport(OpcUaClient client, EndpointConfig endpoint) {
            this.client = client;
            this.endpoint = endpoint;
        }

        @Override
        public AutomationSession createSession(Consumer<Throwable> onLost) throws Exception {
            long timeoutMs = endpoint.requestTimeout().toMillis() * 2;
            try {
                client.connect().get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw translateConnect(endpoint, e);
            } catch (TimeoutException e) {
                throw new ConnectionException("Session activation on " + endpoint.endpointUrl() + " timed out", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("Interrupted while activating session on " + endpoint.endpointUrl(), e);
            }
            MiloSession session = new MiloSession(client, endpoint);
            client.addSessionActivityListener(new SessionActivityListener() {
                @Override
                public void onSessionInactive(UaSession uaSession) {
                    if (session.markInactive()) {
                        onLost.accept(new ConnectionException("Session " + uaSession.getSessionId() + " inactive"));
                    }
                }
            });
            return session;
        }

        @Override
        public void close() throws Exception {
            client.disconnect().get(endpoint.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private static final class MiloSession implements AutomationSession {

        private final OpcUaClient client;
        private final EndpointConfig endpoint;
        private volatile boolean active = true;

        MiloSession(OpcUaClient client, EndpointConfig endpoint) {
            this.client = client;
            this.endpoint = endpoint;
        }

        boolean markInactive() {
            boolean was = active;
            active = false;
            return was;
        }

        @Override
        public AutomationSubscription subscribe(List<TagMapping> mappings, DataChangeListener listener)
                throws Exception {
            double publishingMs = endpoint.publishingInterval().toMillis();
            UaSubscription subscription = awaitSetup("subscription", endpoint,
                    client.getSubscriptionManager().createSubscription(publishingMs));

            List<MonitoredItemCreateRequest> requests = new ArrayList<>(mappings.size());
            for (int i = 0; i < mappings.size(); i++) {
                TagMapping m = mappings.get(i);
                double samplingMs = m.samplingInterval() == null ? publishingMs : m.samplingInterval().toMillis();
                ReadValueId readValueId = new ReadValueId(NodeId.parse(m.nodeId()), AttributeId.Value.uid(), null,
                        QualifiedName.NULL_VALUE);
                MonitoringParameters parameters = new MonitoringParameters(uint(i + 1L), samplingMs, null, uint(10),
                        true);
                requests.add(new MonitoredItemCreateRequest(readValueId, MonitoringMode.Reporting, parameters));
            }

            UaSubscription.ItemCreationCallback onItemCreated = (item, index) -> {
                String nodeId = mappings.get(index).nodeId();
                item.setValueConsumer(value -> listener.onDataChange(toChange(nodeId, value)));
            };

            List<UaMonitoredItem> items = awaitSetup("monitored items", endpoint,
                    subscription.createMonitoredItems(TimestampsToReturn.Both, requests, onItemCreated));

            for (int i = 0; i < items.size(); i++) {
                UaMonitoredItem item = items.get(i);
                if (!item.getStatusCode().isGood()) {
                    log.warn("Monitored item for {} rejected: {}", mappings.get(i).nodeId(), item.getStatusCode());
                }
            }
            return new MiloSubscription(client, subscription, endpoint.requestTimeout());
        }

        @Override
        public PointReading read(String nodeId) {
            DataValue value = await(nodeId, client.readValue(0.0, TimestampsToReturn.Both, parse(nodeId)));
            StatusCode status = value.getStatusCode() == null ? StatusCode.GOOD : value.getStatusCode();
            throwIfPointFailure(nodeId, status);
            return PointReading.of(toChange(nodeId, value));
        }

        @Override
        public WriteOutcome write(String nodeId, Object value) {
            StatusCode status = await(nodeId,
                    client.writeValue(parse(nodeId), DataValue.valueOnly(new Variant(value))));
            throwIfPointFailure(nodeId, status);
            return new WriteOutcome(nodeId, status.isGood(), new QualityCode(status.getValue()));
        }

        @Override
        public List<BrowseEntry> browse(String nodeId) {
            BrowseDescription description = new BrowseDescription(parse(nodeId), BrowseDirection.Forward,
                    Identifiers.References, true,
                    uint(NodeClass.Object.getValue() | NodeClass.Variable.getValue()),
                    uint(BrowseResultMask.All.getValue()));
            BrowseResult result = await(nodeId, client.browse(description));
            throwIfPointFailure(nodeId, result.getStatusCode());

            ReferenceDescription[] references = result.getReferences();
            if (references == null) {
                return List.of();
            }
            List<BrowseEntry> entries = new ArrayList<>(references.length);
            for (ReferenceDescription r : references) {
                ExpandedNodeId child = r.getNodeId();
                entries.add(new BrowseEntry(child.toParseableString(),
                        r.getBrowseName() == null ? null : r.getBrowseName().getName(),
                        r.getDisplayName() == null ? null : r.getDisplayName().getText(),
                        r.getNodeClass() == null ? null : r.getNodeClass().name()));
            }
            return entries;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() throws Exception {
            active = false;
            client.disconnect().get(endpoint.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }

        private <T> T await(String nodeId, CompletableFuture<T> future) {
            try {
                return future.get(endpoint.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw new OperationTimeoutException(nodeId, "No answer for " + nodeId + " within "
                        + endpoint.requestTimeout(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationTimeoutException(nodeId, "Interrupted while waiting for " + nodeId, e);
            } catch (ExecutionException e) {
                Throwable cause = unwrap(e);
                if (cause instanceof UaException ua) {
                    throwIfPointFailure(nodeId, ua.getStatusCode());
                }
                throw new PointAccessException(nodeId, "Operation on " + nodeId + " failed: " + cause.getMessage(),
                        cause);
            }
        }

        private static NodeId parse(String nodeId) {
            try {
                return NodeId.parse(nodeId);
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("Malformed node id: " + nodeId, e);
            }
        }

        private static void throwIfPointFailure(String nodeId, StatusCode status) {
            if (status == null || !status.isBad()) {
                return;
            }
            long code = status.getValue();
            if (code == StatusCodes.Bad_NodeIdUnknown) {
                throw new NodeNotFoundException(nodeId, "Node " + nodeId + " does not exist");
            }
            if (code == StatusCodes.Bad_Timeout) {
                throw new OperationTimeoutException(nodeId, "Server timed out on " + nodeId);
            }
            if (SESSION_FAILURES.contains(code)) {
                throw new SessionInvalidException(nodeId, "Session invalid: " + status);
            }
        }

        private static DataChange toChange(String nodeId, DataValue value) {
            Object raw = value.getValue() == null ? null : value.getValue().getValue();
            StatusCode status = value.getStatusCode() == null ? StatusCode.GOOD : value.getStatusCode();
            DateTime source = value.getSourceTime();
            return new DataChange(nodeId, normalize(raw), new QualityCode(status.getValue()),
                    source == null || source.isNull() ? null : source.getJavaInstant());
        }
    }

    private static final class MiloSubscription implements AutomationSubscription {

        private final OpcUaClient client;
        private final UaSubscription subscription;
        private final Duration requestTimeout;
        private volatile boolean active = true;

        MiloSubscription(OpcUaClient client, UaSubscription subscription, Duration requestTimeout) {
            this.client = client;
            this.subscription = subscription;
            this.requestTimeout = requestTimeout;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void terminate() throws Exception {
            active = false;
            client.getSubscriptionManager().deleteSubscription(subscription.getSubscriptionId())
                    .get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
