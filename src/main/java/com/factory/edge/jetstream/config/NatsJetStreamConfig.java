package com.factory.edge.jetstream.config;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.factory.edge.config.EdgeNodeProperties;
import com.factory.edge.core.ingest.IngestionClient;
import com.factory.edge.jetstream.bootstrap.IngestStreamBootstrapper;
import com.factory.edge.jetstream.naming.IngestSubject;
import com.factory.edge.jetstream.publisher.JetStreamIngestionClient;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;

/**
 * JetStream ingestion path, active with {@code edge.sync.transport=jetstream}.
 */
@Configuration
@ConditionalOnProperty(prefix = "edge.sync", name = "transport", havingValue = "jetstream")
public class NatsJetStreamConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsJetStreamConfig.class);

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties props, EdgeNodeProperties node)
            throws IOException, InterruptedException {
        Options.Builder builder = new Options.Builder()
                .server(props.getUrl())
                .connectionName("edge-" + node.getNodeId())
                .maxReconnects(-1);

        if (notBlank(props.getToken())) {
            builder.token(props.getToken().toCharArray());
        }
        if (notBlank(props.getUser())) {
            String pass = props.getPassword() == null ? "" : props.getPassword();
            builder.userInfo(props.getUser().toCharArray(), pass.toCharArray());
        }
        if (notBlank(props.getCreds())) {
            builder.authHandler(Nats.credentials(props.getCreds()));
        }
        if (props.isTls()) {
            try {
                builder.secure();
            } catch (Exception e) {
                throw new IOException("Cannot create TLS context for NATS", e);
            }
        }

        Connection c = Nats.connect(builder.build());
        log.info("Connected to NATS (url={}, tls={}, user={}, creds={})", props.getUrl(), props.isTls(),
                mask(props.getUser()), props.getCreds() == null ? "" : props.getCreds());
        return c;
    }

    @Bean
    public JetStream jetStream(Connection connection) throws IOException {
        return connection.jetStream();
    }

    @Bean
    public JetStreamManagement jetStreamManagement(Connection connection) throws IOException {
        return connection.jetStreamManagement();
    }

    @Bean
    public IngestSubject ingestSubject(NatsProperties props, EdgeNodeProperties node) {
        return new IngestSubject(props.getSubjectPrefix(), node.getSiteId(), node.getNodeId());
    }

    @Bean
    public IngestionClient jetStreamIngestionClient(JetStream js, IngestSubject subjects, NatsProperties props,
                                                    EdgeNodeProperties node, ObjectMapper mapper) {
        log.info("Sync transport: JetStream (stream={}, subjects={})", props.getStream(), subjects);
        return new JetStreamIngestionClient(js, subjects, node.getNodeId(), props.getStream(), mapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "edge.nats", name = "bootstrap", havingValue = "true")
    public IngestStreamBootstrapper ingestStreamBootstrapper(JetStreamManagement jsm, NatsProperties props,
                                                             IngestSubject subjects) {
        return new IngestStreamBootstrapper(jsm, props, subjects);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    private static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
