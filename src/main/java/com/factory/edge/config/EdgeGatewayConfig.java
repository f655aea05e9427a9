package com.factory.edge.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.factory.edge.core.chain.ChainSigner;
import com.factory.edge.jetstream.config.NatsProperties;

@Configuration
@EnableConfigurationProperties({
        EdgeNodeProperties.class,      // node identity
        JournalProperties.class,       // signing key, retry cap, retention
        SyncWorkerProperties.class,    // drain cadence and ingestion endpoint
        ConnectorProperties.class,     // OPC UA endpoint, security, reconnect
        NatsProperties.class           // optional JetStream ingestion path
})
public class EdgeGatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(EdgeGatewayConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChainSigner chainSigner(JournalProperties props) {
        if (JournalProperties.DEV_SIGNING_KEY.equals(props.getSigningKey())) {
            log.warn("edge.journal.signing-key is the development default; set a node-specific key in production");
        }
        return new ChainSigner(props.getSigningKey());
    }
}
