package com.factory.edge.connector;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.factory.edge.config.ConnectorProperties;
import com.factory.edge.connector.milo.MiloAutomationClient;
import com.factory.edge.r2dbc.service.JournalService;

/**
 * Wires the protocol connector. Disabled with
 * {@code edge.connector.enabled=false} (e.g. on nodes that only forward).
 */
@Configuration
@ConditionalOnProperty(prefix = "edge.connector", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConnectorConfig {

    private static final Logger log = LoggerFactory.getLogger(ConnectorConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public AutomationClient automationClient() {
        return new MiloAutomationClient();
    }

    @Bean
    public TagMappingTable tagMappingTable(ConnectorProperties props, ResourceLoader resources, ObjectMapper mapper) {
        TagMappingTable table = TagMappingTable.load(resources.getResource(props.getTagMap()), mapper);
        if (table.isEmpty()) {
            log.warn("Tag map {} has no mappings; connector will subscribe to nothing", props.getTagMap());
        } else {
            log.info("Loaded {} tag mapping(s) from {}", table.size(), props.getTagMap());
        }
        return table;
    }

    @Bean
    public EndpointConfig endpointConfig(ConnectorProperties props) {
        return new EndpointConfig(props.getEndpointUrl(), props.getApplicationName(), props.getApplicationUri(),
                props.getSecurityMode(), props.getSecurityPolicy(), props.getKeystorePath(),
                props.getKeystorePassword(), props.getKeyAlias(), props.getTrustListDir(),
                props.getRequestTimeout(), props.getPublishingInterval());
    }

    @Bean
    public ProtocolConnector protocolConnector(AutomationClient client, JournalService journal,
                                               TagMappingTable tags, EndpointConfig endpoint,
                                               ConnectorProperties props, Clock clock) {
        return new ProtocolConnector(client, journal, tags, endpoint, props, clock);
    }
}
