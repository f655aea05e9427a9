package com.factory.edge.sync;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.factory.edge.config.EdgeNodeProperties;
import com.factory.edge.config.SyncWorkerProperties;
import com.factory.edge.core.ingest.IngestionClient;

/**
 * HTTP side of the sync worker: the WebClient bound to the remote base URL,
 * the default ingestion client and the trusted time source.
 */
@Configuration
public class SyncConfig {

    @Bean
    public WebClient ingestionWebClient(WebClient.Builder builder, SyncWorkerProperties props) {
        return builder.baseUrl(props.getBaseUrl()).build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "edge.sync", name = "transport", havingValue = "http", matchIfMissing = true)
    public IngestionClient httpIngestionClient(WebClient ingestionWebClient, EdgeNodeProperties node,
                                               SyncWorkerProperties props) {
        return new HttpIngestionClient(ingestionWebClient, node, props);
    }

    @Bean
    public TrustedTimeSource httpTimeSource(WebClient ingestionWebClient, SyncWorkerProperties props) {
        return new HttpTimeSource(ingestionWebClient, props);
    }
}
