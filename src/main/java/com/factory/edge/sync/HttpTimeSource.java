package com.factory.edge.sync;

import java.time.Instant;

import org.springframework.web.reactive.function.client.WebClient;

import com.factory.edge.config.SyncWorkerProperties;
import com.factory.edge.core.ingest.IngestException;

import reactor.core.publisher.Mono;

/**
 * Reads the remote server's clock from the HTTP {@code Date} header of a GET
 * on the time path. Second precision is enough against a threshold measured in
 * tens of seconds.
 */
public class HttpTimeSource implements TrustedTimeSource {

    private final WebClient webClient;
    private final SyncWorkerProperties props;

    public HttpTimeSource(WebClient webClient, SyncWorkerProperties props) {
        this.webClient = webClient;
        this.props = props;
    }

    @Override
    public Mono<Instant> serverTime() {
        return webClient.get()
                .uri(props.getTimePath())
                .exchangeToMono(response -> {
                    long date = response.headers().asHttpHeaders().getDate();
                    Mono<Instant> time = date < 0
                            ? Mono.error(new IngestException("Time endpoint sent no Date header"))
                            : Mono.just(Instant.ofEpochMilli(date));
                    return response.releaseBody().then(time);
                });
    }
}
