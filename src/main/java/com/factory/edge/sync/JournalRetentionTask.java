package com.factory.edge.sync;

import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;
import org.springframework.context.event.EventListener;

import com.factory.edge.config.JournalProperties;
import com.factory.edge.r2dbc.bootstrap.JournalReadyEvent;
import com.factory.edge.r2dbc.service.JournalService;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Periodically prunes synced events older than {@code edge.journal.retention}.
 */
@Component
public class JournalRetentionTask implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(JournalRetentionTask.class);

    private final JournalService journal;
    private final JournalProperties props;
    private final AtomicReference<Disposable> loop = new AtomicReference<>();

    public JournalRetentionTask(JournalService journal, JournalProperties props) {
        this.journal = journal;
        this.props = props;
    }

    @EventListener(JournalReadyEvent.class)
    public void onJournalReady() {
        Disposable d = Flux.interval(props.getPruneInterval(), props.getPruneInterval())
                .onBackpressureDrop()
                .concatMap(tick -> journal.pruneOldEvents(props.getRetention()).onErrorResume(e -> {
                    log.warn("Journal prune failed: {}", e.getMessage());
                    return Mono.empty();
                }))
                .subscribe();
        Disposable previous = loop.getAndSet(d);
        if (previous != null) {
            previous.dispose();
        }
    }

    @Override
    public void destroy() {
        Disposable d = loop.getAndSet(null);
        if (d != null) {
            d.dispose();
        }
    }
}
