package com.factory.edge.r2dbc.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.factory.edge.config.JournalProperties;
import com.factory.edge.core.model.EventCounts;
import com.factory.edge.core.model.IntegrityReport;
import com.factory.edge.r2dbc.service.JournalIntegrityException;
import com.factory.edge.r2dbc.service.JournalService;

/**
 * =====================================================================
 * JournalBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Prepares the journal before anything reads from or writes to it.
 *
 * FLOW
 * ----
 * 1. Create schema and singleton status row (idempotent)
 * 2. Walk the hash chain when {@code edge.journal.verify-on-startup=true}
 * 3. Publish {@link JournalReadyEvent}
 *
 * FAILURE MODEL
 * -------------
 * - Storage errors → startup fails
 * - Chain violations:
 *     → fail OR warn depending on {@code edge.journal.fail-on-violation}
 *
 * The journal is never repaired here.
 */
@Component
@Order(100)
public class JournalBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(JournalBootstrapper.class);

    private final JournalService journal;
    private final JournalProperties props;
    private final ApplicationEventPublisher publisher;

    public JournalBootstrapper(JournalService journal, JournalProperties props, ApplicationEventPublisher publisher) {
        this.journal = journal;
        this.props = props;
        this.publisher = publisher;
    }

    @Override
    public void run(ApplicationArguments args) {
        journal.initialize().block();

        boolean verified = false;
        if (props.isVerifyOnStartup()) {
            IntegrityReport report = journal.verifyIntegrity().block();
            if (report != null && !report.valid()) {
                if (props.isFailOnViolation()) {
                    throw new JournalIntegrityException(report);
                }
                log.warn("Journal chain has {} violation(s) on events {}; continuing (fail-on-violation=false)",
                        report.violations().size(), report.invalidIds());
            } else {
                verified = true;
            }
        }

        EventCounts counts = journal.getEventCount().block();
        long total = counts == null ? 0 : counts.total();

        if (counts != null) {
            log.info("Journal ready: total={}, synced={}, pending={}, deadLettered={}", counts.total(),
                    counts.synced(), counts.pending(), counts.deadLettered());
        }

        publisher.publishEvent(new JournalReadyEvent(total, verified));
    }
}
