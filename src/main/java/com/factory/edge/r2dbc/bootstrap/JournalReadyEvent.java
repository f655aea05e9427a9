package com.factory.edge.r2dbc.bootstrap;

/**
 * =====================================================================
 * JournalReadyEvent
 * =====================================================================
 *
 * Published once by {@link JournalBootstrapper} after the schema exists and
 * (optionally) the chain has been verified.
 *
 *   ┌──────────────────────┐
 *   │  Journal Bootstrap   │
 *   └─────────┬────────────┘
 *             │ publishes
 *             ▼
 *   ┌──────────────────────┐
 *   │ Connector subscribes │
 *   │ Sync worker starts   │
 *   └──────────────────────┘
 *
 * Components that append to or drain the journal MUST wait for this event and
 * MUST NOT start during {@code @PostConstruct}.
 *
 * @param eventCount events present at startup
 * @param verified   whether the chain was walked and found valid
 */
public record JournalReadyEvent(long eventCount, boolean verified) {
}
