package com.factory.edge.connector;

/**
 * Connector lifecycle as an explicit value. Handles live only in the states
 * that own them, so a disconnected connector cannot hold a stale session.
 *
 * <pre>
 *   Disconnected ──▶ Connecting ──▶ SessionEstablished ──▶ Subscribed
 *        ▲               │                  │                  │
 *        └───────────────┴──────────────────┴──────────────────┘
 *                        any transport error / disconnect()
 * </pre>
 */
public sealed interface ConnectorState {

    String name();

    /** True when {@code next} is a legal successor of this state. */
    boolean canMoveTo(ConnectorState next);

    record Disconnected(String reason) implements ConnectorState {

        @Override
        public String name() {
            return "DISCONNECTED";
        }

        @Override
        public boolean canMoveTo(ConnectorState next) {
            return next instanceof Connecting;
        }
    }

    record Connecting(int attempt) implements ConnectorState {

        @Override
        public String name() {
            return "CONNECTING";
        }

        @Override
        public boolean canMoveTo(ConnectorState next) {
            return next instanceof SessionEstablished || next instanceof Disconnected;
        }
    }

    record SessionEstablished(AutomationTransport transport, AutomationSession session) implements ConnectorState {

        @Override
        public String name() {
            return "SESSION_ESTABLISHED";
        }

        @Override
        public boolean canMoveTo(ConnectorState next) {
            return next instanceof Subscribed || next instanceof Disconnected;
        }
    }

    record Subscribed(AutomationTransport transport, AutomationSession session,
            AutomationSubscription subscription) implements ConnectorState {

        @Override
        public String name() {
            return "SUBSCRIBED";
        }

        @Override
        public boolean canMoveTo(ConnectorState next) {
            return next instanceof Disconnected;
        }
    }
}
