package com.factory.edge.connector;

import java.util.function.Consumer;

/**
 * A secure channel to the automation server.
 */
public interface AutomationTransport {

    /**
     * Creates and activates a session.
     *
     * @param onLost invoked (once) when the server or network drops the session
     */
    AutomationSession createSession(Consumer<Throwable> onLost) throws Exception;

    void close() throws Exception;
}
