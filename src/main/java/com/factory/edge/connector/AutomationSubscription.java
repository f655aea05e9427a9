package com.factory.edge.connector;

public interface AutomationSubscription {

    boolean isActive();

    /** Deletes the subscription on the server. */
    void terminate() throws Exception;
}
