package com.factory.edge.connector;

import java.util.List;

/**
 * An activated session on the automation server. Point operations are
 * synchronous and bounded by the transport's request timeout.
 */
public interface AutomationSession {

    AutomationSubscription subscribe(List<TagMapping> mappings, DataChangeListener listener) throws Exception;

    /**
     * @throws NodeNotFoundException     unknown node
     * @throws OperationTimeoutException no answer within the request timeout
     * @throws SessionInvalidException   the session is gone
     */
    PointReading read(String nodeId);

    WriteOutcome write(String nodeId, Object value);

    List<BrowseEntry> browse(String nodeId);

    boolean isActive();

    void close() throws Exception;
}
