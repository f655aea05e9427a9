package com.factory.edge.core.ingest;

import java.util.List;

/** Request body of one batch submission. */
public record IngestBatch(String nodeId, String siteId, List<IngestEvent> events) {
}
