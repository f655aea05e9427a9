package com.factory.edge.connector;

/** One child reference returned by a browse. */
public record BrowseEntry(String nodeId, String browseName, String displayName, String nodeClass) {
}
