package com.factory.edge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Identity of this edge node. Sent with every ingestion batch.
 */
@ConfigurationProperties(prefix = "edge")
public class EdgeNodeProperties {

    private String nodeId = "edge-01";
    private String siteId = "site-01";

    public String getNodeId() { return nodeId; }
    public void setNodeId(String nodeId) { this.nodeId = nodeId; }

    public String getSiteId() { return siteId; }
    public void setSiteId(String siteId) { this.siteId = siteId; }
}
