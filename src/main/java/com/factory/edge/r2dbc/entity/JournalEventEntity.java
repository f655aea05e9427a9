package com.factory.edge.r2dbc.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Row shape of {@code journal_event}. Times are epoch milliseconds.
 */
@Table("journal_event")
public class JournalEventEntity {

    @Id
    @Column("local_id")
    private Long localId;

    @Column("event_id")
    private String eventId;

    @Column("event_time")
    private Long eventTime;

    @Column("asset_id")
    private String assetId;

    @Column("line_id")
    private String lineId;

    @Column("event_type")
    private String eventType;

    @Column("payload")
    private String payloadText;

    @Column("signature")
    private String signature;

    @Column("previous_signature")
    private String previousSignature;

    @Column("synced")
    private Boolean synced;

    @Column("synced_at")
    private Long syncedAt;

    @Column("retry_count")
    private Integer retryCount;

    @Column("last_error")
    private String lastError;

    public Long getLocalId() { return localId; }
    public void setLocalId(Long localId) { this.localId = localId; }

    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }

    public Long getEventTime() { return eventTime; }
    public void setEventTime(Long eventTime) { this.eventTime = eventTime; }

    public String getAssetId() { return assetId; }
    public void setAssetId(String assetId) { this.assetId = assetId; }

    public String getLineId() { return lineId; }
    public void setLineId(String lineId) { this.lineId = lineId; }

    public String getEventType() { return eventType; }
    public void setEventType(String eventType) { this.eventType = eventType; }

    public String getPayloadText() { return payloadText; }
    public void setPayloadText(String payloadText) { this.payloadText = payloadText; }

    public String getSignature() { return signature; }
    public void setSignature(String signature) { this.signature = signature; }

    public String getPreviousSignature() { return previousSignature; }
    public void setPreviousSignature(String previousSignature) { this.previousSignature = previousSignature; }

    public Boolean getSynced() { return synced; }
    public void setSynced(Boolean synced) { this.synced = synced; }

    public Long getSyncedAt() { return syncedAt; }
    public void setSyncedAt(Long syncedAt) { this.syncedAt = syncedAt; }

    public Integer getRetryCount() { return retryCount; }
    public void setRetryCount(Integer retryCount) { this.retryCount = retryCount; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }
}
