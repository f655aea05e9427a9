package com.factory.edge.core.model;

/**
 * Result of recording a failed delivery attempt.
 *
 * @param localId      the event
 * @param recorded     false when the id is unknown or already synced (no-op)
 * @param retryCount   retry counter after the update
 * @param deadLettered true when the event is now excluded from sync candidates
 */
public record FailureOutcome(long localId, boolean recorded, int retryCount, boolean deadLettered) {

    public static FailureOutcome ignored(long localId) {
        return new FailureOutcome(localId, false, 0, false);
    }
}
