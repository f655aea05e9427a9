package com.factory.edge.core.model;

/**
 * Journal size snapshot.
 *
 * @param total        every event still in the journal
 * @param synced       events confirmed by the remote side
 * @param pending      events not yet synced (dead letters included)
 * @param deadLettered pending events that reached the retry cap
 */
public record EventCounts(long total, long synced, long pending, long deadLettered) {
}
