package com.factory.edge.sync;

/**
 * Outcome of one drain → deliver → mark cycle.
 *
 * @param drained      events read from the journal
 * @param accepted     events newly marked synced
 * @param rejected     events recorded as failed (including a total failure)
 * @param deadLettered rejected events that reached the retry cap in this cycle
 * @param error        batch-level failure, null when the request succeeded
 * @param skipped      another cycle was already running
 */
public record SyncCycleResult(int drained, int accepted, int rejected, int deadLettered, String error,
        boolean skipped) {

    public static SyncCycleResult idle() {
        return new SyncCycleResult(0, 0, 0, 0, null, false);
    }

    public static SyncCycleResult skippedCycle() {
        return new SyncCycleResult(0, 0, 0, 0, null, true);
    }

    public static SyncCycleResult failed(String error) {
        return new SyncCycleResult(0, 0, 0, 0, error, false);
    }

    public boolean isIdle() {
        return !skipped && drained == 0 && error == null;
    }
}
