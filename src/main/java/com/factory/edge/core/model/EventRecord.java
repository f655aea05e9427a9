package com.factory.edge.core.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * =====================================================================
 * EventRecord
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The **immutable, signed** half of a journal event. Every field here
 * (except {@link #lineId}) flows into the hash-chain signature; none of them
 * may change after the event has been appended.
 *
 * The operational half (synced flag, retry counter, last error) lives in
 * {@link SyncState}, so a sync-state update can never reach a signed field.
 *
 * PRECISION
 * ---------
 * {@link #timestamp} is truncated to milliseconds on construction. The
 * journal persists epoch milliseconds, so a record read back from storage is
 * equal to the record that was signed.
 *
 * DEDUPLICATION
 * -------------
 * {@link #eventId} is supplied by the producer and is the idempotency key the
 * remote ingestion endpoint deduplicates on.
 */
public record EventRecord(

		/** Producer-supplied unique id; idempotency key downstream. */
		String eventId,

		/** Capture time as reported by the source (not necessarily wall clock). */
		Instant timestamp,

		/** Subject of the reading. */
		String assetId,

		/** Optional production line; not part of the signed tuple. */
		String lineId,

		/** Event kind, e.g. {@code telemetry} or {@code status-change}. */
		String type,

		/** Opaque key/value payload (point values, quality, unit, scale). */
		Map<String, Object> data) {

	public static final String TYPE_TELEMETRY = "telemetry";
	public static final String TYPE_STATUS_CHANGE = "status-change";

	public EventRecord {
		eventId = requireText(eventId, "eventId");
		assetId = requireText(assetId, "assetId");
		type = requireText(type, "type");
		Objects.requireNonNull(timestamp, "timestamp");
		timestamp = timestamp.truncatedTo(ChronoUnit.MILLIS);
		// LinkedHashMap rather than Map.copyOf: readings may carry null values (bad quality)
		data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
	}

	private static String requireText(String value, String name) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(name + " is required");
		}
		return value;
	}
}
