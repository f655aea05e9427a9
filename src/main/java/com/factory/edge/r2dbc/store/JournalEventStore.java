package com.factory.edge.r2dbc.store;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.factory.edge.core.chain.ChainSigner;
import com.factory.edge.core.model.ClockSample;
import com.factory.edge.core.model.EventCounts;
import com.factory.edge.core.model.EventRecord;
import com.factory.edge.core.model.JournalEvent;
import com.factory.edge.core.model.SyncState;
import com.factory.edge.core.model.SyncStatus;
import com.factory.edge.r2dbc.entity.JournalEventEntity;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Database access helper for the journal tables ({@code journal_event},
 * {@code sync_status}, {@code clock_sample}).
 *
 * Statements are single-purpose; ordering, transactions and the write lane
 * are the caller's concern. Times are stored as epoch milliseconds so that a
 * row read back compares equal to the record that was signed.
 */
@Repository
public class JournalEventStore {

	private static final String EVENT_COLUMNS = "local_id, event_id, event_time, asset_id, line_id, event_type, "
			+ "payload, signature, previous_signature, synced, synced_at, retry_count, last_error";

	private static final List<String> SCHEMA = List.of(
			"CREATE TABLE IF NOT EXISTS journal_event ("
					+ "local_id BIGINT PRIMARY KEY, "
					+ "event_id VARCHAR(128) NOT NULL UNIQUE, "
					+ "event_time BIGINT NOT NULL, "
					+ "asset_id VARCHAR(255) NOT NULL, "
					+ "line_id VARCHAR(255), "
					+ "event_type VARCHAR(64) NOT NULL, "
					+ "payload VARCHAR(1000000) NOT NULL, "
					+ "signature VARCHAR(64) NOT NULL, "
					+ "previous_signature VARCHAR(64) NOT NULL, "
					+ "synced BOOLEAN DEFAULT FALSE NOT NULL, "
					+ "synced_at BIGINT, "
					+ "retry_count INT DEFAULT 0 NOT NULL, "
					+ "last_error VARCHAR(2000), "
					+ "created_at BIGINT NOT NULL)",
			"CREATE INDEX IF NOT EXISTS idx_journal_event_pending ON journal_event (synced, retry_count, local_id)",
			"CREATE INDEX IF NOT EXISTS idx_journal_event_time ON journal_event (event_time)",
			"CREATE TABLE IF NOT EXISTS sync_status ("
					+ "id INT PRIMARY KEY, "
					+ "last_synced_local_id BIGINT DEFAULT 0 NOT NULL, "
					+ "last_sync_at BIGINT, "
					+ "total_synced BIGINT DEFAULT 0 NOT NULL, "
					+ "total_failed BIGINT DEFAULT 0 NOT NULL, "
					+ "updated_at BIGINT NOT NULL)",
			"CREATE TABLE IF NOT EXISTS clock_sample ("
					+ "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
					+ "local_time BIGINT NOT NULL, "
					+ "server_time BIGINT NOT NULL, "
					+ "offset_ms BIGINT NOT NULL, "
					+ "recorded_at BIGINT NOT NULL)");

	private final DatabaseClient db;
	private final ChainSigner signer;

	public JournalEventStore(DatabaseClient db, ChainSigner signer) {
		this.db = db;
		this.signer = signer;
	}

	// ---------------------------------------------------------------------
	// Schema
	// ---------------------------------------------------------------------

	public Mono<Void> createSchema(Instant now) {
		return Flux.fromIterable(SCHEMA).concatMap(ddl -> db.sql(ddl).then()).then(ensureStatusRow(now));
	}

	private Mono<Void> ensureStatusRow(Instant now) {
		return db.sql("SELECT COUNT(*) AS n FROM sync_status WHERE id = 1")
				.map((row, meta) -> number(row, "n"))
				.one()
				.flatMap(n -> n > 0 ? Mono.<Void>empty()
						: db.sql("INSERT INTO sync_status (id, last_synced_local_id, total_synced, total_failed, updated_at) "
								+ "VALUES (1, 0, 0, 0, :updated_at)").bind("updated_at", now.toEpochMilli()).then());
	}

	// ---------------------------------------------------------------------
	// Events
	// ---------------------------------------------------------------------

	public Mono<ChainTail> findTail() {
		return db.sql("SELECT local_id, signature FROM journal_event ORDER BY local_id DESC LIMIT 1")
				.map((row, meta) -> new ChainTail(row.get("local_id", Long.class), row.get("signature", String.class)))
				.one();
	}

	public Mono<Void> insert(JournalEvent event, Instant createdAt) {
		EventRecord r = event.record();
		String sql = "INSERT INTO journal_event (local_id, event_id, event_time, asset_id, line_id, event_type, payload, "
				+ "signature, previous_signature, synced, retry_count, created_at) "
				+ "VALUES (:local_id, :event_id, :event_time, :asset_id, :line_id, :event_type, :payload, "
				+ ":signature, :previous_signature, FALSE, 0, :created_at)";

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("local_id", event.localId())
				.bind("event_id", r.eventId()).bind("event_time", r.timestamp().toEpochMilli())
				.bind("asset_id", r.assetId()).bind("event_type", r.type())
				.bind("payload", signer.canonicalPayload(r.data())).bind("signature", event.signature())
				.bind("previous_signature", event.previousSignature()).bind("created_at", createdAt.toEpochMilli());

		if (r.lineId() == null) {
			spec = spec.bindNull("line_id", String.class);
		} else {
			spec = spec.bind("line_id", r.lineId());
		}

		return spec.fetch().rowsUpdated().then();
	}

	public Flux<JournalEvent> findUnsynced(int maxRetries, int limit) {
		String sql = "SELECT " + EVENT_COLUMNS + " FROM journal_event "
				+ "WHERE synced = FALSE AND retry_count < :max_retries ORDER BY local_id ASC LIMIT :limit";
		return db.sql(sql).bind("max_retries", maxRetries).bind("limit", limit).map((row, meta) -> toModel(row))
				.all();
	}

	public Flux<JournalEvent> findDeadLetters(int maxRetries, int limit) {
		String sql = "SELECT " + EVENT_COLUMNS + " FROM journal_event "
				+ "WHERE synced = FALSE AND retry_count >= :max_retries ORDER BY local_id ASC LIMIT :limit";
		return db.sql(sql).bind("max_retries", maxRetries).bind("limit", limit).map((row, meta) -> toModel(row))
				.all();
	}

	/** Every row in chain order. */
	public Flux<JournalEvent> findAllOrdered() {
		return db.sql("SELECT " + EVENT_COLUMNS + " FROM journal_event ORDER BY local_id ASC")
				.map((row, meta) -> toModel(row)).all();
	}

	public Mono<JournalEvent> findById(long localId) {
		return db.sql("SELECT " + EVENT_COLUMNS + " FROM journal_event WHERE local_id = :local_id")
				.bind("local_id", localId).map((row, meta) -> toModel(row)).one();
	}

	/**
	 * How many of the given ids are still unsynced, and the highest of them.
	 */
	public Mono<PendingSlice> findPendingSlice(Collection<Long> ids) {
		String sql = "SELECT COALESCE(MAX(local_id), 0) AS max_id, COUNT(*) AS n FROM journal_event "
				+ "WHERE local_id IN (:ids) AND synced = FALSE";
		return db.sql(sql).bind("ids", ids)
				.map((row, meta) -> new PendingSlice(number(row, "max_id"), number(row, "n"))).one();
	}

	public record PendingSlice(long maxLocalId, long count) {
	}

	public Mono<Long> updateSynced(Collection<Long> ids, Instant syncedAt) {
		String sql = "UPDATE journal_event SET synced = TRUE, synced_at = :synced_at "
				+ "WHERE local_id IN (:ids) AND synced = FALSE";
		return db.sql(sql).bind("synced_at", syncedAt.toEpochMilli()).bind("ids", ids).fetch().rowsUpdated();
	}

	/**
	 * Bumps the retry counter, never past {@code maxRetries}. No-op for synced or
	 * unknown ids.
	 */
	public Mono<Long> incrementRetry(long localId, int maxRetries, String lastError) {
		String sql = "UPDATE journal_event SET "
				+ "retry_count = CASE WHEN retry_count < :max_retries THEN retry_count + 1 ELSE retry_count END, "
				+ "last_error = :last_error WHERE local_id = :local_id AND synced = FALSE";

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("max_retries", maxRetries).bind("local_id", localId);
		if (lastError == null) {
			spec = spec.bindNull("last_error", String.class);
		} else {
			spec = spec.bind("last_error", lastError);
		}
		return spec.fetch().rowsUpdated();
	}

	public Mono<SyncState> findSyncState(long localId) {
		return db.sql("SELECT synced, synced_at, retry_count, last_error FROM journal_event WHERE local_id = :local_id")
				.bind("local_id", localId).map((row, meta) -> syncState(row)).one();
	}

	public Mono<Long> resetRetry(long localId, int maxRetries) {
		String sql = "UPDATE journal_event SET retry_count = 0, last_error = NULL "
				+ "WHERE local_id = :local_id AND synced = FALSE AND retry_count >= :max_retries";
		return db.sql(sql).bind("local_id", localId).bind("max_retries", maxRetries).fetch().rowsUpdated();
	}

	/**
	 * Deletes the oldest run of events that are all synced and older than
	 * {@code cutoff}. Only a prefix of the chain is removed: the first event
	 * that is pending, dead-lettered, recent or the chain tail stops the run,
	 * so every surviving row still links to its stored predecessor.
	 */
	public Mono<Long> deleteSyncedPrefixBefore(Instant cutoff) {
		String sql = "DELETE FROM journal_event WHERE local_id < ("
				+ "SELECT MIN(local_id) FROM journal_event WHERE synced = FALSE OR event_time >= :cutoff "
				+ "OR local_id = (SELECT MAX(local_id) FROM journal_event))";
		return db.sql(sql).bind("cutoff", cutoff.toEpochMilli()).fetch().rowsUpdated();
	}

	public Mono<EventCounts> countEvents(int maxRetries) {
		String sql = "SELECT COUNT(*) AS total, "
				+ "SUM(CASE WHEN synced = TRUE THEN 1 ELSE 0 END) AS synced_count, "
				+ "SUM(CASE WHEN synced = FALSE THEN 1 ELSE 0 END) AS pending_count, "
				+ "SUM(CASE WHEN synced = FALSE AND retry_count >= :max_retries THEN 1 ELSE 0 END) AS dead_count "
				+ "FROM journal_event";
		return db.sql(sql).bind("max_retries", maxRetries)
				.map((row, meta) -> new EventCounts(number(row, "total"), number(row, "synced_count"),
						number(row, "pending_count"), number(row, "dead_count")))
				.one();
	}

	// ---------------------------------------------------------------------
	// Sync status
	// ---------------------------------------------------------------------

	public Mono<Void> recordSynced(long maxLocalId, long count, Instant at) {
		String sql = "UPDATE sync_status SET last_synced_local_id = GREATEST(last_synced_local_id, :max_id), "
				+ "last_sync_at = :at, total_synced = total_synced + :count, updated_at = :at WHERE id = 1";
		return db.sql(sql).bind("max_id", maxLocalId).bind("count", count).bind("at", at.toEpochMilli()).then();
	}

	public Mono<Void> recordFailed(Instant at) {
		return db.sql("UPDATE sync_status SET total_failed = total_failed + 1, updated_at = :at WHERE id = 1")
				.bind("at", at.toEpochMilli()).then();
	}

	public Mono<SyncStatus> findSyncStatus() {
		String sql = "SELECT last_synced_local_id, last_sync_at, total_synced, total_failed, updated_at "
				+ "FROM sync_status WHERE id = 1";
		return db.sql(sql).map((row, meta) -> new SyncStatus(number(row, "last_synced_local_id"),
				instant(row.get("last_sync_at", Long.class)), number(row, "total_synced"),
				number(row, "total_failed"), instant(row.get("updated_at", Long.class)))).one();
	}

	// ---------------------------------------------------------------------
	// Clock samples
	// ---------------------------------------------------------------------

	public Mono<Void> insertClockSample(ClockSample sample, Instant recordedAt) {
		String sql = "INSERT INTO clock_sample (local_time, server_time, offset_ms, recorded_at) "
				+ "VALUES (:local_time, :server_time, :offset_ms, :recorded_at)";
		return db.sql(sql).bind("local_time", sample.localTime().toEpochMilli())
				.bind("server_time", sample.serverTime().toEpochMilli()).bind("offset_ms", sample.offsetMs())
				.bind("recorded_at", recordedAt.toEpochMilli()).then();
	}

	public Mono<Long> findLatestOffset() {
		return db.sql("SELECT offset_ms FROM clock_sample ORDER BY id DESC LIMIT 1")
				.map((row, meta) -> row.get("offset_ms", Long.class)).one();
	}

	/**
	 * Newest first. {@code driftExceeded} is evaluated against the given threshold.
	 */
	public Flux<ClockSample> findClockSamples(int limit, long thresholdMs) {
		return db.sql("SELECT local_time, server_time, offset_ms FROM clock_sample ORDER BY id DESC LIMIT :limit")
				.bind("limit", limit).map((row, meta) -> {
					long offset = number(row, "offset_ms");
					return new ClockSample(instant(row.get("local_time", Long.class)),
							instant(row.get("server_time", Long.class)), offset, Math.abs(offset) > thresholdMs);
				}).all();
	}

	// ---------------------------------------------------------------------
	// Mapping
	// ---------------------------------------------------------------------

	private JournalEvent toModel(Row row) {
		JournalEventEntity e = new JournalEventEntity();
		e.setLocalId(row.get("local_id", Long.class));
		e.setEventId(row.get("event_id", String.class));
		e.setEventTime(row.get("event_time", Long.class));
		e.setAssetId(row.get("asset_id", String.class));
		e.setLineId(row.get("line_id", String.class));
		e.setEventType(row.get("event_type", String.class));
		e.setPayloadText(row.get("payload", String.class));
		e.setSignature(row.get("signature", String.class));
		e.setPreviousSignature(row.get("previous_signature", String.class));
		e.setSynced(row.get("synced", Boolean.class));
		e.setSyncedAt(row.get("synced_at", Long.class));
		e.setRetryCount(row.get("retry_count", Integer.class));
		e.setLastError(row.get("last_error", String.class));
		return toModel(e);
	}

	private JournalEvent toModel(JournalEventEntity e) {
		Map<String, Object> data;
		try {
			data = signer.parsePayload(e.getPayloadText());
		} catch (IllegalArgumentException ex) {
			// surfaces as a signature mismatch on verification
			data = Map.of("payload_parse_error", String.valueOf(ex.getMessage()));
		}

		EventRecord record = new EventRecord(e.getEventId(), Instant.ofEpochMilli(e.getEventTime()), e.getAssetId(),
				e.getLineId(), e.getEventType(), data);

		SyncState sync = new SyncState(Boolean.TRUE.equals(e.getSynced()), instant(e.getSyncedAt()),
				e.getRetryCount() == null ? 0 : e.getRetryCount(), e.getLastError());

		return new JournalEvent(e.getLocalId(), record, e.getSignature(), e.getPreviousSignature(), sync);
	}

	private static SyncState syncState(Row row) {
		Integer retries = row.get("retry_count", Integer.class);
		return new SyncState(Boolean.TRUE.equals(row.get("synced", Boolean.class)),
				instant(row.get("synced_at", Long.class)), retries == null ? 0 : retries,
				row.get("last_error", String.class));
	}

	private static Instant instant(Long epochMillis) {
		return epochMillis == null ? null : Instant.ofEpochMilli(epochMillis);
	}

	/** Aggregates come back as BIGINT or DECIMAL depending on the input type; null means no rows. */
	private static long number(Row row, String column) {
		Object v = row.get(column);
		if (v == null)
			return 0L;
		if (v instanceof Number n)
			return n.longValue();
		return Long.parseLong(String.valueOf(v));
	}
}
