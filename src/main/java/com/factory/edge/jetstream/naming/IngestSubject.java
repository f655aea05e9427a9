package com.factory.edge.jetstream.naming;

import java.util.regex.Pattern;

/**
 * =====================================================================
 * IngestSubject
 * =====================================================================
 *
 * Builds the NATS subject a journal event is published to:
 *
 *   <prefix>.<siteId>.<nodeId>.<assetId>
 *   e.g. telemetry.ingest.site-01.edge-01.press-1
 *
 * The stream captures {@code <prefix>.>}. Site and node ids are validated
 * strictly (they come from configuration); asset ids come from the tag map
 * and are sanitized instead, because NATS reserves '.', '*', '>' and
 * whitespace.
 */
public final class IngestSubject {

	private static final Pattern TOKEN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,63}$");
	private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_-]");

	private final String prefix;
	private final String siteId;
	private final String nodeId;

	public IngestSubject(String prefix, String siteId, String nodeId) {
		this.prefix = requirePrefix(prefix);
		this.siteId = requireToken(siteId, "siteId");
		this.nodeId = requireToken(nodeId, "nodeId");
	}

	public String forAsset(String assetId) {
		return prefix + "." + siteId + "." + nodeId + "." + sanitize(assetId);
	}

	/** Wildcard the ingest stream must capture. */
	public String streamSubject() {
		return prefix + ".>";
	}

	static String sanitize(String assetId) {
		if (assetId == null || assetId.isBlank()) {
			return "unknown";
		}
		String s = UNSAFE.matcher(assetId.trim()).replaceAll("_");
		return s.length() <= 64 ? s : s.substring(0, 64);
	}

	private static String requirePrefix(String prefix) {
		if (prefix == null || prefix.isBlank()) {
			throw new IllegalArgumentException("subjectPrefix is required");
		}
		for (String token : prefix.split("\\.", -1)) {
			requireToken(token, "subjectPrefix token");
		}
		return prefix;
	}

	private static String requireToken(String value, String name) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(name + " is required");
		}
		if (!TOKEN.matcher(value).matches()) {
			throw new IllegalArgumentException(name + " must match " + TOKEN.pattern() + " but was: " + value);
		}
		return value;
	}

	@Override
	public String toString() {
		return streamSubject();
	}
}
