package com.factory.edge.core.chain;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.factory.edge.core.model.EventRecord;

/**
 * =====================================================================
 * ChainSigner
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Computes the tamper-evidence signature of a journal event:
 *
 *   HMAC-SHA256(key, canonical-json{assetId, data, eventId,
 *                                   previousSignature, timestamp, type})
 *
 * rendered as lowercase hex.
 *
 * CANONICAL FORM
 * --------------
 * - keys sorted at every depth (including inside {@code data})
 * - timestamp rendered as ISO-8601 UTC at millisecond precision
 * - {@code lineId} is NOT part of the signed tuple
 *
 * The same canonical mapper renders the stored payload, so a payload read
 * back from storage re-serializes to the bytes that were signed.
 *
 * {@link Mac} is not thread-safe; a new instance is created per call.
 */
public final class ChainSigner {

	/** previousSignature of the first event ever appended. */
	public static final String GENESIS = "0".repeat(64);

	private static final String ALGORITHM = "HmacSHA256";
	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
	};

	private final SecretKeySpec key;
	private final ObjectMapper canonical;

	public ChainSigner(String signingKey) {
		if (signingKey == null || signingKey.isEmpty()) {
			throw new IllegalArgumentException("signing key is required");
		}
		this.key = new SecretKeySpec(signingKey.getBytes(StandardCharsets.UTF_8), ALGORITHM);
		this.canonical = JsonMapper.builder().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
				.enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY).build();
	}

	public String sign(EventRecord record, String previousSignature) {
		return hmac(signedDocument(record, previousSignature));
	}

	/**
	 * Constant-time comparison of a stored signature against the recomputed one.
	 */
	public boolean verify(EventRecord record, String previousSignature, String storedSignature) {
		if (storedSignature == null) {
			return false;
		}
		byte[] expected = sign(record, previousSignature).getBytes(StandardCharsets.US_ASCII);
		return MessageDigest.isEqual(expected, storedSignature.getBytes(StandardCharsets.US_ASCII));
	}

	/** Canonical JSON of an event payload, as persisted. */
	public String canonicalPayload(Map<String, Object> data) {
		return write(data == null ? Map.of() : data);
	}

	public Map<String, Object> parsePayload(String payload) {
		if (payload == null || payload.isBlank()) {
			return Map.of();
		}
		try {
			return canonical.readValue(payload, MAP_TYPE);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Stored payload is not a JSON object", e);
		}
	}

	String signedDocument(EventRecord record, String previousSignature) {
		Map<String, Object> doc = new TreeMap<>();
		doc.put("assetId", record.assetId());
		doc.put("data", record.data());
		doc.put("eventId", record.eventId());
		doc.put("previousSignature", previousSignature);
		doc.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(record.timestamp()));
		doc.put("type", record.type());
		return write(doc);
	}

	private String write(Object value) {
		try {
			return canonical.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Event payload is not serializable to JSON", e);
		}
	}

	private String hmac(String document) {
		try {
			Mac mac = Mac.getInstance(ALGORITHM);
			mac.init(key);
			return HexFormat.of().formatHex(mac.doFinal(document.getBytes(StandardCharsets.UTF_8)));
		} catch (GeneralSecurityException e) {
			throw new IllegalStateException("HmacSHA256 unavailable", e);
		}
	}
}
