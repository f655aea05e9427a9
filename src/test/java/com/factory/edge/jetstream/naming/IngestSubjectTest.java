package com.factory.edge.jetstream.naming;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class IngestSubjectTest {

	private final IngestSubject subjects = new IngestSubject("telemetry.ingest", "site-01", "edge-01");

	@Test
	void buildsAssetSubjectUnderStreamWildcard() {
		assertThat(subjects.forAsset("press-1")).isEqualTo("telemetry.ingest.site-01.edge-01.press-1");
		assertThat(subjects.streamSubject()).isEqualTo("telemetry.ingest.>");
	}

	@Test
	void sanitizesReservedCharactersInAssetIds() {
		assertThat(IngestSubject.sanitize("line 1.press*2>")).isEqualTo("line_1_press_2_");
		assertThat(IngestSubject.sanitize("  ")).isEqualTo("unknown");
		assertThat(IngestSubject.sanitize("a".repeat(100))).hasSize(64);
	}

	@Test
	void rejectsInvalidConfiguredTokens() {
		assertThatThrownBy(() -> new IngestSubject("telemetry.ingest", "site.01", "edge-01"))
				.isInstanceOf(IllegalArgumentException.class).hasMessageContaining("siteId");
		assertThatThrownBy(() -> new IngestSubject("telemetry..ingest", "site-01", "edge-01"))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new IngestSubject("telemetry.ingest", "site-01", null))
				.isInstanceOf(IllegalArgumentException.class).hasMessageContaining("nodeId is required");
	}
}
