package com.factory.edge.connector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.factory.edge.config.JacksonConfig;

class TagMappingTableTest {

    private final ObjectMapper mapper = new JacksonConfig().objectMapper();

    @Test
    void loadsMappingsFromJson() {
        TagMappingTable table = TagMappingTable.load(new ClassPathResource("tag-map-test.json"), mapper);

        assertThat(table.size()).isEqualTo(2);
        TagMapping temp = table.find("ns=2;s=Line1.Press1.Temperature").orElseThrow();
        assertThat(temp.scaleFactor()).isEqualTo(0.1);
        assertThat(temp.samplingInterval()).isEqualTo(Duration.ofMillis(250));
        assertThat(table.find("ns=2;s=Line1.Press1.State").orElseThrow().samplingInterval())
                .isEqualTo(Duration.ofSeconds(2));
        assertThat(table.find("ns=2;s=Other")).isEmpty();
    }

    @Test
    void reportsEveryProblemAtOnce() {
        List<TagMapping> mappings = List.of(
                new TagMapping("n1", "a", "m", null, null, null, null),
                new TagMapping("n1", "a", "m2", null, null, null, null),
                new TagMapping("n2", " ", "m", 0.0, null, null, null),
                new TagMapping("n3", "a", null, Double.NaN, null, null, null));

        assertThatThrownBy(() -> TagMappingTable.of(mappings))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate nodeId n1")
                .hasMessageContaining("mapping[2]: assetId is required")
                .hasMessageContaining("mapping[2]: scaleFactor")
                .hasMessageContaining("mapping[3]: metricName is required")
                .hasMessageContaining("mapping[3]: scaleFactor");
    }

    @Test
    void rejectsMalformedDurations() {
        ByteArrayResource json = new ByteArrayResource(
                "[{\"nodeId\":\"n\",\"assetId\":\"a\",\"metricName\":\"m\",\"samplingInterval\":\"soon\"}]".getBytes());

        assertThatThrownBy(() -> TagMappingTable.load(json, mapper))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not valid");
    }

    @Test
    void missingFileIsAnError() {
        assertThatThrownBy(() -> TagMappingTable.load(new ClassPathResource("nope.json"), mapper))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Tag map not found");
    }

    @Test
    void scaleOnlyTouchesNumbers() {
        TagMapping scaled = new TagMapping("n", "a", "m", 2.0, null, null, null);
        TagMapping plain = new TagMapping("n", "a", "m", 1.0, null, null, null);

        assertThat(scaled.scale(21)).isEqualTo(42.0);
        assertThat(scaled.scale("RUNNING")).isEqualTo("RUNNING");
        assertThat(plain.scaled()).isFalse();
        assertThat(plain.scale(21)).isEqualTo(21);
    }
}
