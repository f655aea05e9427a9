package com.factory.edge.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

class FlexibleDurationDeserializerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    record Holder(@JsonDeserialize(using = FlexibleDurationDeserializer.class) Duration interval) {
    }

    private Duration parse(String jsonValue) throws Exception {
        return mapper.readValue("{\"interval\":" + jsonValue + "}", Holder.class).interval();
    }

    @ParameterizedTest
    @CsvSource({
            "'\"250ms\"', 250",
            "'\"5s\"', 5000",
            "'\"2m\"', 120000",
            "'\"1h\"', 3600000",
            "'\"PT0.5S\"', 500",
            "'\"pt5s\"', 5000",
            "1000, 1000"
    })
    void acceptsShorthandIsoAndMillis(String json, long expectedMillis) throws Exception {
        assertThat(parse(json)).isEqualTo(Duration.ofMillis(expectedMillis));
    }

    @Test
    void blankMeansUnset() throws Exception {
        assertThat(parse("\"\"")).isNull();
        assertThat(parse("null")).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = { "\"soon\"", "\"0s\"", "\"-PT1S\"", "0" })
    void rejectsInvalidOrNonPositive(String json) {
        assertThatThrownBy(() -> parse(json)).isInstanceOf(JsonMappingException.class);
    }
}
