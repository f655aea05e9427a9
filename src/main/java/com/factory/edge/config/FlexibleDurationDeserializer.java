package com.factory.edge.config;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Jackson {@link JsonDeserializer} for {@link Duration} that accepts the forms
 * people type into tag-map files.
 *
 * <h2>Accepted examples</h2>
 * <pre>
 * "PT0.5S" -> 500 milliseconds
 * "pt5s"   -> 5 seconds
 * "250ms"  -> 250 milliseconds
 * "5s"     -> 5 seconds
 * "2m"     -> 2 minutes
 * "1h"     -> 1 hour
 * 1000     -> 1000 milliseconds
 * null     -> null (caller applies its default)
 * </pre>
 *
 * Anything else, including zero and negative values, is rejected.
 */
public final class FlexibleDurationDeserializer extends JsonDeserializer<Duration> {

    private static final Pattern SHORTHAND = Pattern.compile("^(\\d+)(ms|s|m|h)$", Pattern.CASE_INSENSITIVE);

    @Override
    public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);

        if (node == null || node.isNull()) {
            return null;
        }

        if (node.isNumber()) {
            return positive(Duration.ofMillis(node.asLong()), node.asText(), ctxt);
        }

        String s = node.asText("").trim();
        if (s.isEmpty()) {
            return null;
        }

        Matcher m = SHORTHAND.matcher(s);
        if (m.matches()) {
            long n = Long.parseLong(m.group(1));
            Duration d = switch (m.group(2).toLowerCase(Locale.ROOT)) {
                case "ms" -> Duration.ofMillis(n);
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                default -> Duration.ofHours(n);
            };
            return positive(d, s, ctxt);
        }

        try {
            return positive(Duration.parse(s.toUpperCase(Locale.ROOT)), s, ctxt);
        } catch (DateTimeParseException e) {
            return (Duration) ctxt.handleWeirdStringValue(Duration.class, s,
                    "expected ISO-8601 or <number>(ms|s|m|h)");
        }
    }

    private static Duration positive(Duration d, String raw, DeserializationContext ctxt) throws IOException {
        if (d.isNegative() || d.isZero()) {
            return (Duration) ctxt.handleWeirdStringValue(Duration.class, raw, "duration must be positive");
        }
        return d;
    }
}
