package io.fabricla.collector.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Lenient readers for source JSON. Each takes a list of candidate field names because the API families spell
 * the same thing differently ({@code startTimeUtc} vs {@code startTime}); the first non-null value wins.
 */
public final class JsonFields {
    private JsonFields() {}

    public static JsonNode first(JsonNode node, String... names) {
        if (node == null) return null;
        for (String n : names) {
            JsonNode v = node.get(n);
            if (v != null && !v.isNull() && !v.isMissingNode()) return v;
        }
        return null;
    }

    public static String text(JsonNode node, String... names) {
        JsonNode v = first(node, names);
        if (v == null) return null;
        if (v.isContainerNode()) return v.toString();
        String s = v.asText();
        return s.isEmpty() ? null : s;
    }

    /**
     * ISO-8601 timestamps with or without offset; values without one are read as UTC. Unparseable values
     * come back empty rather than failing.
     */
    public static Optional<Instant> instant(JsonNode node, String... names) {
        String s = text(node, names);
        if (s == null) return Optional.empty();
        return parseInstant(s);
    }

    public static Optional<Instant> parseInstant(String s) {
        try {
            TemporalAccessor t = DateTimeFormatter.ISO_DATE_TIME.parseBest(s.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (t instanceof OffsetDateTime odt) return Optional.of(odt.toInstant());
            return Optional.of(((LocalDateTime) t).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static Long longValue(JsonNode node, String... names) {
        JsonNode v = first(node, names);
        if (v == null) return null;
        if (v.isNumber()) return v.asLong();
        try {
            return Long.parseLong(v.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Double doubleValue(JsonNode node, String... names) {
        JsonNode v = first(node, names);
        if (v == null) return null;
        if (v.isNumber()) return v.asDouble();
        try {
            return Double.parseDouble(v.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Boolean bool(JsonNode node, String... names) {
        JsonNode v = first(node, names);
        if (v == null) return null;
        if (v.isBoolean()) return v.asBoolean();
        String s = v.asText().trim();
        if (s.equalsIgnoreCase("true")) return Boolean.TRUE;
        if (s.equalsIgnoreCase("false")) return Boolean.FALSE;
        return null;
    }

    /** Milliseconds between two instants, or null unless both are known and ordered. */
    public static Long durationMs(Instant start, Instant end) {
        if (start == null || end == null || end.isBefore(start)) return null;
        return Duration.between(start, end).toMillis();
    }
}
