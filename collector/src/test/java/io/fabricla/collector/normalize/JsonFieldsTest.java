package io.fabricla.collector.normalize;

import io.fabricla.core.Json;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class JsonFieldsTest {

    @Test
    void timestamps_with_offset_without_offset_and_long_fractions() {
        assertEquals(Optional.of(Instant.parse("2024-01-01T10:00:00Z")), JsonFields.parseInstant("2024-01-01T12:00:00+02:00"));
        assertEquals(Optional.of(Instant.parse("2024-01-01T12:00:00Z")), JsonFields.parseInstant("2024-01-01T12:00:00"));
        assertEquals(Optional.of(Instant.parse("2024-01-01T12:00:00.1234567Z")), JsonFields.parseInstant("2024-01-01T12:00:00.1234567Z"));
        assertEquals(Optional.empty(), JsonFields.parseInstant("not a date"));
    }

    @Test
    void first_non_null_name_wins() throws Exception {
        var node = Json.mapper().readTree("{\"a\":null,\"b\":\"x\",\"c\":\"y\"}");
        assertEquals("x", JsonFields.text(node, "a", "b", "c"));
        assertNull(JsonFields.text(node, "missing"));
        assertNull(JsonFields.text(null, "a"));
    }

    @Test
    void numbers_accept_strings() throws Exception {
        var node = Json.mapper().readTree("{\"n\":\"42\",\"d\":1.5,\"bad\":\"x\"}");
        assertEquals(42L, JsonFields.longValue(node, "n"));
        assertEquals(1.5, JsonFields.doubleValue(node, "d"));
        assertNull(JsonFields.longValue(node, "bad"));
        assertNull(JsonFields.durationMs(Instant.EPOCH.plusSeconds(1), Instant.EPOCH));
        assertEquals(1000L, JsonFields.durationMs(Instant.EPOCH, Instant.EPOCH.plusSeconds(1)));
    }
}
