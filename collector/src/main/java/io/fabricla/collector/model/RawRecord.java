package io.fabricla.collector.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One record as returned by a Source API page, tagged with its family and the entity it was read for.
 * {@code parent} is set for sub-resource records (activity runs) and points at the parent run's body.
 */
public record RawRecord(SourceKind kind, EntityRef entity, JsonNode body, JsonNode parent) {
    public RawRecord {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(body, "body");
    }

    public RawRecord(SourceKind kind, EntityRef entity, JsonNode body) {
        this(kind, entity, body, null);
    }
}
