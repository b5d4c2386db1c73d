package io.fabricla.collector.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A record shaped for exactly one stream: every schema column present in schema order, unknown values null.
 * Serializes as a flat JSON object of its values.
 */
public final class NormalizedRecord {
    private final String stream;
    private final Map<String, Object> values;

    NormalizedRecord(String stream, Map<String, Object> values) {
        this.stream = stream;
        this.values = Collections.unmodifiableMap(values);
    }

    public String stream() { return stream; }

    @JsonValue
    public Map<String, Object> values() { return values; }

    public Object get(String column) { return values.get(column); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedRecord that)) return false;
        return stream.equals(that.stream) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stream, values);
    }

    @Override
    public String toString() {
        return "NormalizedRecord{" + stream + ", " + values + '}';
    }

    /** Fills columns by name; {@link #build()} nulls whatever was not set. */
    public static final class Builder {
        private final StreamSchema schema;
        private final Map<String, Object> values = new LinkedHashMap<>();

        Builder(StreamSchema schema) { this.schema = schema; }

        public Builder set(String column, Object value) {
            Column c = schema.column(column)
                    .orElseThrow(() -> new IllegalArgumentException("no column " + column + " in " + schema.stream()));
            if (!c.type().accepts(value)) {
                throw new IllegalArgumentException("column " + column + " expects " + c.type() + ", got " + value.getClass().getSimpleName());
            }
            values.put(column, value);
            return this;
        }

        public NormalizedRecord build() {
            Map<String, Object> ordered = new LinkedHashMap<>();
            for (Column c : schema.columns()) ordered.put(c.name(), values.get(c.name()));
            return new NormalizedRecord(schema.stream(), ordered);
        }
    }
}
