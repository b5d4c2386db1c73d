package io.fabricla.collector.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered set of typed columns bound to one ingestion stream. The table itself is provisioned elsewhere;
 * the collector only uses the schema to build conforming records and to validate before sending.
 */
public final class StreamSchema {
    private final String stream;
    private final List<Column> columns;
    private final Map<String, Column> byName;

    public StreamSchema(String stream, List<Column> columns) {
        this.stream = Objects.requireNonNull(stream, "stream");
        this.columns = List.copyOf(columns);
        Map<String, Column> m = new LinkedHashMap<>();
        for (Column c : this.columns) {
            if (m.put(c.name(), c) != null) throw new IllegalArgumentException("duplicate column " + c.name() + " in " + stream);
        }
        this.byName = m;
    }

    public String stream() { return stream; }
    public List<Column> columns() { return columns; }
    public Optional<Column> column(String name) { return Optional.ofNullable(byName.get(name)); }

    public NormalizedRecord.Builder newRecord() { return new NormalizedRecord.Builder(this); }

    /**
     * Returns the problems that keep {@code record} from matching this schema exactly: wrong stream, missing
     * or extra fields, or values of the wrong type. Empty when the record conforms.
     */
    public List<String> violations(NormalizedRecord record) {
        List<String> out = new ArrayList<>();
        if (!stream.equals(record.stream())) {
            out.add("record belongs to stream " + record.stream() + ", not " + stream);
        }
        Map<String, Object> values = record.values();
        for (Column c : columns) {
            if (!values.containsKey(c.name())) {
                out.add("missing field " + c.name());
            } else if (!c.type().accepts(values.get(c.name()))) {
                out.add("field " + c.name() + " expects " + c.type() + " but has " + values.get(c.name()).getClass().getSimpleName());
            }
        }
        for (String k : values.keySet()) {
            if (!byName.containsKey(k)) out.add("unexpected field " + k);
        }
        return out;
    }

    @Override
    public String toString() {
        return "StreamSchema{" + stream + ", " + columns.size() + " columns}";
    }
}
