package io.fabricla.collector.model;

import java.util.Objects;

public record Column(String name, ColumnType type) {
    public Column {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static Column string(String name) { return new Column(name, ColumnType.STRING); }
    public static Column datetime(String name) { return new Column(name, ColumnType.DATETIME); }
    public static Column int64(String name) { return new Column(name, ColumnType.LONG); }
    public static Column real(String name) { return new Column(name, ColumnType.REAL); }
    public static Column bool(String name) { return new Column(name, ColumnType.BOOLEAN); }
}
