package io.fabricla.collector.model;

import java.time.Instant;

/** Column types supported by the destination tables, with the Java type each value must have. */
public enum ColumnType {
    STRING(String.class),
    DATETIME(Instant.class),
    LONG(Long.class),
    REAL(Double.class),
    BOOLEAN(Boolean.class);

    private final Class<?> javaType;

    ColumnType(Class<?> javaType) { this.javaType = javaType; }

    public Class<?> javaType() { return javaType; }

    /** Nulls are accepted for every type; unknown values are sent as null. */
    public boolean accepts(Object value) {
        return value == null || javaType.isInstance(value);
    }
}
