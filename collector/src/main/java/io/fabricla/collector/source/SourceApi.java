package io.fabricla.collector.source;

/** The REST APIs records are read from; each has its own base URL and token scope. */
public enum SourceApi {
    FABRIC,
    POWER_BI
}
