package io.fabricla.collector.model;

public enum RunStatus {
    COMPLETED,
    PARTIALLY_FAILED
}
