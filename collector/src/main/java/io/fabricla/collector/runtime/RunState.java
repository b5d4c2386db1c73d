package io.fabricla.collector.runtime;

/** Lifecycle of one collection run. */
public enum RunState {
    INIT,
    DISCOVERING,
    COLLECTING,
    FLUSHING,
    COMPLETED,
    PARTIALLY_FAILED
}
