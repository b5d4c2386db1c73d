package io.fabricla.core;

import java.util.List;

/** Delivers one batch for a named channel in a single call; delivery is all-or-nothing. */
public interface BatchSink<T> {
    void acceptBatch(String channel, List<T> records) throws Exception;
}
