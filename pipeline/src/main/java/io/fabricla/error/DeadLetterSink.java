package io.fabricla.error;

import java.util.List;

/** Receives batches that could not be delivered, so they can be inspected or replayed later. */
public interface DeadLetterSink<T> extends AutoCloseable {
    void acceptFailure(String stage, String channel, List<T> records, Exception e);

    @Override default void close() {}

    static <T> DeadLetterSink<T> none() { return (stage, channel, records, e) -> {}; }
}
