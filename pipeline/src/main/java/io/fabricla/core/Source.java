package io.fabricla.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * A Source produces a lazy, finite, non-restartable sequence of records. Each element is fetched on demand;
 * implementations backed by a remote API make one call per page boundary.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch the next record, blocking on I/O if the current page is used up. Returns empty once the source is
     * exhausted; after that {@link #isFinished()} is true and further polls keep returning empty.
     */
    Optional<T> poll() throws Exception;

    /**
     * Whether the source has reached a terminal state and will produce no more records.
     */
    boolean isFinished();

    @Override
    default void close() {}
}
