package io.fabricla.core;

import java.util.List;

/**
 * Transform converts an input record into zero or more output records.
 * Implementations must be free of I/O so they can run on any worker thread.
 */
public interface Transform<I, O> {
    List<O> apply(I input) throws Exception;
}
