package io.fabricla.collector.model;

import java.util.List;

/**
 * Per-stream outcome of a run. {@code sent + failed} equals the number of records normalized for the stream.
 */
public record StreamResult(String stream, long sent, long failed, List<String> skippedEntities, List<String> errors) {
    public StreamResult {
        skippedEntities = List.copyOf(skippedEntities);
        errors = List.copyOf(errors);
    }

    public boolean hasFailures() { return failed > 0; }
}
