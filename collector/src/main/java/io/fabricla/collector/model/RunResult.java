package io.fabricla.collector.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * End state of one collection run.
 *
 * @param skippedKinds     kinds whose discovery failed, with the reason; their entities were not collected
 * @param entityFailures   entities abandoned mid-collection (throttling, pagination cap, API errors, deadline)
 * @param deadlineExceeded whether the run's external deadline cut collection short
 * @param workersStillRunning workers that ignored cancellation and were still running when the result was built;
 *                         records they submit afterwards are not reflected in {@code streams}
 */
public record RunResult(RunStatus status,
                        CollectionWindow window,
                        Map<String, StreamResult> streams,
                        Map<EntityKind, String> skippedKinds,
                        List<EntityFailure> entityFailures,
                        int entitiesCollected,
                        boolean deadlineExceeded,
                        int workersStillRunning,
                        Instant startedAt,
                        Instant finishedAt) {
    public RunResult {
        streams = Collections.unmodifiableMap(new TreeMap<>(streams));
        skippedKinds = Map.copyOf(skippedKinds);
        entityFailures = List.copyOf(entityFailures);
    }

    public StreamResult stream(String name) { return streams.get(name); }

    public long totalSent() { return streams.values().stream().mapToLong(StreamResult::sent).sum(); }
    public long totalFailed() { return streams.values().stream().mapToLong(StreamResult::failed).sum(); }
}
