package io.fabricla.collector.source;

import io.fabricla.collector.http.Uris;
import io.fabricla.collector.model.CollectionWindow;
import io.fabricla.collector.model.EntityKind;
import io.fabricla.collector.model.EntityRef;
import io.fabricla.collector.model.SourceKind;

import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One Source API family: the entity kind it is read for, where its records live and which field dates them.
 * {@link #ACTIVITY_RUNS} is a sub-resource family fetched per pipeline run.
 */
public enum SourceFamily {
    PIPELINE_RUNS(SourceKind.PIPELINE_RUN, EntityKind.PIPELINE, SourceApi.FABRIC, "value", "startTimeUtc", false),
    ACTIVITY_RUNS(SourceKind.ACTIVITY_RUN, EntityKind.PIPELINE, SourceApi.FABRIC, "value", null, false),
    DATAFLOW_RUNS(SourceKind.DATAFLOW_RUN, EntityKind.DATAFLOW, SourceApi.FABRIC, "value", "startTimeUtc", false),
    DATASET_REFRESHES(SourceKind.DATASET_REFRESH, EntityKind.DATASET, SourceApi.POWER_BI, "value", "startTime", false),
    USER_ACTIVITY(SourceKind.USER_ACTIVITY, EntityKind.WORKSPACE, SourceApi.POWER_BI, "activityEventEntities", "CreationTime", true),
    CAPACITY_METRICS(SourceKind.CAPACITY_METRIC, EntityKind.CAPACITY, SourceApi.FABRIC, "value", "timestamp", false);

    private final SourceKind kind;
    private final EntityKind entityKind;
    private final SourceApi api;
    private final String recordsField;
    private final String timeField;
    private final boolean daySliced;

    SourceFamily(SourceKind kind, EntityKind entityKind, SourceApi api, String recordsField, String timeField, boolean daySliced) {
        this.kind = kind;
        this.entityKind = entityKind;
        this.api = api;
        this.recordsField = recordsField;
        this.timeField = timeField;
        this.daySliced = daySliced;
    }

    public SourceKind kind() { return kind; }
    public EntityKind entityKind() { return entityKind; }
    public SourceApi api() { return api; }
    public String recordsField() { return recordsField; }
    public Optional<String> timeField() { return Optional.ofNullable(timeField); }

    /** The family read directly for an entity of this kind (sub-resource families excluded). */
    public static SourceFamily primaryFor(EntityKind entityKind) {
        for (SourceFamily f : values()) {
            if (f.entityKind == entityKind && f != ACTIVITY_RUNS) return f;
        }
        throw new IllegalArgumentException("No source family reads " + entityKind);
    }

    public static SourceFamily of(SourceKind kind) {
        for (SourceFamily f : values()) {
            if (f.kind == kind) return f;
        }
        throw new IllegalArgumentException("No source family for " + kind);
    }

    /** Sub-resource family fetched once per parent record at full detail, if any. */
    public Optional<SourceFamily> detailFamily() {
        return this == PIPELINE_RUNS ? Optional.of(ACTIVITY_RUNS) : Optional.empty();
    }

    /**
     * First-page requests for {@code entity} over {@code window}. Usually one; the activity-events API only
     * accepts same-day ranges, so it gets one per UTC day.
     */
    public List<URI> seeds(String base, EntityRef entity, CollectionWindow window) {
        if (entity.kind() != entityKind) {
            throw new IllegalArgumentException(this + " cannot read " + entity);
        }
        List<URI> out = new ArrayList<>();
        switch (this) {
            case PIPELINE_RUNS, DATAFLOW_RUNS -> out.add(Uris.resolve(base,
                    "/workspaces/" + Uris.encode(entity.workspaceId()) + "/items/" + Uris.encode(entity.id()) + "/jobs/instances"));
            case DATASET_REFRESHES -> out.add(Uris.resolve(base,
                    "/groups/" + Uris.encode(entity.workspaceId()) + "/datasets/" + Uris.encode(entity.id()) + "/refreshes"));
            case USER_ACTIVITY -> {
                for (CollectionWindow day : daySliced ? window.utcDaySlices() : List.of(window)) {
                    out.add(Uris.resolve(base, "/admin/activityevents"
                            + "?startDateTime=" + Uris.encode(quoted(day.start()))
                            + "&endDateTime=" + Uris.encode(quoted(day.end().minusMillis(1)))
                            + "&$filter=" + Uris.encode("WorkspaceId eq '" + entity.id() + "'")));
                }
            }
            case CAPACITY_METRICS -> out.add(Uris.resolve(base, "/capacities/" + Uris.encode(entity.id()) + "/metrics"
                    + "?startDateTime=" + Uris.encode(window.start().toString())
                    + "&endDateTime=" + Uris.encode(window.end().toString())));
            case ACTIVITY_RUNS -> throw new IllegalArgumentException("activity runs are read per pipeline run");
        }
        return out;
    }

    /** Activity runs of one pipeline run. */
    public static URI activityRunsUri(String base, EntityRef pipeline, String runId) {
        return Uris.resolve(base, "/workspaces/" + Uris.encode(pipeline.workspaceId()) + "/items/" + Uris.encode(pipeline.id())
                + "/jobs/instances/" + Uris.encode(runId) + "/activityruns");
    }

    private static String quoted(Instant t) {
        return "'" + DateTimeFormatter.ISO_INSTANT.format(t.truncatedTo(ChronoUnit.MILLIS)) + "'";
    }
}
