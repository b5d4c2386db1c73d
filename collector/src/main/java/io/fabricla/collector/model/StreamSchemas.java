package io.fabricla.collector.model;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.fabricla.collector.model.Column.bool;
import static io.fabricla.collector.model.Column.datetime;
import static io.fabricla.collector.model.Column.int64;
import static io.fabricla.collector.model.Column.real;
import static io.fabricla.collector.model.Column.string;

/**
 * The provisioned streams and their table schemas, one per source kind.
 */
public final class StreamSchemas {
    public static final String PIPELINE_RUNS = "Custom-FabricPipelineRun_CL";
    public static final String ACTIVITY_RUNS = "Custom-FabricPipelineActivityRun_CL";
    public static final String DATAFLOW_RUNS = "Custom-FabricDataflowRun_CL";
    public static final String DATASET_REFRESHES = "Custom-FabricDatasetRefresh_CL";
    public static final String USER_ACTIVITY = "Custom-FabricUserActivity_CL";
    public static final String CAPACITY_METRICS = "Custom-FabricCapacityMetrics_CL";

    private static final Map<String, StreamSchema> BY_STREAM = new LinkedHashMap<>();
    private static final Map<SourceKind, StreamSchema> BY_KIND = new EnumMap<>(SourceKind.class);

    static {
        register(SourceKind.PIPELINE_RUN, new StreamSchema(PIPELINE_RUNS, List.of(
                datetime("TimeGenerated"), string("WorkspaceId"), string("PipelineId"), string("RunId"),
                string("JobType"), string("InvokeType"), string("Status"),
                datetime("StartTime"), datetime("EndTime"), int64("DurationMs"), string("FailureReason"))));
        register(SourceKind.ACTIVITY_RUN, new StreamSchema(ACTIVITY_RUNS, List.of(
                datetime("TimeGenerated"), string("WorkspaceId"), string("PipelineId"), string("RunId"),
                string("ActivityRunId"), string("ActivityName"), string("ActivityType"), string("Status"),
                datetime("StartTime"), datetime("EndTime"), int64("DurationMs"), string("ErrorMessage"))));
        register(SourceKind.DATAFLOW_RUN, new StreamSchema(DATAFLOW_RUNS, List.of(
                datetime("TimeGenerated"), string("WorkspaceId"), string("DataflowId"), string("RunId"),
                string("JobType"), string("InvokeType"), string("Status"),
                datetime("StartTime"), datetime("EndTime"), int64("DurationMs"), string("FailureReason"))));
        register(SourceKind.DATASET_REFRESH, new StreamSchema(DATASET_REFRESHES, List.of(
                datetime("TimeGenerated"), string("WorkspaceId"), string("DatasetId"), string("RequestId"),
                string("RefreshType"), string("Status"),
                datetime("StartTime"), datetime("EndTime"), int64("DurationMs"), string("ServiceExceptionJson"))));
        register(SourceKind.USER_ACTIVITY, new StreamSchema(USER_ACTIVITY, List.of(
                datetime("TimeGenerated"), string("ActivityId"), string("Activity"), string("Operation"),
                string("UserId"), string("WorkspaceId"), string("ItemName"), string("ItemType"), string("ClientIP"),
                bool("IsSuccess"), int64("RecordType"))));
        register(SourceKind.CAPACITY_METRIC, new StreamSchema(CAPACITY_METRICS, List.of(
                datetime("TimeGenerated"), string("CapacityId"), string("WorkspaceId"), string("ItemId"),
                string("ItemKind"), string("OperationName"), real("CuSeconds"), int64("DurationMs"),
                int64("UserCount"), bool("Throttled"))));
    }

    private StreamSchemas() {}

    private static void register(SourceKind kind, StreamSchema schema) {
        BY_STREAM.put(schema.stream(), schema);
        BY_KIND.put(kind, schema);
    }

    public static StreamSchema forKind(SourceKind kind) { return BY_KIND.get(kind); }

    public static Optional<StreamSchema> forStream(String stream) { return Optional.ofNullable(BY_STREAM.get(stream)); }

    public static List<String> streamNames() { return List.copyOf(BY_STREAM.keySet()); }

    /** The source kind whose records land in {@code stream}. */
    public static Optional<SourceKind> kindOf(String stream) {
        return BY_KIND.entrySet().stream()
                .filter(e -> e.getValue().stream().equals(stream))
                .map(Map.Entry::getKey)
                .findFirst();
    }
}
