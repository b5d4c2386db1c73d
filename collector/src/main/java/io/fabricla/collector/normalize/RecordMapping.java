package io.fabricla.collector.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import io.fabricla.collector.error.NormalizationException;
import io.fabricla.collector.model.NormalizedRecord;
import io.fabricla.collector.model.RawRecord;
import io.fabricla.collector.model.SourceKind;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-family field mapping from a raw record onto its stream's columns. Columns a mapping does not set stay null.
 */
@FunctionalInterface
public interface RecordMapping {

    void map(RawRecord raw, NormalizedRecord.Builder out) throws NormalizationException;

    static RecordMapping forKind(SourceKind kind) {
        RecordMapping m = Mappings.BY_KIND.get(kind);
        if (m == null) throw new IllegalArgumentException("No mapping for " + kind);
        return m;
    }

    final class Mappings {
        private static final Map<SourceKind, RecordMapping> BY_KIND = new EnumMap<>(SourceKind.class);

        static {
            BY_KIND.put(SourceKind.PIPELINE_RUN, (raw, out) -> jobInstance(raw, out, "PipelineId"));
            BY_KIND.put(SourceKind.DATAFLOW_RUN, (raw, out) -> jobInstance(raw, out, "DataflowId"));
            BY_KIND.put(SourceKind.ACTIVITY_RUN, Mappings::activityRun);
            BY_KIND.put(SourceKind.DATASET_REFRESH, Mappings::datasetRefresh);
            BY_KIND.put(SourceKind.USER_ACTIVITY, Mappings::userActivity);
            BY_KIND.put(SourceKind.CAPACITY_METRIC, Mappings::capacityMetric);
        }

        private Mappings() {}

        private static void jobInstance(RawRecord raw, NormalizedRecord.Builder out, String itemColumn) throws NormalizationException {
            JsonNode b = raw.body();
            Instant start = JsonFields.instant(b, "startTimeUtc", "startTime").orElse(null);
            Instant end = JsonFields.instant(b, "endTimeUtc", "endTime").orElse(null);
            out.set("TimeGenerated", end != null ? end : start)
                    .set("WorkspaceId", raw.entity().workspaceId())
                    .set(itemColumn, coalesce(JsonFields.text(b, "itemId"), raw.entity().id()))
                    .set("RunId", required(raw, b, "RunId", "id"))
                    .set("JobType", JsonFields.text(b, "jobType"))
                    .set("InvokeType", JsonFields.text(b, "invokeType"))
                    .set("Status", JsonFields.text(b, "status"))
                    .set("StartTime", start)
                    .set("EndTime", end)
                    .set("DurationMs", JsonFields.durationMs(start, end))
                    .set("FailureReason", errorText(b.get("failureReason")));
        }

        private static void activityRun(RawRecord raw, NormalizedRecord.Builder out) throws NormalizationException {
            JsonNode b = raw.body();
            Instant start = JsonFields.instant(b, "activityRunStart", "startTime").orElse(null);
            Instant end = JsonFields.instant(b, "activityRunEnd", "endTime").orElse(null);
            Long duration = JsonFields.longValue(b, "durationInMs", "durationMs");
            out.set("TimeGenerated", end != null ? end : start)
                    .set("WorkspaceId", raw.entity().workspaceId())
                    .set("PipelineId", raw.entity().id())
                    .set("RunId", coalesce(JsonFields.text(b, "pipelineRunId"), JsonFields.text(raw.parent(), "id")))
                    .set("ActivityRunId", required(raw, b, "ActivityRunId", "activityRunId"))
                    .set("ActivityName", JsonFields.text(b, "activityName"))
                    .set("ActivityType", JsonFields.text(b, "activityType"))
                    .set("Status", JsonFields.text(b, "status"))
                    .set("StartTime", start)
                    .set("EndTime", end)
                    .set("DurationMs", duration != null ? duration : JsonFields.durationMs(start, end))
                    .set("ErrorMessage", errorText(b.get("error")));
        }

        private static void datasetRefresh(RawRecord raw, NormalizedRecord.Builder out) throws NormalizationException {
            JsonNode b = raw.body();
            Instant start = JsonFields.instant(b, "startTime").orElse(null);
            Instant end = JsonFields.instant(b, "endTime").orElse(null);
            out.set("TimeGenerated", end != null ? end : start)
                    .set("WorkspaceId", raw.entity().workspaceId())
                    .set("DatasetId", raw.entity().id())
                    .set("RequestId", required(raw, b, "RequestId", "requestId", "id"))
                    .set("RefreshType", JsonFields.text(b, "refreshType"))
                    .set("Status", JsonFields.text(b, "status"))
                    .set("StartTime", start)
                    .set("EndTime", end)
                    .set("DurationMs", JsonFields.durationMs(start, end))
                    .set("ServiceExceptionJson", JsonFields.text(b, "serviceExceptionJson"));
        }

        private static void userActivity(RawRecord raw, NormalizedRecord.Builder out) throws NormalizationException {
            JsonNode b = raw.body();
            out.set("TimeGenerated", JsonFields.instant(b, "CreationTime").orElse(null))
                    .set("ActivityId", required(raw, b, "ActivityId", "Id", "ActivityId"))
                    .set("Activity", JsonFields.text(b, "Activity"))
                    .set("Operation", JsonFields.text(b, "Operation"))
                    .set("UserId", JsonFields.text(b, "UserId", "UserKey"))
                    .set("WorkspaceId", coalesce(JsonFields.text(b, "WorkspaceId"), raw.entity().id()))
                    .set("ItemName", JsonFields.text(b, "ItemName", "ArtifactName"))
                    .set("ItemType", JsonFields.text(b, "ItemType", "ArtifactKind"))
                    .set("ClientIP", JsonFields.text(b, "ClientIP"))
                    .set("IsSuccess", JsonFields.bool(b, "IsSuccess"))
                    .set("RecordType", JsonFields.longValue(b, "RecordType"));
        }

        private static void capacityMetric(RawRecord raw, NormalizedRecord.Builder out) {
            JsonNode b = raw.body();
            out.set("TimeGenerated", JsonFields.instant(b, "timestamp").orElse(null))
                    .set("CapacityId", coalesce(JsonFields.text(b, "capacityId"), raw.entity().id()))
                    .set("WorkspaceId", JsonFields.text(b, "workspaceId"))
                    .set("ItemId", JsonFields.text(b, "itemId"))
                    .set("ItemKind", JsonFields.text(b, "itemKind"))
                    .set("OperationName", JsonFields.text(b, "operationName"))
                    .set("CuSeconds", JsonFields.doubleValue(b, "cuSeconds", "totalCUs"))
                    .set("DurationMs", JsonFields.longValue(b, "durationMs", "durationInMs"))
                    .set("UserCount", JsonFields.longValue(b, "userCount", "users"))
                    .set("Throttled", JsonFields.bool(b, "throttled", "isThrottled"));
        }

        private static String required(RawRecord raw, JsonNode body, String column, String... fields) throws NormalizationException {
            String v = JsonFields.text(body, fields);
            if (v == null) {
                throw new NormalizationException(raw.kind() + " record for " + raw.entity() + " has no " + column);
            }
            return v;
        }

        private static String coalesce(String a, String b) { return a != null ? a : b; }

        /** Error objects carry a message; anything else is kept as its JSON text. */
        private static String errorText(JsonNode error) {
            if (error == null || error.isNull()) return null;
            if (error.isObject()) {
                String msg = JsonFields.text(error, "message", "errorMessage");
                if (msg != null) return msg;
                return error.toString();
            }
            String s = error.asText();
            return s.isEmpty() ? null : s;
        }
    }
}
