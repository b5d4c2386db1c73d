package io.fabricla.collector.model;

/** Tag carried by every raw record: which API family produced it and so which mapping normalizes it. */
public enum SourceKind {
    PIPELINE_RUN,
    ACTIVITY_RUN,
    DATAFLOW_RUN,
    DATASET_REFRESH,
    USER_ACTIVITY,
    CAPACITY_METRIC
}
