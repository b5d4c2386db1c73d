package io.fabricla.collector.model;

import java.util.Locale;

/** Kinds of monitored Fabric objects. Child kinds live inside a workspace. */
public enum EntityKind {
    WORKSPACE(false),
    PIPELINE(true),
    DATAFLOW(true),
    DATASET(true),
    CAPACITY(false);

    private final boolean workspaceChild;

    EntityKind(boolean workspaceChild) { this.workspaceChild = workspaceChild; }

    public boolean isWorkspaceChild() { return workspaceChild; }

    public static EntityKind parse(String s) {
        return EntityKind.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
