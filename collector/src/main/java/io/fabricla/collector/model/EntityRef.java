package io.fabricla.collector.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A concrete monitored object. For workspace children, {@code workspaceId} names the owning workspace;
 * for workspaces and capacities it is null.
 */
public record EntityRef(String id, EntityKind kind, String workspaceId) {
    public EntityRef {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        if (kind.isWorkspaceChild() && workspaceId == null) {
            throw new IllegalArgumentException(kind + " " + id + " needs a workspace id");
        }
    }

    public static EntityRef workspace(String id) { return new EntityRef(id, EntityKind.WORKSPACE, null); }
    public static EntityRef capacity(String id) { return new EntityRef(id, EntityKind.CAPACITY, null); }
    public static EntityRef child(EntityKind kind, String workspaceId, String id) { return new EntityRef(id, kind, workspaceId); }

    /** Parses the configuration form: plain id for top-level kinds, {@code workspaceId/itemId} for children. */
    public static EntityRef parse(EntityKind kind, String text) {
        String t = text.trim();
        if (!kind.isWorkspaceChild()) return new EntityRef(t, kind, null);
        int slash = t.indexOf('/');
        if (slash <= 0 || slash == t.length() - 1) {
            throw new IllegalArgumentException(kind + " id must be written workspaceId/itemId: " + text);
        }
        return new EntityRef(t.substring(slash + 1), kind, t.substring(0, slash));
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + (workspaceId == null ? "" : workspaceId + "/") + id;
    }
}
