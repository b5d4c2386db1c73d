package io.fabricla.collector.model;

import java.util.List;

/**
 * Which entities of one kind a run covers: everything the caller can see, or a fixed list.
 */
public sealed interface Scope permits Scope.All, Scope.Explicit {

    static Scope all() { return All.INSTANCE; }

    static Scope explicit(List<String> ids) {
        if (ids == null || ids.isEmpty()) throw new IllegalArgumentException("explicit scope needs at least one id");
        return new Explicit(List.copyOf(ids));
    }

    final class All implements Scope {
        private static final All INSTANCE = new All();
        private All() {}
        @Override public String toString() { return "all"; }
    }

    record Explicit(List<String> ids) implements Scope {}
}
