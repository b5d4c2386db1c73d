package io.fabricla.collector.model;

import java.util.Locale;

/** SUMMARY skips per-parent sub-resource calls; FULL issues one extra paginated call per parent record. */
public enum DetailLevel {
    SUMMARY,
    FULL;

    public static DetailLevel parse(String s) {
        return DetailLevel.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
