package io.fabricla.collector.model;

import java.time.Duration;
import java.util.Locale;

/**
 * Temporal collection strategies. The mode picks the default window length and whether activity-level detail
 * is fetched; both can be overridden in configuration.
 */
public enum CollectionMode {
    BULK(Duration.ofDays(30), DetailLevel.SUMMARY),
    INCREMENTAL(Duration.ofMinutes(60), DetailLevel.FULL),
    ACTIVITY_BACKFILL(Duration.ofDays(7), DetailLevel.FULL);

    private final Duration defaultLookback;
    private final DetailLevel defaultDetail;

    CollectionMode(Duration defaultLookback, DetailLevel defaultDetail) {
        this.defaultLookback = defaultLookback;
        this.defaultDetail = defaultDetail;
    }

    public Duration defaultLookback() { return defaultLookback; }
    public DetailLevel defaultDetail() { return defaultDetail; }

    public static CollectionMode parse(String s) {
        return CollectionMode.valueOf(s.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
