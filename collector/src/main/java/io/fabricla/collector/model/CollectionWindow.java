package io.fabricla.collector.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Half-open time range [start, end) a run collects, tagged with the mode that produced it.
 */
public record CollectionWindow(Instant start, Instant end, CollectionMode mode) {
    public CollectionWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(mode, "mode");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("window start " + start + " must be before end " + end);
        }
    }

    /** Window ending at {@code now}, reaching back {@code lookback} (or the mode's default when null). */
    public static CollectionWindow endingAt(Instant now, CollectionMode mode, Duration lookback) {
        Duration len = lookback == null ? mode.defaultLookback() : lookback;
        return new CollectionWindow(now.minus(len), now, mode);
    }

    public boolean contains(Instant t) {
        return !t.isBefore(start) && t.isBefore(end);
    }

    public Duration length() { return Duration.between(start, end); }

    /** Splits the window at UTC midnights; APIs that only accept same-day ranges are paged one slice at a time. */
    public List<CollectionWindow> utcDaySlices() {
        List<CollectionWindow> out = new ArrayList<>();
        Instant s = start;
        while (s.isBefore(end)) {
            LocalDate day = s.atZone(ZoneOffset.UTC).toLocalDate();
            Instant nextMidnight = day.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC);
            Instant e = nextMidnight.isBefore(end) ? nextMidnight : end;
            out.add(new CollectionWindow(s, e, mode));
            s = e;
        }
        return out;
    }
}
