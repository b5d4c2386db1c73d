package io.fabricla.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.SortedMap;
import java.util.TreeMap;

public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;

    public Metrics(MetricRegistry registry) {
        this(registry, "");
    }

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix == null || prefix.isEmpty() ? "" : prefix + ".";
    }

    public MetricRegistry registry() { return registry; }

    /** A view whose metric names are nested under this one's prefix. */
    public Metrics scoped(String name) { return new Metrics(registry, prefix + name); }

    public Counter counter(String name) { return registry.counter(prefix + name); }
    public Timer timer(String name) { return registry.timer(prefix + name); }

    /** Counter values by full name, for end-of-run summaries. */
    public SortedMap<String, Long> counterSnapshot() {
        SortedMap<String, Long> out = new TreeMap<>();
        registry.getCounters().forEach((k, v) -> out.put(k, v.getCount()));
        return out;
    }
}
