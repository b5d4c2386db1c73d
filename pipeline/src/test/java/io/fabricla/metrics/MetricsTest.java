package io.fabricla.metrics;

import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MetricsTest {

    @Test
    void scoped_views_share_one_registry() {
        MetricRegistry registry = new MetricRegistry();
        Metrics root = new Metrics(registry, "collector");
        root.scoped("ingest").counter("batches.sent").inc(2);
        root.counter("entities.failed").inc();
        root.scoped("ingest").counter("batches.sent").inc();

        var snapshot = root.counterSnapshot();
        assertEquals(3L, snapshot.get("collector.ingest.batches.sent"));
        assertEquals(1L, snapshot.get("collector.entities.failed"));
        assertSame(registry, root.scoped("x").registry());
    }
}
