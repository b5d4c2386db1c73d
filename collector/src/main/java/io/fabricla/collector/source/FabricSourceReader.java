package io.fabricla.collector.source;

import io.fabricla.collector.http.RestApiClient;
import io.fabricla.collector.model.CollectionWindow;
import io.fabricla.collector.model.DetailLevel;
import io.fabricla.collector.model.EntityRef;
import io.fabricla.collector.model.RawRecord;
import io.fabricla.core.Source;
import io.fabricla.metrics.Metrics;

import java.util.EnumMap;
import java.util.Map;

/**
 * Reads Fabric and Power BI records. Activity-run detail is fetched only at {@link DetailLevel#FULL} and only when
 * the activity stream is being collected.
 */
public class FabricSourceReader implements SourceReader {
    private final Map<SourceApi, RestApiClient> clients;
    private final Map<SourceApi, String> bases;
    private final boolean activityDetailEnabled;
    private final int maxPages;
    private final int maxDetailPages;
    private final Metrics metrics;

    public FabricSourceReader(Map<SourceApi, RestApiClient> clients,
                              Map<SourceApi, String> bases,
                              boolean activityDetailEnabled,
                              int maxPages,
                              int maxDetailPages,
                              Metrics metrics) {
        this.clients = new EnumMap<>(clients);
        this.bases = new EnumMap<>(bases);
        this.activityDetailEnabled = activityDetailEnabled;
        this.maxPages = maxPages;
        this.maxDetailPages = maxDetailPages;
        this.metrics = metrics;
    }

    @Override
    public Source<RawRecord> read(EntityRef entity, CollectionWindow window, DetailLevel detail) {
        SourceFamily family = SourceFamily.primaryFor(entity.kind());
        boolean fetchDetail = detail == DetailLevel.FULL && activityDetailEnabled && family.detailFamily().isPresent();
        SourceApi detailApi = family.detailFamily().map(SourceFamily::api).orElse(family.api());
        return new PagedRecordSource(
                client(family.api()),
                family,
                entity,
                window,
                family.seeds(base(family.api()), entity, window),
                fetchDetail,
                fetchDetail ? client(detailApi) : null,
                fetchDetail ? base(detailApi) : null,
                maxPages,
                maxDetailPages,
                metrics);
    }

    private RestApiClient client(SourceApi api) {
        RestApiClient c = clients.get(api);
        if (c == null) throw new IllegalStateException("No client configured for " + api);
        return c;
    }

    private String base(SourceApi api) {
        String b = bases.get(api);
        if (b == null) throw new IllegalStateException("No base URL configured for " + api);
        return b;
    }
}
