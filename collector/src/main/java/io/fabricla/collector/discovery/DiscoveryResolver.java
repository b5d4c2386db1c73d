package io.fabricla.collector.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import io.fabricla.collector.error.CollectorException;
import io.fabricla.collector.error.DiscoveryException;
import io.fabricla.collector.error.PaginationExhaustedException;
import io.fabricla.collector.http.ApiPage;
import io.fabricla.collector.http.RestApiClient;
import io.fabricla.collector.http.Uris;
import io.fabricla.collector.model.EntityKind;
import io.fabricla.collector.model.EntityRef;
import io.fabricla.collector.model.Scope;
import io.fabricla.collector.normalize.JsonFields;
import io.fabricla.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a kind's {@link Scope} into concrete entities. Explicit ids are returned as configured, without checking
 * that they exist. {@link Scope#all()} lists what the caller can see through the Fabric API: workspaces and
 * capacities directly, pipelines, dataflows and datasets once per parent workspace.
 */
public class DiscoveryResolver {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryResolver.class);

    private final RestApiClient client;
    private final String base;
    private final int maxPages;
    private final Metrics metrics;

    public DiscoveryResolver(RestApiClient client, String base, int maxPages, Metrics metrics) {
        this.client = client;
        this.base = base;
        this.maxPages = maxPages;
        this.metrics = metrics.scoped("discovery");
    }

    /**
     * @param parents resolved workspaces; only read for workspace-child kinds under {@link Scope#all()}
     * @throws DiscoveryException if a listing call fails after the client's own retries
     */
    public List<EntityRef> resolve(EntityKind kind, Scope scope, List<EntityRef> parents)
            throws DiscoveryException, InterruptedException {
        if (scope instanceof Scope.Explicit explicit) {
            List<EntityRef> out = new ArrayList<>(explicit.ids().size());
            for (String id : explicit.ids()) {
                try {
                    out.add(EntityRef.parse(kind, id));
                } catch (IllegalArgumentException e) {
                    throw new DiscoveryException(kind, e.getMessage(), e);
                }
            }
            return out;
        }

        Map<String, EntityRef> found = new LinkedHashMap<>();
        try {
            if (kind.isWorkspaceChild()) {
                for (EntityRef ws : parents) {
                    URI uri = Uris.resolve(base, "/workspaces/" + Uris.encode(ws.id()) + "/items?type=" + itemType(kind));
                    for (String id : listIds(uri, kind + " in " + ws.id())) {
                        EntityRef ref = EntityRef.child(kind, ws.id(), id);
                        found.putIfAbsent(ref.toString(), ref);
                    }
                }
            } else {
                String path = kind == EntityKind.WORKSPACE ? "/workspaces" : "/capacities";
                for (String id : listIds(Uris.resolve(base, path), kind.toString())) {
                    EntityRef ref = new EntityRef(id, kind, null);
                    found.putIfAbsent(ref.toString(), ref);
                }
            }
        } catch (CollectorException e) {
            metrics.counter("failures").inc();
            throw new DiscoveryException(kind, "Discovery of " + kind + " failed: " + e.getMessage(), e);
        }
        metrics.counter(kind.name().toLowerCase(Locale.ROOT)).inc(found.size());
        log.info("Discovered {} {} entities", found.size(), kind);
        return List.copyOf(found.values());
    }

    private List<String> listIds(URI first, String what) throws CollectorException, InterruptedException {
        List<String> ids = new ArrayList<>();
        URI next = first;
        int pages = 0;
        while (next != null) {
            if (pages >= maxPages) throw new PaginationExhaustedException(what, maxPages);
            JsonNode body = client.get(next);
            pages++;
            ApiPage page = ApiPage.parse(body, next, "value");
            for (JsonNode item : page.items()) {
                String id = JsonFields.text(item, "id");
                if (id != null) ids.add(id);
            }
            next = page.nextUri().orElse(null);
        }
        return ids;
    }

    static String itemType(EntityKind kind) {
        switch (kind) {
            case PIPELINE: return "DataPipeline";
            case DATAFLOW: return "Dataflow";
            case DATASET: return "SemanticModel";
            default: throw new IllegalArgumentException(kind + " is not a workspace item");
        }
    }
}
