package io.fabricla.collector.source;

import com.codahale.metrics.Counter;
import com.fasterxml.jackson.databind.JsonNode;
import io.fabricla.collector.error.CollectorException;
import io.fabricla.collector.error.PaginationExhaustedException;
import io.fabricla.collector.http.ApiPage;
import io.fabricla.collector.http.RestApiClient;
import io.fabricla.collector.model.CollectionWindow;
import io.fabricla.collector.model.EntityRef;
import io.fabricla.collector.model.RawRecord;
import io.fabricla.collector.normalize.JsonFields;
import io.fabricla.core.Source;
import io.fabricla.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lazily pages through one entity's records. Work is a deque of pending records and pending fetches; a fetch
 * is only made when polling reaches it, so each page (and each per-run detail listing) costs exactly one call
 * at the moment its first record is needed. Records keep source order, with a run's activity records right
 * after the run itself.
 *
 * <p>Primary pages and detail pages are capped separately: detail calls grow with the number of runs in the
 * window, primary pages with how the API chunks them.
 */
public class PagedRecordSource implements Source<RawRecord> {
    private static final Logger log = LoggerFactory.getLogger(PagedRecordSource.class);

    private final RestApiClient client;
    private final RestApiClient detailClient;
    private final String detailBase;
    private final SourceFamily family;
    private final EntityRef entity;
    private final CollectionWindow window;
    private final boolean fetchDetail;
    private final int maxPages;
    private final int maxDetailPages;
    private final Deque<Object> pending = new ArrayDeque<>();
    private final Counter pagesFetched;
    private final Counter outOfWindow;
    private int pages;
    private int detailPages;
    private boolean finished;

    private record Fetch(URI uri, SourceFamily family, JsonNode parent) {}

    /**
     * @param detailClient client and base for the detail family's API; ignored unless {@code fetchDetail}
     */
    public PagedRecordSource(RestApiClient client,
                             SourceFamily family,
                             EntityRef entity,
                             CollectionWindow window,
                             List<URI> seeds,
                             boolean fetchDetail,
                             RestApiClient detailClient,
                             String detailBase,
                             int maxPages,
                             int maxDetailPages,
                             Metrics metrics) {
        this.client = client;
        this.family = family;
        this.entity = entity;
        this.window = window;
        this.fetchDetail = fetchDetail && family.detailFamily().isPresent();
        this.detailClient = detailClient == null ? client : detailClient;
        this.detailBase = detailBase;
        this.maxPages = maxPages;
        this.maxDetailPages = maxDetailPages;
        Metrics m = metrics.scoped("source." + family.name().toLowerCase(Locale.ROOT));
        this.pagesFetched = m.counter("pages");
        this.outOfWindow = m.counter("out_of_window");
        for (URI seed : seeds) pending.addLast(new Fetch(seed, family, null));
    }

    @Override
    public Optional<RawRecord> poll() throws CollectorException, InterruptedException {
        while (!pending.isEmpty()) {
            Object head = pending.pollFirst();
            if (head instanceof RawRecord r) return Optional.of(r);
            fetch((Fetch) head);
        }
        finished = true;
        return Optional.empty();
    }

    @Override
    public boolean isFinished() { return finished; }

    private void fetch(Fetch f) throws CollectorException, InterruptedException {
        boolean primary = f.family() == family;
        if (primary && pages >= maxPages) {
            throw new PaginationExhaustedException(entity.toString(), maxPages);
        }
        if (!primary && detailPages >= maxDetailPages) {
            throw new PaginationExhaustedException(entity.toString(), maxDetailPages, f.family() + " detail pages");
        }
        JsonNode body = (primary ? client : detailClient).get(f.uri());
        if (primary) pages++;
        else detailPages++;
        pagesFetched.inc();
        ApiPage page = ApiPage.parse(body, f.uri(), f.family().recordsField());
        log.debug("{} page {} of {}: {} records", f.family(), primary ? pages : detailPages, entity, page.items().size());

        List<Object> next = new ArrayList<>(page.items().size() + 1);
        for (JsonNode item : page.items()) {
            if (!inWindow(f.family(), item)) {
                outOfWindow.inc();
                continue;
            }
            next.add(new RawRecord(f.family().kind(), entity, item, f.parent()));
            if (fetchDetail && primary) {
                String runId = JsonFields.text(item, "id");
                if (runId != null) {
                    next.add(new Fetch(SourceFamily.activityRunsUri(detailBase, entity, runId), family.detailFamily().get(), item));
                }
            }
        }
        page.nextUri().ifPresent(u -> next.add(new Fetch(u, f.family(), f.parent())));
        for (int i = next.size() - 1; i >= 0; i--) pending.addFirst(next.get(i));
    }

    /** Missing or unparseable timestamps are kept; the server-side filter already applied to them. */
    private boolean inWindow(SourceFamily f, JsonNode item) {
        if (f.timeField().isEmpty()) return true;
        Optional<Instant> t = JsonFields.instant(item, f.timeField().get());
        return t.isEmpty() || window.contains(t.get());
    }
}
