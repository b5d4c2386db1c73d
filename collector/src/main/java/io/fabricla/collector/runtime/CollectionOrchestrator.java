package io.fabricla.collector.runtime;

import com.codahale.metrics.MetricRegistry;
import io.fabricla.budget.Budget;
import io.fabricla.budget.QpsBudget;
import io.fabricla.collector.auth.CredentialProvider;
import io.fabricla.collector.auth.TokenSession;
import io.fabricla.collector.config.CollectorConfig;
import io.fabricla.collector.error.AuthException;
import io.fabricla.collector.error.CollectorException;
import io.fabricla.collector.error.ConfigException;
import io.fabricla.collector.error.DiscoveryException;
import io.fabricla.collector.error.TransientHttpException;
import io.fabricla.collector.discovery.DiscoveryResolver;
import io.fabricla.collector.http.RestApiClient;
import io.fabricla.collector.ingest.BatchIngestionClient;
import io.fabricla.collector.ingest.LogsIngestionSink;
import io.fabricla.collector.model.CollectionWindow;
import io.fabricla.collector.model.DetailLevel;
import io.fabricla.collector.model.EntityFailure;
import io.fabricla.collector.model.EntityKind;
import io.fabricla.collector.model.EntityRef;
import io.fabricla.collector.model.NormalizedRecord;
import io.fabricla.collector.model.RawRecord;
import io.fabricla.collector.model.RunResult;
import io.fabricla.collector.model.RunStatus;
import io.fabricla.collector.model.Scope;
import io.fabricla.collector.model.SourceKind;
import io.fabricla.collector.model.StreamResult;
import io.fabricla.collector.model.StreamSchemas;
import io.fabricla.collector.normalize.RecordNormalizer;
import io.fabricla.collector.source.FabricSourceReader;
import io.fabricla.collector.source.SourceApi;
import io.fabricla.collector.source.SourceFamily;
import io.fabricla.collector.source.SourceReader;
import io.fabricla.core.Json;
import io.fabricla.core.Source;
import io.fabricla.error.DeadLetterSink;
import io.fabricla.metrics.Metrics;
import io.fabricla.retry.RetryPolicy;
import io.fabricla.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one collection: discover entities, read and normalize each entity's records on a bounded worker pool,
 * batch them into the ingestion streams, flush, and summarize.
 *
 * <p>Only configuration errors, failing to get the initial tokens and failing to discover any configured kind
 * abort a run. Everything else is contained at the entity or batch where it happened and shows up in the
 * {@link RunResult}.
 */
public class CollectionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CollectionOrchestrator.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final CollectorConfig config;
    private final HttpClient http;
    private final CredentialProvider credentials;
    private final Metrics metrics;
    private final Sleeper sleeper;
    private final Clock clock;
    private final DeadLetterSink<NormalizedRecord> deadLetters;
    private final AtomicInteger runningWorkers = new AtomicInteger();
    private Duration shutdownGrace = SHUTDOWN_GRACE;
    private volatile RunState state = RunState.INIT;

    public CollectionOrchestrator(CollectorConfig config,
                                  HttpClient http,
                                  CredentialProvider credentials,
                                  MetricRegistry registry,
                                  Sleeper sleeper,
                                  Clock clock,
                                  DeadLetterSink<NormalizedRecord> deadLetters) {
        this.config = config;
        this.http = http;
        this.credentials = credentials;
        this.metrics = new Metrics(registry, "collector");
        this.sleeper = sleeper;
        this.clock = clock;
        this.deadLetters = deadLetters == null ? DeadLetterSink.none() : deadLetters;
    }

    public RunState state() { return state; }

    /** Extra wait, on top of the HTTP timeout, for abandoned workers to stop after the deadline. */
    CollectionOrchestrator shutdownGrace(Duration grace) {
        this.shutdownGrace = grace;
        return this;
    }

    public RunResult run() throws ConfigException, AuthException, DiscoveryException, InterruptedException {
        state = RunState.INIT;
        Instant startedAt = clock.instant();
        config.validate();
        CollectionWindow window;
        try {
            window = config.window(startedAt);
        } catch (DateTimeException | IllegalArgumentException | ArithmeticException e) {
            throw new ConfigException("Invalid collection window: " + e.getMessage(), e);
        }
        DetailLevel detail = config.effectiveDetail();
        log.info("Run starting: mode={} window=[{}, {}) detail={} streams={}",
                config.mode(), window.start(), window.end(), detail, config.streams());

        Map<SourceApi, TokenSession> apiTokens = new EnumMap<>(SourceApi.class);
        for (SourceApi api : config.requiredApis()) {
            apiTokens.put(api, TokenSession.open(credentials, config.scopes().forApi(api), clock));
        }
        TokenSession ingestTokens = TokenSession.open(credentials, config.scopes().ingestion(), clock);

        Map<SourceApi, RestApiClient> clients = new EnumMap<>(SourceApi.class);
        Map<SourceApi, String> bases = new EnumMap<>(SourceApi.class);
        RetryPolicy sourceRetry = config.retry().policy(e -> e instanceof TransientHttpException);
        Budget budget = config.sourceQps() > 0 ? new QpsBudget(config.sourceQps(), sleeper) : Budget.UNLIMITED;
        for (Map.Entry<SourceApi, TokenSession> e : apiTokens.entrySet()) {
            clients.put(e.getKey(), new RestApiClient(e.getKey().name().toLowerCase(Locale.ROOT), http, e.getValue(),
                    sourceRetry, budget, sleeper, clock, config.httpTimeout(), config.throttleMaxAttempts(),
                    config.throttleDefaultRetryAfter(), Json.mapper(), metrics));
            bases.put(e.getKey(), e.getKey() == SourceApi.FABRIC ? config.fabricApiBase() : config.powerBiApiBase());
        }

        state = RunState.DISCOVERING;
        DiscoveryResolver discovery = new DiscoveryResolver(clients.get(SourceApi.FABRIC), config.fabricApiBase(),
                config.sourceMaxPages(), metrics);
        Map<EntityKind, String> skippedKinds = new EnumMap<>(EntityKind.class);
        List<EntityRef> entities = discover(discovery, skippedKinds);

        state = RunState.COLLECTING;
        Set<SourceKind> kinds = config.sourceKinds();
        SourceReader reader = new FabricSourceReader(clients, bases, kinds.contains(SourceKind.ACTIVITY_RUN),
                config.sourceMaxPages(), config.sourceMaxDetailPages(), metrics);
        RecordNormalizer normalizer = new RecordNormalizer(Set.copyOf(config.streams()));
        BatchIngestionClient ingestion = new BatchIngestionClient(
                new LogsIngestionSink(http, config.ingestion().endpoint(), config.ingestion().dcrId(),
                        config.ingestion().apiVersion(), ingestTokens, config.httpTimeout(), Json.mapper(), clock, metrics),
                ingestTokens,
                config.retry().policy(e -> e instanceof TransientHttpException),
                sleeper,
                config.batch().maxRecords(),
                config.batch().maxBytes(),
                deadLetters,
                Json.mapper(),
                metrics);
        ingestion.open(config.streams());

        Queue<EntityFailure> failures = new ConcurrentLinkedQueue<>();
        AtomicInteger collected = new AtomicInteger();
        boolean deadlineExceeded = collect(entities, window, detail, reader, normalizer, ingestion, failures, collected, startedAt);

        state = RunState.FLUSHING;
        ingestion.close();
        ingestion.flushAll();

        RunResult result = summarize(window, ingestion, skippedKinds, new ArrayList<>(failures), collected.get(),
                deadlineExceeded, runningWorkers.get(), startedAt);
        state = result.status() == RunStatus.COMPLETED ? RunState.COMPLETED : RunState.PARTIALLY_FAILED;
        log.info("Run finished {}: sent={} failed={} entities={} entityFailures={} skippedKinds={}",
                result.status(), result.totalSent(), result.totalFailed(), result.entitiesCollected(),
                result.entityFailures().size(), result.skippedKinds().keySet());
        return result;
    }

    /**
     * Workspaces go first since child kinds under {@link Scope#all()} are listed per workspace. A kind that cannot
     * be discovered is skipped; if every collected kind is skipped the run has nothing to do and fails.
     */
    private List<EntityRef> discover(DiscoveryResolver discovery, Map<EntityKind, String> skipped)
            throws DiscoveryException, InterruptedException {
        Set<EntityKind> collectedKinds = config.collectedKinds();
        boolean needWorkspaces = collectedKinds.contains(EntityKind.WORKSPACE) || collectedKinds.stream()
                .anyMatch(k -> k.isWorkspaceChild() && config.scope(k) instanceof Scope.All);

        List<EntityRef> workspaces = List.of();
        DiscoveryException workspaceFailure = null;
        if (needWorkspaces) {
            try {
                workspaces = discovery.resolve(EntityKind.WORKSPACE, config.scope(EntityKind.WORKSPACE), List.of());
            } catch (DiscoveryException e) {
                workspaceFailure = e;
                log.warn("Skipping workspace discovery: {}", e.getMessage());
            }
        }

        List<EntityRef> out = new ArrayList<>();
        DiscoveryException last = workspaceFailure;
        for (EntityKind kind : collectedKinds) {
            if (kind == EntityKind.WORKSPACE) {
                if (workspaceFailure != null) skipped.put(kind, workspaceFailure.getMessage());
                else out.addAll(workspaces);
                continue;
            }
            Scope scope = config.scope(kind);
            if (kind.isWorkspaceChild() && scope instanceof Scope.All && workspaceFailure != null) {
                skipped.put(kind, "workspaces could not be discovered: " + workspaceFailure.getMessage());
                continue;
            }
            try {
                out.addAll(discovery.resolve(kind, scope, workspaces));
            } catch (DiscoveryException e) {
                last = e;
                skipped.put(kind, e.getMessage());
                log.warn("Skipping {}: {}", kind, e.getMessage());
            }
        }
        if (!collectedKinds.isEmpty() && skipped.keySet().containsAll(collectedKinds)) {
            throw new DiscoveryException(null, "No configured entity kind could be discovered: " + skipped, last);
        }
        log.info("Collecting {} entities", out.size());
        return out;
    }

    /** Returns whether the deadline cut collection short. */
    private boolean collect(List<EntityRef> entities,
                            CollectionWindow window,
                            DetailLevel detail,
                            SourceReader reader,
                            RecordNormalizer normalizer,
                            BatchIngestionClient ingestion,
                            Queue<EntityFailure> failures,
                            AtomicInteger collected,
                            Instant startedAt) throws InterruptedException {
        if (entities.isEmpty()) return false;
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.workers(), entities.size()), workerThreads());
        Map<EntityRef, Future<?>> tasks = new LinkedHashMap<>();
        for (EntityRef entity : entities) {
            tasks.put(entity, pool.submit(() -> collectEntity(entity, window, detail, reader, normalizer, ingestion, failures, collected)));
        }
        pool.shutdown();

        boolean finished;
        try {
            if (config.runDeadline() == null) {
                finished = pool.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
            } else {
                Duration left = Duration.between(clock.instant(), startedAt.plus(config.runDeadline()));
                finished = !left.isNegative() && pool.awaitTermination(left.toNanos(), TimeUnit.NANOSECONDS);
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            throw e;
        }
        if (finished) return false;

        log.warn("Run deadline of {} reached; abandoning in-flight entities", config.runDeadline());
        List<EntityRef> unfinished = new ArrayList<>();
        for (Map.Entry<EntityRef, Future<?>> t : tasks.entrySet()) {
            if (!t.getValue().isDone()) unfinished.add(t.getKey());
        }
        pool.shutdownNow();
        for (EntityRef e : unfinished) {
            failures.add(new EntityFailure(e.toString(), e.kind(), "DeadlineExceeded",
                    "abandoned when the run deadline of " + config.runDeadline() + " expired"));
        }
        if (!pool.awaitTermination(config.httpTimeout().plus(shutdownGrace).toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("{} workers did not stop after the deadline; records they submit from now on are not in the result",
                    runningWorkers.get());
        }
        return true;
    }

    private void collectEntity(EntityRef entity,
                               CollectionWindow window,
                               DetailLevel detail,
                               SourceReader reader,
                               RecordNormalizer normalizer,
                               BatchIngestionClient ingestion,
                               Queue<EntityFailure> failures,
                               AtomicInteger collected) {
        long records = 0;
        runningWorkers.incrementAndGet();
        try (Source<RawRecord> source = reader.read(entity, window, detail)) {
            while (true) {
                if (Thread.currentThread().isInterrupted()) throw new InterruptedException("abandoned");
                Optional<RawRecord> raw = source.poll();
                if (raw.isEmpty()) break;
                for (NormalizedRecord r : normalizer.apply(raw.get())) {
                    ingestion.submit(r);
                    records++;
                }
            }
            collected.incrementAndGet();
            metrics.counter("records.normalized").inc(records);
            log.debug("Collected {} records from {}", records, entity);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Collection of {} interrupted after {} records", entity, records);
        } catch (Exception e) {
            metrics.counter("entities.failed").inc();
            failures.add(EntityFailure.of(entity, e));
            if (e instanceof CollectorException) {
                log.warn("Collection of {} failed after {} records: {}", entity, records, e.toString());
            } else {
                log.warn("Collection of {} failed after {} records", entity, records, e);
            }
        } finally {
            runningWorkers.decrementAndGet();
        }
    }

    private RunResult summarize(CollectionWindow window,
                                BatchIngestionClient ingestion,
                                Map<EntityKind, String> skippedKinds,
                                List<EntityFailure> failures,
                                int collected,
                                boolean deadlineExceeded,
                                int workersStillRunning,
                                Instant startedAt) {
        Map<String, StreamResult> streams = new LinkedHashMap<>();
        boolean anyFailed = false;
        for (String stream : config.streams()) {
            BatchIngestionClient.DeliveryStats stats = ingestion.stats(stream);
            EntityKind feeding = StreamSchemas.kindOf(stream).map(k -> SourceFamily.of(k).entityKind()).orElse(null);
            List<String> skippedEntities = new ArrayList<>();
            List<String> errors = new ArrayList<>(stats.errors());
            for (EntityFailure f : failures) {
                if (f.kind() == feeding) {
                    skippedEntities.add(f.entity());
                    errors.add(f.entity() + ": " + f.error() + ": " + f.message());
                }
            }
            if (feeding != null && skippedKinds.containsKey(feeding)) {
                errors.add(feeding + " skipped: " + skippedKinds.get(feeding));
            }
            anyFailed |= stats.failed() > 0;
            streams.put(stream, new StreamResult(stream, stats.sent(), stats.failed(), skippedEntities, errors));
        }
        RunStatus status = anyFailed || !failures.isEmpty() || deadlineExceeded ? RunStatus.PARTIALLY_FAILED : RunStatus.COMPLETED;
        return new RunResult(status, window, streams, skippedKinds, failures, collected, deadlineExceeded,
                workersStillRunning, startedAt, clock.instant());
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "collector-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
