package io.fabricla.collector.config;

import io.fabricla.collector.error.ConfigException;
import io.fabricla.collector.model.CollectionMode;
import io.fabricla.collector.model.CollectionWindow;
import io.fabricla.collector.model.DetailLevel;
import io.fabricla.collector.model.EntityKind;
import io.fabricla.collector.model.EntityRef;
import io.fabricla.collector.model.Scope;
import io.fabricla.collector.model.SourceKind;
import io.fabricla.collector.model.StreamSchemas;
import io.fabricla.collector.source.SourceApi;
import io.fabricla.collector.source.SourceFamily;
import io.fabricla.retry.ExponentialBackoffRetryPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Everything one collection run needs to know. Build with {@link #from(Settings)}, then {@link #validate()}.
 *
 * @param entities    kinds narrowed to explicit ids; kinds not listed are collected in full
 * @param lookback    window length, or null for the mode's default
 * @param detail      detail level, or null for the mode's default
 * @param runDeadline external deadline for the whole run, or null for none
 * @param deadLetterDir where failed batches are written, or null to drop them after counting
 */
public record CollectorConfig(
        List<String> streams,
        Map<EntityKind, Scope> entities,
        CollectionMode mode,
        Duration lookback,
        DetailLevel detail,
        int workers,
        BatchLimits batch,
        RetrySettings retry,
        int throttleMaxAttempts,
        Duration throttleDefaultRetryAfter,
        int sourceMaxPages,
        int sourceMaxDetailPages,
        double sourceQps,
        Duration httpTimeout,
        String fabricApiBase,
        String powerBiApiBase,
        Ingestion ingestion,
        AuthScopes scopes,
        Duration runDeadline,
        Path deadLetterDir
) {
    public static final String DEFAULT_FABRIC_API = "https://api.fabric.microsoft.com/v1";
    public static final String DEFAULT_POWERBI_API = "https://api.powerbi.com/v1.0/myorg";
    public static final Duration MAX_LOOKBACK = Duration.ofDays(366);

    public CollectorConfig {
        streams = List.copyOf(streams);
        entities = entities.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(entities));
    }

    public record BatchLimits(int maxRecords, long maxBytes) {
        public static final BatchLimits DEFAULT = new BatchLimits(500, 1_000_000);
    }

    /** Backoff shared by source reads, discovery and ingestion. */
    public record RetrySettings(long baseDelayMs, double multiplier, long maxDelayMs, int maxAttempts, double jitter) {
        public static final RetrySettings DEFAULT = new RetrySettings(1000, 2.0, 60_000, 5, 0.2);

        public ExponentialBackoffRetryPolicy policy(Predicate<Exception> retryable) {
            return new ExponentialBackoffRetryPolicy(maxAttempts, baseDelayMs, multiplier, maxDelayMs, jitter, retryable, new Random());
        }
    }

    public record Ingestion(String endpoint, String dcrId, String apiVersion) {}

    public record AuthScopes(String fabric, String powerBi, String ingestion) {
        public static final AuthScopes DEFAULT = new AuthScopes(
                "https://api.fabric.microsoft.com/.default",
                "https://analysis.windows.net/powerbi/api/.default",
                "https://monitor.azure.com/.default");

        public String forApi(SourceApi api) { return api == SourceApi.FABRIC ? fabric : powerBi; }
    }

    public static CollectorConfig load(Path path) throws ConfigException {
        return from(Settings.load(path));
    }

    public static CollectorConfig from(Settings s) throws ConfigException {
        List<String> streams = list(s.get("streams", ""));
        Map<EntityKind, Scope> entities = new EnumMap<>(EntityKind.class);
        for (EntityKind k : EntityKind.values()) {
            Optional<String> v = s.get("entities." + k.name().toLowerCase(Locale.ROOT));
            if (v.isEmpty()) continue;
            String t = v.get().trim();
            if (t.equals("*") || t.equalsIgnoreCase("all")) continue;
            List<String> ids = list(t);
            if (!ids.isEmpty()) entities.put(k, Scope.explicit(ids));
        }
        CollectionMode mode;
        DetailLevel detail = null;
        try {
            mode = CollectionMode.parse(s.get("window.mode", "incremental"));
            Optional<String> d = s.get("detail.level");
            if (d.isPresent()) detail = DetailLevel.parse(d.get());
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid window.mode or detail.level: " + e.getMessage(), e);
        }
        long lookbackMinutes = s.getLong("window.lookback.minutes", -1);
        Duration lookback;
        try {
            lookback = lookbackMinutes == -1 ? null : Duration.ofMinutes(lookbackMinutes);
        } catch (ArithmeticException e) {
            throw new ConfigException("window.lookback.minutes is out of range: " + lookbackMinutes, e);
        }
        long deadline = s.getLong("run.deadline.seconds", 0);

        return new CollectorConfig(
                streams,
                entities,
                mode,
                lookback,
                detail,
                s.getInt("workers", 4),
                new BatchLimits(s.getInt("batch.max.records", BatchLimits.DEFAULT.maxRecords()),
                        s.getLong("batch.max.bytes", BatchLimits.DEFAULT.maxBytes())),
                new RetrySettings(
                        s.getLong("retry.base.delay.ms", RetrySettings.DEFAULT.baseDelayMs()),
                        s.getDouble("retry.multiplier", RetrySettings.DEFAULT.multiplier()),
                        s.getLong("retry.max.delay.ms", RetrySettings.DEFAULT.maxDelayMs()),
                        s.getInt("retry.max.attempts", RetrySettings.DEFAULT.maxAttempts()),
                        s.getDouble("retry.jitter", RetrySettings.DEFAULT.jitter())),
                s.getInt("throttle.max.attempts", 5),
                Duration.ofMillis(s.getLong("throttle.default.retry.after.ms", 30_000)),
                s.getInt("source.max.pages", 1000),
                s.getInt("source.max.detail.pages", 20_000),
                s.getDouble("source.qps", 0),
                Duration.ofSeconds(s.getLong("http.timeout.seconds", 60)),
                s.get("fabric.api.base", DEFAULT_FABRIC_API),
                s.get("powerbi.api.base", DEFAULT_POWERBI_API),
                new Ingestion(s.get("ingestion.endpoint", null), s.get("ingestion.dcr.id", null),
                        s.get("ingestion.api.version", "2023-01-01")),
                new AuthScopes(
                        s.get("auth.fabric.scope", AuthScopes.DEFAULT.fabric()),
                        s.get("auth.powerbi.scope", AuthScopes.DEFAULT.powerBi()),
                        s.get("auth.ingestion.scope", AuthScopes.DEFAULT.ingestion())),
                deadline <= 0 ? null : Duration.ofSeconds(deadline),
                s.get("deadletter.dir").map(Path::of).orElse(null));
    }

    /** Rejects anything that would make the run fail later for a reason known now. */
    public CollectorConfig validate() throws ConfigException {
        List<String> problems = new ArrayList<>();
        if (streams.isEmpty()) problems.add("streams must name at least one stream");
        for (String st : streams) {
            if (StreamSchemas.forStream(st).isEmpty()) problems.add("unknown stream " + st);
        }
        if (workers < 1) problems.add("workers must be >= 1");
        if (batch.maxRecords() < 1) problems.add("batch.max.records must be >= 1");
        if (batch.maxBytes() < 3) problems.add("batch.max.bytes must be >= 3");
        if (retry.maxAttempts() < 1) problems.add("retry.max.attempts must be >= 1");
        if (retry.baseDelayMs() < 0 || retry.maxDelayMs() < 0) problems.add("retry delays must not be negative");
        if (retry.multiplier() < 1.0) problems.add("retry.multiplier must be >= 1");
        if (retry.jitter() < 0 || retry.jitter() > 1) problems.add("retry.jitter must be within [0, 1]");
        if (throttleMaxAttempts < 1) problems.add("throttle.max.attempts must be >= 1");
        if (sourceMaxPages < 1) problems.add("source.max.pages must be >= 1");
        if (sourceMaxDetailPages < 1) problems.add("source.max.detail.pages must be >= 1");
        if (sourceQps < 0) problems.add("source.qps must not be negative");
        if (httpTimeout.isZero() || httpTimeout.isNegative()) problems.add("http.timeout.seconds must be > 0");
        if (lookback != null && (lookback.isZero() || lookback.isNegative())) problems.add("window.lookback.minutes must be > 0");
        if (lookback != null && lookback.compareTo(MAX_LOOKBACK) > 0) {
            problems.add("window.lookback.minutes must be at most " + MAX_LOOKBACK.toMinutes());
        }
        if (blank(ingestion.endpoint())) problems.add("ingestion.endpoint is required");
        if (blank(ingestion.dcrId())) problems.add("ingestion.dcr.id is required");
        for (Map.Entry<EntityKind, Scope> e : entities.entrySet()) {
            if (e.getValue() instanceof Scope.Explicit ex) {
                for (String id : ex.ids()) {
                    try {
                        EntityRef.parse(e.getKey(), id);
                    } catch (IllegalArgumentException iae) {
                        problems.add(iae.getMessage());
                    }
                }
            }
        }
        if (!problems.isEmpty()) throw new ConfigException("Invalid configuration: " + String.join("; ", problems));
        return this;
    }

    public DetailLevel effectiveDetail() { return detail != null ? detail : mode.defaultDetail(); }

    public CollectionWindow window(Instant now) { return CollectionWindow.endingAt(now, mode, lookback); }

    public Scope scope(EntityKind kind) { return entities.getOrDefault(kind, Scope.all()); }

    public Set<SourceKind> sourceKinds() {
        Set<SourceKind> out = EnumSet.noneOf(SourceKind.class);
        for (String st : streams) StreamSchemas.kindOf(st).ifPresent(out::add);
        return out;
    }

    /** Entity kinds whose records feed a configured stream, in discovery order. */
    public Set<EntityKind> collectedKinds() {
        Set<EntityKind> out = new LinkedHashSet<>();
        for (EntityKind k : EntityKind.values()) {
            for (SourceKind sk : sourceKinds()) {
                if (SourceFamily.of(sk).entityKind() == k) out.add(k);
            }
        }
        return out;
    }

    /** APIs the collected kinds are read from. Discovery always uses Fabric. */
    public Set<SourceApi> requiredApis() {
        Set<SourceApi> out = EnumSet.of(SourceApi.FABRIC);
        for (SourceKind sk : sourceKinds()) out.add(SourceFamily.of(sk).api());
        return out;
    }

    public CollectorConfig withOverrides(CollectionMode mode, Duration lookback, DetailLevel detail, Integer workers,
                                         List<String> streams, Duration runDeadline) {
        return new CollectorConfig(
                streams == null || streams.isEmpty() ? this.streams : streams,
                entities,
                mode == null ? this.mode : mode,
                lookback == null ? this.lookback : lookback,
                detail == null ? this.detail : detail,
                workers == null ? this.workers : workers,
                batch, retry, throttleMaxAttempts, throttleDefaultRetryAfter, sourceMaxPages, sourceMaxDetailPages, sourceQps,
                httpTimeout,
                fabricApiBase, powerBiApiBase, ingestion, scopes,
                runDeadline == null ? this.runDeadline : runDeadline,
                deadLetterDir);
    }

    private static List<String> list(String csv) {
        List<String> out = new ArrayList<>();
        for (String p : Arrays.asList(csv.split(","))) {
            String t = p.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static boolean blank(String s) { return s == null || s.isBlank(); }
}
