package io.fabricla.collector;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.fabricla.collector.auth.CredentialProvider;
import io.fabricla.collector.auth.StaticCredentialProvider;
import io.fabricla.collector.config.CollectorConfig;
import io.fabricla.collector.config.Settings;
import io.fabricla.collector.model.NormalizedRecord;
import io.fabricla.collector.runtime.CollectionOrchestrator;
import io.fabricla.error.DeadLetterSink;
import io.fabricla.error.FileDeadLetterSink;
import io.fabricla.retry.Sleeper;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public class CollectorModule extends AbstractModule {
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final CollectorConfig config;
    private final Settings settings;

    public CollectorModule(CollectorConfig config, Settings settings) {
        this.config = config;
        this.settings = settings;
    }

    @Override
    protected void configure() {
        bind(CollectorConfig.class).toInstance(config);
        bind(Settings.class).toInstance(settings);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Clock clock() { return Clock.systemUTC(); }

    @Provides @Singleton Sleeper sleeper() { return Sleeper.SYSTEM; }

    @Provides @Singleton HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(Math.min(30, config.httpTimeout().toSeconds())))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Provides @Singleton CredentialProvider credentialProvider() {
        return StaticCredentialProvider.fromSettings(settings, config.scopes());
    }

    @Provides @Singleton DeadLetterSink<NormalizedRecord> deadLetters(Clock clock) throws IOException {
        if (config.deadLetterDir() == null) return DeadLetterSink.none();
        return new FileDeadLetterSink<>(config.deadLetterDir().resolve("ingest-" + FILE_STAMP.format(clock.instant()) + ".jsonl"));
    }

    @Provides CollectionOrchestrator orchestrator(HttpClient http, CredentialProvider credentials, MetricRegistry registry,
                                                  Sleeper sleeper, Clock clock, DeadLetterSink<NormalizedRecord> deadLetters) {
        return new CollectionOrchestrator(config, http, credentials, registry, sleeper, clock, deadLetters);
    }
}
