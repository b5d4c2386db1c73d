package io.fabricla.collector.runtime;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import io.fabricla.collector.auth.CredentialProvider;
import io.fabricla.collector.auth.StaticCredentialProvider;
import io.fabricla.collector.config.CollectorConfig;
import io.fabricla.collector.config.Settings;
import io.fabricla.collector.error.AuthException;
import io.fabricla.collector.error.ConfigException;
import io.fabricla.collector.error.DiscoveryException;
import io.fabricla.collector.model.EntityFailure;
import io.fabricla.collector.model.EntityKind;
import io.fabricla.collector.model.EntityRef;
import io.fabricla.collector.model.NormalizedRecord;
import io.fabricla.collector.model.RunResult;
import io.fabricla.collector.model.RunStatus;
import io.fabricla.collector.model.StreamResult;
import io.fabricla.collector.model.StreamSchemas;
import io.fabricla.collector.testing.Fixtures;
import io.fabricla.collector.testing.StubHttpServer;
import io.fabricla.collector.testing.StubHttpServer.Response;
import io.fabricla.core.Json;
import io.fabricla.error.DeadLetterSink;
import io.fabricla.retry.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class CollectionOrchestratorTest {
    static final String RUNS_1 = "/v1/workspaces/ws-1/items/pipe-1/jobs/instances";
    static final String RUNS_2 = "/v1/workspaces/ws-1/items/pipe-2/jobs/instances";
    static final String INGEST_RUNS = "/dataCollectionRules/dcr-1/streams/" + StreamSchemas.PIPELINE_RUNS;
    static final String INGEST_ACTIVITIES = "/dataCollectionRules/dcr-1/streams/" + StreamSchemas.ACTIVITY_RUNS;

    StubHttpServer server;
    Fixtures.RecordingSleeper sleeper;
    List<String> deadLettered;
    Instant inWindow;

    @BeforeEach
    void start() throws Exception {
        server = new StubHttpServer();
        sleeper = new Fixtures.RecordingSleeper();
        deadLettered = Collections.synchronizedList(new ArrayList<>());
        inWindow = Instant.now().minusSeconds(3600);
        server.enqueue(INGEST_RUNS, Response.status(204));
        server.enqueue(INGEST_ACTIVITIES, Response.status(204));
    }

    @AfterEach
    void stop() { server.close(); }

    String base() { return server.baseUrl() + "/v1"; }

    Settings settings(String... kv) {
        Properties p = new Properties();
        p.setProperty("fabric.api.base", base());
        p.setProperty("powerbi.api.base", base());
        p.setProperty("ingestion.endpoint", server.baseUrl());
        p.setProperty("ingestion.dcr.id", "dcr-1");
        p.setProperty("window.mode", "incremental");
        p.setProperty("window.lookback.minutes", "1200");
        p.setProperty("detail.level", "summary");
        p.setProperty("retry.base.delay.ms", "1");
        p.setProperty("retry.max.attempts", "2");
        p.setProperty("streams", StreamSchemas.PIPELINE_RUNS);
        for (int i = 0; i < kv.length; i += 2) p.setProperty(kv[i], kv[i + 1]);
        return new Settings(p, new Properties(), Map.of());
    }

    CollectionOrchestrator orchestrator(Settings s, CredentialProvider credentials) throws Exception {
        DeadLetterSink<NormalizedRecord> dlq = (stage, channel, records, e) -> deadLettered.add(stage + ":" + channel + ":" + records.size());
        return new CollectionOrchestrator(CollectorConfig.from(s), HttpClient.newHttpClient(), credentials,
                new MetricRegistry(), sleeper, Clock.systemUTC(), dlq);
    }

    RunResult run(String... kv) throws Exception {
        return orchestrator(settings(kv), StaticCredentialProvider.of("tok")).run();
    }

    @Test
    void collects_three_pages_and_delivers_them_in_one_post() throws Exception {
        server.enqueue(RUNS_1,
                Response.json(Fixtures.runsPage(0, 100, inWindow, base() + "/workspaces/ws-1/items/pipe-1/jobs/instances?page=2")),
                Response.json(Fixtures.runsPage(100, 100, inWindow, base() + "/workspaces/ws-1/items/pipe-1/jobs/instances?page=3")),
                Response.json(Fixtures.runsPage(200, 40, inWindow, null)));

        RunResult result = run("entities.pipeline", "ws-1/pipe-1");

        assertEquals(RunStatus.COMPLETED, result.status());
        StreamResult runs = result.stream(StreamSchemas.PIPELINE_RUNS);
        assertEquals(240, runs.sent());
        assertEquals(0, runs.failed());
        assertEquals(1, result.entitiesCollected());
        assertFalse(result.deadlineExceeded());

        List<StubHttpServer.Request> posts = server.requests(INGEST_RUNS);
        assertEquals(1, posts.size());
        assertEquals("Bearer tok", posts.get(0).header("Authorization"));
        JsonNode body = Json.mapper().readTree(posts.get(0).body());
        assertEquals(240, body.size());
        assertEquals("run-0", body.get(0).path("RunId").asText());
        assertEquals(3, server.requests(RUNS_1).size());
    }

    @Test
    void discovers_workspaces_across_pages_and_collects_their_pipelines() throws Exception {
        server.enqueue("/v1/workspaces",
                Response.json(Fixtures.idsPage(base() + "/workspaces?continuationToken=abc", "A")),
                Response.json(Fixtures.idsPage(null, "B")));
        server.enqueue("/v1/workspaces/A/items", Response.json(Fixtures.idsPage(null, "pA")));
        server.enqueue("/v1/workspaces/B/items", Response.json(Fixtures.idsPage(null, "pB")));
        server.enqueue("/v1/workspaces/A/items/pA/jobs/instances", Response.json(Fixtures.runsPage(0, 3, inWindow, null)));
        server.enqueue("/v1/workspaces/B/items/pB/jobs/instances", Response.json(Fixtures.runsPage(10, 2, inWindow, null)));

        RunResult result = run();

        assertEquals(RunStatus.COMPLETED, result.status());
        assertEquals(2, result.entitiesCollected());
        assertEquals(5, result.stream(StreamSchemas.PIPELINE_RUNS).sent());
        assertEquals(2, server.requests("/v1/workspaces").size());
        assertEquals(1, server.requests("/v1/workspaces/A/items").size());
        assertEquals(1, server.requests("/v1/workspaces/B/items").size());
        assertTrue(server.requests("/v1/workspaces/A/items").get(0).query().contains("type=DataPipeline"));
    }

    @Test
    void entity_with_no_records_completes_without_posting() throws Exception {
        server.enqueue(RUNS_1, Response.json("{\"value\":[]}"));

        RunResult result = run("entities.pipeline", "ws-1/pipe-1");

        assertEquals(RunStatus.COMPLETED, result.status());
        assertEquals(0, result.stream(StreamSchemas.PIPELINE_RUNS).sent());
        assertEquals(0, result.stream(StreamSchemas.PIPELINE_RUNS).failed());
        assertTrue(server.requests(INGEST_RUNS).isEmpty());
    }

    @Test
    void failing_entity_does_not_stop_the_others() throws Exception {
        server.enqueue(RUNS_1, Response.status(403, "{\"error\":\"forbidden\"}"));
        server.enqueue(RUNS_2, Response.json(Fixtures.runsPage(0, 5, inWindow, null)));

        RunResult result = run("entities.pipeline", "ws-1/pipe-1,ws-1/pipe-2");

        assertEquals(RunStatus.PARTIALLY_FAILED, result.status());
        StreamResult runs = result.stream(StreamSchemas.PIPELINE_RUNS);
        assertEquals(5, runs.sent());
        assertEquals(0, runs.failed());
        String failed = EntityRef.child(EntityKind.PIPELINE, "ws-1", "pipe-1").toString();
        assertEquals(List.of(failed), runs.skippedEntities());
        EntityFailure f = result.entityFailures().get(0);
        assertEquals("SourceApiException", f.error());
        assertEquals(1, result.entitiesCollected());
    }

    @Test
    void full_detail_fetches_activity_runs_after_each_run() throws Exception {
        server.enqueue(RUNS_1, Response.json(Fixtures.runsPage(0, 2, inWindow, null)));
        server.enqueue(RUNS_1 + "/run-0/activityruns", Response.json(
                "{\"value\":[{\"activityRunId\":\"a0\",\"activityName\":\"Copy\",\"status\":\"Succeeded\"}]}"));
        server.enqueue(RUNS_1 + "/run-1/activityruns", Response.json(
                "{\"value\":[{\"activityRunId\":\"b0\"},{\"activityRunId\":\"b1\"}]}"));

        RunResult result = run("entities.pipeline", "ws-1/pipe-1",
                "streams", StreamSchemas.PIPELINE_RUNS + "," + StreamSchemas.ACTIVITY_RUNS,
                "detail.level", "full");

        assertEquals(RunStatus.COMPLETED, result.status());
        assertEquals(2, result.stream(StreamSchemas.PIPELINE_RUNS).sent());
        assertEquals(3, result.stream(StreamSchemas.ACTIVITY_RUNS).sent());
        JsonNode activities = Json.mapper().readTree(server.requests(INGEST_ACTIVITIES).get(0).body());
        assertEquals("run-0", activities.get(0).path("RunId").asText());
    }

    @Test
    void rejected_batch_is_counted_failed_and_dead_lettered() throws Exception {
        server.handle(INGEST_RUNS, r -> Response.status(400, "{\"error\":\"bad schema\"}"));
        server.enqueue(RUNS_1, Response.json(Fixtures.runsPage(0, 12, inWindow, null)));

        RunResult result = run("entities.pipeline", "ws-1/pipe-1");

        assertEquals(RunStatus.PARTIALLY_FAILED, result.status());
        StreamResult runs = result.stream(StreamSchemas.PIPELINE_RUNS);
        assertEquals(0, runs.sent());
        assertEquals(12, runs.failed());
        assertFalse(runs.errors().isEmpty());
        assertEquals(List.of("ingest:" + StreamSchemas.PIPELINE_RUNS + ":12"), deadLettered);
    }

    @Test
    void invalid_configuration_fails_before_any_request() {
        assertThrows(ConfigException.class, () -> run("streams", "", "entities.pipeline", "ws-1/pipe-1"));
        assertThrows(ConfigException.class, () -> run("workers", "0"));
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void missing_credentials_abort_the_run() throws Exception {
        CredentialProvider none = scope -> {
            throw new AuthException("no credential for " + scope);
        };
        CollectionOrchestrator o = orchestrator(settings("entities.pipeline", "ws-1/pipe-1"), none);
        assertThrows(AuthException.class, o::run);
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void run_fails_when_no_kind_can_be_discovered() {
        server.enqueue("/v1/workspaces", Response.status(500));

        DiscoveryException e = assertThrows(DiscoveryException.class, this::run);
        assertTrue(e.getMessage().contains("No configured entity kind"), e.getMessage());
        assertTrue(server.requests(INGEST_RUNS).isEmpty());
    }

    @Test
    void undiscoverable_kind_is_skipped_while_others_are_collected() throws Exception {
        server.enqueue("/v1/capacities", Response.status(500));
        server.enqueue(RUNS_1, Response.json(Fixtures.runsPage(0, 4, inWindow, null)));

        RunResult result = run("entities.pipeline", "ws-1/pipe-1",
                "streams", StreamSchemas.PIPELINE_RUNS + "," + StreamSchemas.CAPACITY_METRICS);

        assertEquals(Set.of(EntityKind.CAPACITY), result.skippedKinds().keySet());
        assertEquals(4, result.stream(StreamSchemas.PIPELINE_RUNS).sent());
        assertEquals(0, result.stream(StreamSchemas.CAPACITY_METRICS).sent());
        assertTrue(result.stream(StreamSchemas.CAPACITY_METRICS).errors().get(0).startsWith("CAPACITY skipped"));
    }

    @Test
    void deadline_abandons_slow_entities() throws Exception {
        server.handle(RUNS_1, r -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Response.json(Fixtures.runsPage(0, 1, inWindow, null));
        });

        CollectionOrchestrator o = orchestrator(settings("entities.pipeline", "ws-1/pipe-1",
                "run.deadline.seconds", "1", "http.timeout.seconds", "10"), StaticCredentialProvider.of("tok"));
        RunResult result = o.run();

        assertTrue(result.deadlineExceeded());
        assertEquals(RunStatus.PARTIALLY_FAILED, result.status());
        assertEquals(RunState.PARTIALLY_FAILED, o.state());
        assertEquals("DeadlineExceeded", result.entityFailures().get(0).error());
        assertEquals(0, result.stream(StreamSchemas.PIPELINE_RUNS).sent());
        assertEquals(0, result.workersStillRunning());
    }

    @Test
    void workers_that_ignore_cancellation_are_reported() throws Exception {
        server.handle(RUNS_1, r -> Response.status(503));
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch sleeping = new CountDownLatch(1);
        Sleeper stubborn = d -> {
            sleeping.countDown();
            boolean interrupted = false;
            while (release.getCount() > 0) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) Thread.currentThread().interrupt();
        };

        CollectionOrchestrator o = new CollectionOrchestrator(
                CollectorConfig.from(settings("entities.pipeline", "ws-1/pipe-1",
                        "run.deadline.seconds", "1", "http.timeout.seconds", "1")),
                HttpClient.newHttpClient(), StaticCredentialProvider.of("tok"), new MetricRegistry(), stubborn,
                Clock.systemUTC(), DeadLetterSink.none()).shutdownGrace(Duration.ZERO);
        try {
            RunResult result = o.run();

            assertTrue(sleeping.await(0, TimeUnit.SECONDS));
            assertTrue(result.deadlineExceeded());
            assertEquals(1, result.workersStillRunning());
            assertEquals(RunStatus.PARTIALLY_FAILED, result.status());
            assertEquals("DeadlineExceeded", result.entityFailures().get(0).error());
        } finally {
            release.countDown();
        }
    }

    @Test
    void out_of_range_lookback_is_a_config_error() {
        assertThrows(ConfigException.class,
                () -> run("entities.pipeline", "ws-1/pipe-1", "window.lookback.minutes", "1000000000000000"));
        assertTrue(server.requests().isEmpty());
    }
}
