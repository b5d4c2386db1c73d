package io.fabricla.collector.ingest;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import io.fabricla.collector.error.AuthException;
import io.fabricla.collector.error.IngestionException;
import io.fabricla.collector.error.SchemaMismatchException;
import io.fabricla.collector.error.TokenExpiredException;
import io.fabricla.collector.error.TransientHttpException;
import io.fabricla.collector.model.NormalizedRecord;
import io.fabricla.collector.model.SourceKind;
import io.fabricla.collector.model.StreamSchemas;
import io.fabricla.collector.testing.Fixtures;
import io.fabricla.collector.testing.StubHttpServer;
import io.fabricla.collector.testing.StubHttpServer.Response;
import io.fabricla.core.Json;
import io.fabricla.metrics.Metrics;
import io.fabricla.retry.ExponentialBackoffRetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class LogsIngestionSinkTest {
    static final String PATH = "/dataCollectionRules/dcr-1/streams/" + StreamSchemas.PIPELINE_RUNS;

    StubHttpServer server;
    LogsIngestionSink sink;

    @BeforeEach
    void start() throws Exception {
        server = new StubHttpServer();
        sink = new LogsIngestionSink(HttpClient.newHttpClient(), server.baseUrl(), "dcr-1", null, Fixtures.session("ing-tok"),
                Duration.ofSeconds(5), Json.mapper(), Clock.systemUTC(), new Metrics(new MetricRegistry()));
    }

    @AfterEach
    void stop() { server.close(); }

    static NormalizedRecord run(String id) {
        return StreamSchemas.forKind(SourceKind.PIPELINE_RUN).newRecord()
                .set("RunId", id).set("TimeGenerated", Instant.parse("2024-05-01T10:00:00Z")).set("DurationMs", 12L).build();
    }

    @Test
    void posts_json_array_to_stream_endpoint() throws Exception {
        server.enqueue(PATH, Response.status(204));
        sink.acceptBatch(StreamSchemas.PIPELINE_RUNS, List.of(run("r1"), run("r2")));

        StubHttpServer.Request req = server.requests(PATH).get(0);
        assertEquals("POST", req.method());
        assertEquals("api-version=2023-01-01", req.query());
        assertEquals("Bearer ing-tok", req.header("Authorization"));
        assertEquals(StreamSchemas.PIPELINE_RUNS, req.header("x-ms-stream-name"));
        assertEquals("application/json", req.header("Content-Type"));
        JsonNode body = Json.mapper().readTree(req.body());
        assertEquals(2, body.size());
        assertEquals("r2", body.get(1).get("RunId").asText());
        assertEquals("2024-05-01T10:00:00Z", body.get(0).get("TimeGenerated").asText());
        assertTrue(body.get(0).has("FailureReason"));
        assertTrue(body.get(0).get("FailureReason").isNull());
    }

    @Test
    void statuses_map_onto_failure_kinds() {
        server.enqueue(PATH, Response.status(400, "{\"error\":{\"message\":\"Column DurationMs has wrong type\"}}"));
        SchemaMismatchException schema = assertThrows(SchemaMismatchException.class,
                () -> sink.acceptBatch(StreamSchemas.PIPELINE_RUNS, List.of(run("r"))));
        assertTrue(schema.getMessage().contains("DurationMs"));

        server.handle(PATH, req -> Response.status(401));
        TokenExpiredException expired = assertThrows(TokenExpiredException.class,
                () -> sink.acceptBatch(StreamSchemas.PIPELINE_RUNS, List.of(run("r"))));
        assertEquals("ing-tok", expired.staleToken().value());

        server.handle(PATH, req -> Response.status(403));
        assertThrows(AuthException.class, () -> sink.acceptBatch(StreamSchemas.PIPELINE_RUNS, List.of(run("r"))));

        server.handle(PATH, req -> Response.status(413));
        assertEquals(413, assertThrows(IngestionException.class,
                () -> sink.acceptBatch(StreamSchemas.PIPELINE_RUNS, List.of(run("r")))).status());

        server.handle(PATH, req -> Response.status(429).withHeader("Retry-After", "3"));
        TransientHttpException throttled = assertThrows(TransientHttpException.class,
                () -> sink.acceptBatch(StreamSchemas.PIPELINE_RUNS, List.of(run("r"))));
        assertEquals(Duration.ofSeconds(3), throttled.retryAfter().orElseThrow());

        server.handle(PATH, req -> Response.status(503));
        assertEquals(503, assertThrows(TransientHttpException.class,
                () -> sink.acceptBatch(StreamSchemas.PIPELINE_RUNS, List.of(run("r")))).status());
    }

    @Test
    void unreachable_endpoint_is_transient() throws Exception {
        LogsIngestionSink down = new LogsIngestionSink(HttpClient.newHttpClient(), Fixtures.closedBaseUrl(), "dcr-1", null,
                Fixtures.session("ing-tok"), Duration.ofSeconds(5), Json.mapper(), Clock.systemUTC(), new Metrics(new MetricRegistry()));

        TransientHttpException e = assertThrows(TransientHttpException.class,
                () -> down.acceptBatch(StreamSchemas.PIPELINE_RUNS, List.of(run("r"))));
        assertEquals(0, e.status());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void unreachable_endpoint_fails_the_batch_after_retries() throws Exception {
        LogsIngestionSink down = new LogsIngestionSink(HttpClient.newHttpClient(), Fixtures.closedBaseUrl(), "dcr-1", null,
                Fixtures.session("ing-tok"), Duration.ofSeconds(5), Json.mapper(), Clock.systemUTC(), new Metrics(new MetricRegistry()));
        Fixtures.RecordingSleeper sleeper = new Fixtures.RecordingSleeper();
        List<String> deadLettered = new ArrayList<>();
        BatchIngestionClient client = new BatchIngestionClient(down, null,
                new ExponentialBackoffRetryPolicy(3, 10, 2.0, 100, 0.0, e -> e instanceof TransientHttpException, new Random(1)),
                sleeper, 10, 1_000_000, (stage, channel, records, e) -> deadLettered.add(stage + ":" + records.size()),
                Json.mapper(), new Metrics(new MetricRegistry()));

        client.submit(run("r1"));
        client.submit(run("r2"));
        client.flushAll();

        BatchIngestionClient.DeliveryStats stats = client.stats(StreamSchemas.PIPELINE_RUNS);
        assertEquals(0, stats.sent());
        assertEquals(2, stats.failed());
        assertTrue(stats.errors().get(0).startsWith("TransientHttpException"), stats.errors().toString());
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), sleeper.sleeps);
        assertEquals(List.of("ingest:2"), deadLettered);
    }
}
