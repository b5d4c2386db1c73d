package io.fabricla.collector.testing;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fabricla.collector.auth.StaticCredentialProvider;
import io.fabricla.collector.auth.TokenSession;
import io.fabricla.collector.http.RestApiClient;
import io.fabricla.core.Json;
import io.fabricla.metrics.Metrics;
import io.fabricla.retry.ExponentialBackoffRetryPolicy;
import io.fabricla.retry.Sleeper;
import io.fabricla.budget.Budget;
import io.fabricla.collector.error.TransientHttpException;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/** Shared builders for collector tests. */
public final class Fixtures {
    private Fixtures() {}

    /** Records requested waits instead of sleeping. */
    public static final class RecordingSleeper implements Sleeper {
        public final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    /** A local URL nothing listens on, so connecting fails straight away. */
    public static String closedBaseUrl() throws IOException {
        int port;
        try (ServerSocket s = new ServerSocket(0)) {
            port = s.getLocalPort();
        }
        return "http://127.0.0.1:" + port;
    }

    public static TokenSession session(String token) throws Exception {
        return TokenSession.open(StaticCredentialProvider.of(token), "scope", Clock.systemUTC());
    }

    public static RestApiClient client(TokenSession tokens, Sleeper sleeper, int maxAttempts, int throttleMaxAttempts) {
        return new RestApiClient("test", java.net.http.HttpClient.newHttpClient(), tokens,
                new ExponentialBackoffRetryPolicy(maxAttempts, 10, 2.0, 100, 0.0, e -> e instanceof TransientHttpException, new Random(1)),
                Budget.UNLIMITED, sleeper, Clock.systemUTC(), Duration.ofSeconds(5), throttleMaxAttempts,
                Duration.ofMillis(250), Json.mapper(), new Metrics(new MetricRegistry()));
    }

    /** A job-instances page of {@code count} runs starting at {@code firstId}, all inside the given hour. */
    public static String runsPage(int firstId, int count, Instant start, String continuationUri) {
        ObjectNode root = Json.mapper().createObjectNode();
        ArrayNode value = root.putArray("value");
        for (int i = 0; i < count; i++) {
            ObjectNode run = value.addObject();
            run.put("id", "run-" + (firstId + i));
            run.put("itemId", "pipe-1");
            run.put("jobType", "Pipeline");
            run.put("invokeType", "Scheduled");
            run.put("status", "Completed");
            run.put("startTimeUtc", start.plusSeconds(i).toString());
            run.put("endTimeUtc", start.plusSeconds(i + 30).toString());
        }
        if (continuationUri != null) root.put("continuationUri", continuationUri);
        return root.toString();
    }

    public static String idsPage(String continuationUri, String... ids) {
        ObjectNode root = Json.mapper().createObjectNode();
        ArrayNode value = root.putArray("value");
        for (String id : ids) value.addObject().put("id", id).put("displayName", "name-" + id);
        if (continuationUri != null) root.put("continuationUri", continuationUri);
        return root.toString();
    }
}
