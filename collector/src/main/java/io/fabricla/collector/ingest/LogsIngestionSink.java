package io.fabricla.collector.ingest;

import com.codahale.metrics.Timer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabricla.collector.auth.BearerToken;
import io.fabricla.collector.auth.TokenSession;
import io.fabricla.collector.error.AuthException;
import io.fabricla.collector.error.CollectorException;
import io.fabricla.collector.error.IngestionException;
import io.fabricla.collector.error.SchemaMismatchException;
import io.fabricla.collector.error.TokenExpiredException;
import io.fabricla.collector.error.TransientHttpException;
import io.fabricla.collector.http.RestApiClient;
import io.fabricla.collector.http.RetryAfter;
import io.fabricla.collector.http.Uris;
import io.fabricla.collector.model.NormalizedRecord;
import io.fabricla.core.BatchSink;
import io.fabricla.metrics.Metrics;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * One POST per batch to the Azure Monitor Logs Ingestion API. Makes a single attempt and reports the outcome as
 * an exception type; retrying and token refresh are the caller's job.
 */
public class LogsIngestionSink implements BatchSink<NormalizedRecord> {
    public static final String DEFAULT_API_VERSION = "2023-01-01";

    private final HttpClient http;
    private final String endpoint;
    private final String dcrId;
    private final String apiVersion;
    private final TokenSession tokens;
    private final Duration timeout;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Timer postTimer;

    public LogsIngestionSink(HttpClient http, String endpoint, String dcrId, String apiVersion, TokenSession tokens,
                             Duration timeout, ObjectMapper mapper, Clock clock, Metrics metrics) {
        this.http = http;
        this.endpoint = endpoint;
        this.dcrId = dcrId;
        this.apiVersion = apiVersion == null || apiVersion.isBlank() ? DEFAULT_API_VERSION : apiVersion;
        this.tokens = tokens;
        this.timeout = timeout;
        this.mapper = mapper;
        this.clock = clock;
        this.postTimer = metrics.timer("ingest.post.time");
    }

    public URI streamUri(String stream) {
        return URI.create(Uris.resolve(endpoint, "/dataCollectionRules/" + Uris.encode(dcrId) + "/streams/" + Uris.encode(stream))
                + "?api-version=" + Uris.encode(apiVersion));
    }

    @Override
    public void acceptBatch(String stream, List<NormalizedRecord> records) throws CollectorException, InterruptedException {
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(records);
        } catch (JsonProcessingException e) {
            throw new IngestionException("Could not serialize batch for " + stream + ": " + e.getOriginalMessage(), 0);
        }
        BearerToken token = tokens.current();
        HttpRequest req = HttpRequest.newBuilder(streamUri(stream))
                .timeout(timeout)
                .header("Authorization", token.header())
                .header("Content-Type", "application/json")
                .header("User-Agent", RestApiClient.USER_AGENT)
                .header("x-ms-stream-name", stream)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        HttpResponse<String> resp;
        try (Timer.Context ignored = postTimer.time()) {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientHttpException("POST " + stream + " failed: " + e, e);
        }

        int status = resp.statusCode();
        if (status >= 200 && status < 300) return;
        String detail = abbreviate(resp.body());
        if (status == 400) throw new SchemaMismatchException("Stream " + stream + " rejected the batch: " + detail);
        if (status == 401) throw new TokenExpiredException("Ingestion token rejected for " + stream, token);
        if (status == 403) throw new AuthException("Not authorized to ingest into " + stream + ": " + detail);
        if (status == 429 || status >= 500 || status == 408) {
            throw new TransientHttpException("POST " + stream + " failed: HTTP " + status,
                    status, RetryAfter.from(resp.headers(), clock).orElse(null));
        }
        throw new IngestionException("POST " + stream + " failed: HTTP " + status + (detail.isEmpty() ? "" : " - " + detail), status);
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        String s = body.strip();
        return s.length() <= 300 ? s : s.substring(0, 300) + "...";
    }
}
