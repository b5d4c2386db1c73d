package io.fabricla.collector.http;

import com.codahale.metrics.Timer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabricla.budget.Budget;
import io.fabricla.collector.auth.BearerToken;
import io.fabricla.collector.auth.TokenSession;
import io.fabricla.collector.error.AuthException;
import io.fabricla.collector.error.CollectorException;
import io.fabricla.collector.error.SourceApiException;
import io.fabricla.collector.error.ThrottledException;
import io.fabricla.collector.error.TransientHttpException;
import io.fabricla.metrics.Metrics;
import io.fabricla.retry.RetryPolicy;
import io.fabricla.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Authenticated JSON GET against one REST API (Fabric or Power BI), shared by discovery and the source readers.
 *
 * <ul>
 *   <li>429: waits for the server's Retry-After (or the default) and repeats the same request, up to
 *       {@code throttleMaxAttempts} requests, then {@link ThrottledException}.</li>
 *   <li>5xx, 408 and connection errors: retried under the backoff policy, then {@link TransientHttpException}.</li>
 *   <li>401: one token refresh and retry, then {@link AuthException}.</li>
 *   <li>Other non-2xx: {@link SourceApiException} straight away.</li>
 * </ul>
 */
public class RestApiClient {
    private static final Logger log = LoggerFactory.getLogger(RestApiClient.class);
    public static final String USER_AGENT = "FabricLA-Connector/1.0.0";

    private final String name;
    private final HttpClient http;
    private final TokenSession tokens;
    private final RetryPolicy retryPolicy;
    private final Budget budget;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Duration timeout;
    private final int throttleMaxAttempts;
    private final Duration defaultRetryAfter;
    private final ObjectMapper mapper;
    private final Metrics metrics;
    private final Timer fetchTimer;

    public RestApiClient(String name,
                         HttpClient http,
                         TokenSession tokens,
                         RetryPolicy retryPolicy,
                         Budget budget,
                         Sleeper sleeper,
                         Clock clock,
                         Duration timeout,
                         int throttleMaxAttempts,
                         Duration defaultRetryAfter,
                         ObjectMapper mapper,
                         Metrics metrics) {
        this.name = name;
        this.http = Objects.requireNonNull(http);
        this.tokens = Objects.requireNonNull(tokens);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.budget = budget == null ? Budget.UNLIMITED : budget;
        this.sleeper = Objects.requireNonNull(sleeper);
        this.clock = Objects.requireNonNull(clock);
        this.timeout = timeout == null ? Duration.ofSeconds(60) : timeout;
        this.throttleMaxAttempts = Math.max(1, throttleMaxAttempts);
        this.defaultRetryAfter = defaultRetryAfter == null ? Duration.ofSeconds(30) : defaultRetryAfter;
        this.mapper = Objects.requireNonNull(mapper);
        this.metrics = metrics.scoped("api." + name);
        this.fetchTimer = this.metrics.timer("get.time");
    }

    public String name() { return name; }

    public JsonNode get(URI uri) throws CollectorException, InterruptedException {
        int throttled = 0;
        int failures = 0;
        boolean refreshed = false;
        while (true) {
            budget.acquireExternalOp();
            BearerToken token = tokens.current();
            HttpRequest req = HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("Authorization", token.header())
                    .header("Accept", "application/json")
                    .header("User-Agent", USER_AGENT)
                    .GET()
                    .build();
            HttpResponse<String> resp;
            try (Timer.Context ignored = fetchTimer.time()) {
                resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                failures++;
                TransientHttpException te = new TransientHttpException("GET " + uri + " failed: " + e, e);
                if (!retryPolicy.shouldRetry(failures, te)) throw te;
                backoff(uri, failures, te);
                continue;
            }

            int status = resp.statusCode();
            if (status >= 200 && status < 300) {
                metrics.counter("get.ok").inc();
                return parse(uri, status, resp.body());
            }
            if (status == 429) {
                throttled++;
                metrics.counter("get.throttled").inc();
                if (throttled >= throttleMaxAttempts) throw new ThrottledException(uri, throttled);
                Duration wait = RetryAfter.from(resp.headers(), clock).orElse(defaultRetryAfter);
                log.warn("{} throttled on {} (attempt {}/{}), waiting {} ms", name, uri.getPath(), throttled, throttleMaxAttempts, wait.toMillis());
                sleeper.sleep(wait);
                continue;
            }
            if (status == 401) {
                if (refreshed) throw new AuthException("GET " + uri + " still unauthorized after token refresh");
                refreshed = true;
                tokens.refresh(token);
                continue;
            }
            if (status >= 500 || status == 408) {
                failures++;
                TransientHttpException te = new TransientHttpException("GET " + uri + " failed: HTTP " + status, status,
                        RetryAfter.from(resp.headers(), clock).orElse(null));
                if (!retryPolicy.shouldRetry(failures, te)) throw te;
                backoff(uri, failures, te);
                continue;
            }
            throw new SourceApiException(uri, status, abbreviate(resp.body()));
        }
    }

    private void backoff(URI uri, int attempt, TransientHttpException e) throws InterruptedException {
        long millis = retryPolicy.backoffMillis(attempt);
        if (e.retryAfter().isPresent()) millis = Math.max(millis, e.retryAfter().get().toMillis());
        metrics.counter("get.retries").inc();
        log.warn("{} retrying {} after {} ms (attempt {}): {}", name, uri.getPath(), millis, attempt, e.getMessage());
        sleeper.sleep(Duration.ofMillis(millis));
    }

    private JsonNode parse(URI uri, int status, String body) throws SourceApiException {
        if (body == null || body.isBlank()) return mapper.createObjectNode();
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SourceApiException(uri, status, "response is not JSON: " + e.getOriginalMessage());
        }
    }

    static String abbreviate(String body) {
        if (body == null) return "";
        String s = body.strip();
        return s.length() <= 300 ? s : s.substring(0, 300) + "...";
    }
}
