package io.fabricla.collector.ingest;

import com.codahale.metrics.Timer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabricla.collector.auth.TokenSession;
import io.fabricla.collector.error.AuthException;
import io.fabricla.collector.error.IngestionException;
import io.fabricla.collector.error.SchemaMismatchException;
import io.fabricla.collector.error.TokenExpiredException;
import io.fabricla.collector.error.TransientHttpException;
import io.fabricla.collector.model.NormalizedRecord;
import io.fabricla.collector.model.StreamSchema;
import io.fabricla.collector.model.StreamSchemas;
import io.fabricla.core.BatchSink;
import io.fabricla.error.DeadLetterSink;
import io.fabricla.metrics.Metrics;
import io.fabricla.retry.RetryPolicy;
import io.fabricla.retry.Sleeper;
import io.fabricla.runtime.BatchBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Buffers normalized records per stream and delivers them in batches.
 *
 * <p>Each stream has its own buffer and lock. Workers add under the lock and take ready batches out of it; the
 * network call happens outside the lock, so one slow stream does not hold up the others. Every submitted record
 * ends up counted exactly once as sent or failed.
 */
public class BatchIngestionClient {
    private static final Logger log = LoggerFactory.getLogger(BatchIngestionClient.class);
    private static final int MAX_ERRORS_KEPT = 20;

    private final BatchSink<NormalizedRecord> sink;
    private final TokenSession tokens;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final int maxRecords;
    private final long maxBytes;
    private final DeadLetterSink<NormalizedRecord> deadLetters;
    private final ObjectMapper mapper;
    private final Metrics metrics;
    private final Timer flushTimer;
    private final Map<String, StreamState> streams = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /** Delivery counts of one stream. {@code submitted == sent + failed + buffered}. */
    public record DeliveryStats(long submitted, long sent, long failed, List<String> errors) {
        public DeliveryStats {
            errors = List.copyOf(errors);
        }
    }

    private final class StreamState {
        final String stream;
        final StreamSchema schema;
        final BatchBuffer<NormalizedRecord> buffer = new BatchBuffer<>(maxRecords, maxBytes);
        final AtomicLong submitted = new AtomicLong();
        final AtomicLong sent = new AtomicLong();
        final AtomicLong failed = new AtomicLong();
        final List<String> errors = new ArrayList<>();

        StreamState(String stream, StreamSchema schema) {
            this.stream = stream;
            this.schema = schema;
        }

        synchronized void error(String message) {
            if (errors.size() < MAX_ERRORS_KEPT && !errors.contains(message)) errors.add(message);
        }

        synchronized List<String> errors() { return List.copyOf(errors); }
    }

    /**
     * @param tokens ingestion token session, refreshed once per batch when the endpoint reports an expired token;
     *               null when the sink manages its own credentials
     */
    public BatchIngestionClient(BatchSink<NormalizedRecord> sink,
                                TokenSession tokens,
                                RetryPolicy retryPolicy,
                                Sleeper sleeper,
                                int maxRecords,
                                long maxBytes,
                                DeadLetterSink<NormalizedRecord> deadLetters,
                                ObjectMapper mapper,
                                Metrics metrics) {
        this.sink = sink;
        this.tokens = tokens;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.maxRecords = maxRecords;
        this.maxBytes = maxBytes;
        this.deadLetters = deadLetters == null ? DeadLetterSink.none() : deadLetters;
        this.mapper = mapper;
        this.metrics = metrics.scoped("ingest");
        this.flushTimer = this.metrics.timer("flush.time");
    }

    /** Registers streams up front so they report zero counts even when nothing was submitted. */
    public void open(Collection<String> streamNames) {
        for (String s : streamNames) state(s);
    }

    /**
     * Buffers {@code record} for its stream, sending whatever batches became full. Records that do not match the
     * stream's schema, or cannot be serialized, are counted as failed without being buffered.
     */
    public void submit(NormalizedRecord record) {
        StreamState st = state(record.stream());
        st.submitted.incrementAndGet();
        List<String> violations = st.schema.violations(record);
        if (!violations.isEmpty()) {
            reject("validate", st, record, new SchemaMismatchException("Record does not match " + st.stream + ": " + String.join(", ", violations)));
            return;
        }
        long size;
        try {
            size = mapper.writeValueAsBytes(record).length;
        } catch (JsonProcessingException e) {
            reject("validate", st, record, e);
            return;
        }
        List<List<NormalizedRecord>> ready = null;
        synchronized (st) {
            if (!closed) ready = st.buffer.add(record, size);
        }
        if (ready == null) {
            reject("closed", st, record, new IngestionException("Record for " + st.stream + " arrived after the client was closed", 0));
            return;
        }
        for (List<NormalizedRecord> batch : ready) send(st, batch);
    }

    /** Sends whatever is buffered for {@code stream}. */
    public void flush(String stream) {
        StreamState st = streams.get(stream);
        if (st == null) return;
        Optional<List<NormalizedRecord>> batch;
        synchronized (st) {
            batch = st.buffer.flush();
        }
        batch.ifPresent(b -> send(st, b));
    }

    /**
     * Stops accepting records; anything submitted afterwards is counted as failed. Buffered records stay put
     * until flushed.
     */
    public void close() {
        for (StreamState st : streams.values()) {
            synchronized (st) {
                closed = true;
            }
        }
        closed = true;
    }

    public void flushAll() {
        for (String s : new TreeMap<>(streams).keySet()) flush(s);
    }

    public int buffered(String stream) {
        StreamState st = streams.get(stream);
        if (st == null) return 0;
        synchronized (st) {
            return st.buffer.size();
        }
    }

    public DeliveryStats stats(String stream) {
        StreamState st = streams.get(stream);
        if (st == null) return new DeliveryStats(0, 0, 0, List.of());
        return new DeliveryStats(st.submitted.get(), st.sent.get(), st.failed.get(), st.errors());
    }

    private StreamState state(String stream) {
        return streams.computeIfAbsent(stream, s -> new StreamState(s, StreamSchemas.forStream(s)
                .orElseThrow(() -> new IllegalArgumentException("Unknown stream " + s))));
    }

    private void reject(String stage, StreamState st, NormalizedRecord record, Exception e) {
        st.failed.incrementAndGet();
        st.error(e.getMessage());
        metrics.counter("records.rejected").inc();
        log.warn("Rejected a record for {}: {}", st.stream, e.getMessage());
        deadLetters.acceptFailure(stage, st.stream, List.of(record), e);
    }

    /**
     * Delivers one batch: transient failures are retried under the backoff policy, an expired token gets one
     * refresh that does not count as an attempt, anything else fails the whole batch.
     */
    private void send(StreamState st, List<NormalizedRecord> batch) {
        int attempt = 0;
        boolean refreshed = false;
        try (Timer.Context ignored = flushTimer.time()) {
            while (true) {
                attempt++;
                try {
                    sink.acceptBatch(st.stream, batch);
                    st.sent.addAndGet(batch.size());
                    metrics.counter("batches.sent").inc();
                    metrics.counter("records.sent").inc(batch.size());
                    log.debug("Sent {} records to {}", batch.size(), st.stream);
                    return;
                } catch (TokenExpiredException e) {
                    if (refreshed || tokens == null) {
                        fail(st, batch, new AuthException("Ingestion token rejected after refresh for " + st.stream));
                        return;
                    }
                    refreshed = true;
                    attempt--;
                    tokens.refresh(e.staleToken());
                } catch (TransientHttpException e) {
                    if (!retryPolicy.shouldRetry(attempt, e)) {
                        fail(st, batch, e);
                        return;
                    }
                    long millis = retryPolicy.backoffMillis(attempt);
                    if (e.retryAfter().isPresent()) millis = Math.max(millis, e.retryAfter().get().toMillis());
                    metrics.counter("retries").inc();
                    log.warn("Retrying batch of {} for {} in {} ms (attempt {}): {}", batch.size(), st.stream, millis, attempt, e.getMessage());
                    sleeper.sleep(Duration.ofMillis(millis));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(st, batch, e);
        } catch (Exception e) {
            fail(st, batch, e);
        }
    }

    private void fail(StreamState st, List<NormalizedRecord> batch, Exception e) {
        st.failed.addAndGet(batch.size());
        String message = e.getClass().getSimpleName() + ": " + e.getMessage();
        st.error(message);
        metrics.counter("batches.failed").inc();
        metrics.counter("records.failed").inc(batch.size());
        log.error("Batch of {} records for {} failed: {}", batch.size(), st.stream, message);
        deadLetters.acceptFailure("ingest", st.stream, batch, e);
    }
}
