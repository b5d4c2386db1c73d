package io.fabricla.retry;

import java.util.Random;
import java.util.function.Predicate;

/**
 * Exponential backoff with jitter: delay(n) = min(maxMillis, baseMillis * multiplier^(n-1)), then spread by
 * +/- jitter (a fraction of the delay). Only exceptions accepted by the retryable predicate are retried.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final double multiplier;
    private final long maxMillis;
    private final double jitter;
    private final Predicate<Exception> retryable;
    private final Random random;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, double multiplier, long maxMillis,
                                         double jitter, Predicate<Exception> retryable, Random random) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
        this.multiplier = Math.max(1.0, multiplier);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.jitter = Math.min(1.0, Math.max(0.0, jitter));
        this.retryable = retryable == null ? e -> true : retryable;
        this.random = random == null ? new Random() : random;
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts && retryable.test(e);
    }

    @Override
    public long backoffMillis(int attempt) {
        double raw = baseMillis * Math.pow(multiplier, Math.min(30, Math.max(0, attempt - 1)));
        long delay = (long) Math.min(raw, maxMillis);
        if (jitter == 0.0 || delay == 0) return delay;
        double spread = delay * jitter;
        double jittered;
        synchronized (random) {
            jittered = delay - spread + (2 * spread * random.nextDouble());
        }
        return Math.max(0L, Math.min(maxMillis, Math.round(jittered)));
    }

    @Override
    public int maxAttempts() { return maxAttempts; }

    @Override
    public String toString() {
        return "ExponentialBackoffRetryPolicy{" +
                "maxAttempts=" + maxAttempts +
                ", baseMillis=" + baseMillis +
                ", multiplier=" + multiplier +
                ", maxMillis=" + maxMillis +
                ", jitter=" + jitter +
                '}';
    }
}
