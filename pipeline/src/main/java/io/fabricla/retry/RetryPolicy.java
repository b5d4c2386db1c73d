package io.fabricla.retry;

public interface RetryPolicy {
    /** attempt is 1-based: the number of calls already made, including the one that just failed. */
    boolean shouldRetry(int attempt, Exception e);
    long backoffMillis(int attempt);
    int maxAttempts();
}
