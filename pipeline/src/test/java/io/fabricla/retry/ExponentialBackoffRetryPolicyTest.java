package io.fabricla.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class ExponentialBackoffRetryPolicyTest {

    @Test
    void delays_grow_by_multiplier_and_stop_at_ceiling() {
        var p = new ExponentialBackoffRetryPolicy(10, 100, 3.0, 1000, 0.0, e -> true, new Random(1));
        assertEquals(100, p.backoffMillis(1));
        assertEquals(300, p.backoffMillis(2));
        assertEquals(900, p.backoffMillis(3));
        assertEquals(1000, p.backoffMillis(4));
        assertEquals(1000, p.backoffMillis(40));
    }

    @Test
    void jitter_stays_within_fraction_of_delay() {
        var p = new ExponentialBackoffRetryPolicy(5, 1000, 2.0, 60_000, 0.25, e -> true, new Random(42));
        for (int i = 0; i < 200; i++) {
            long d = p.backoffMillis(2);
            assertTrue(d >= 1500 && d <= 2500, "delay " + d);
        }
    }

    @Test
    void attempt_ceiling_counts_the_failed_call() {
        var p = new ExponentialBackoffRetryPolicy(3, 1, 2.0, 10, 0.0, e -> true, new Random(1));
        Exception e = new IOException("boom");
        assertTrue(p.shouldRetry(1, e));
        assertTrue(p.shouldRetry(2, e));
        assertFalse(p.shouldRetry(3, e));
        assertEquals(3, p.maxAttempts());
    }

    @Test
    void only_retryable_failures_are_retried() {
        var p = new ExponentialBackoffRetryPolicy(5, 1, 2.0, 10, 0.0, e -> e instanceof IOException, new Random(1));
        assertTrue(p.shouldRetry(1, new IOException("reset")));
        assertFalse(p.shouldRetry(1, new IllegalStateException("bad")));
        assertEquals(5, p.maxAttempts());
    }
}
