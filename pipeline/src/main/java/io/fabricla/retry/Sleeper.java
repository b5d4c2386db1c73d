package io.fabricla.retry;

import java.time.Duration;

/** Suspends the calling thread; swapped out in tests so backoff paths run without wall-clock waits. */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = d -> {
        if (!d.isNegative() && !d.isZero()) Thread.sleep(d.toMillis());
    };

    void sleep(Duration duration) throws InterruptedException;
}
