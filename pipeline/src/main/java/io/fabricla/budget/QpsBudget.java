package io.fabricla.budget;

import io.fabricla.retry.Sleeper;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Spaces external calls evenly at a fixed rate. Each caller reserves the next free slot with a CAS and then
 * sleeps until its slot arrives, so concurrent workers never share a slot and never spin.
 */
public class QpsBudget implements Budget {
    private final long intervalNanos;
    private final AtomicLong nextAvailableNanos = new AtomicLong(Long.MIN_VALUE);
    private final Sleeper sleeper;

    public QpsBudget(double permitsPerSecond, Sleeper sleeper) {
        this.intervalNanos = permitsPerSecond <= 0 ? 0 : (long) (TimeUnit.SECONDS.toNanos(1) / permitsPerSecond);
        this.sleeper = sleeper;
    }

    @Override
    public void acquireExternalOp() throws InterruptedException {
        if (intervalNanos == 0) return;
        long now = System.nanoTime();
        while (true) {
            long current = nextAvailableNanos.get();
            long earliest = current == Long.MIN_VALUE ? now : Math.max(current, now);
            if (nextAvailableNanos.compareAndSet(current, earliest + intervalNanos)) {
                long delay = earliest - now;
                if (delay > 0) sleeper.sleep(Duration.ofNanos(delay));
                return;
            }
        }
    }
}
