package io.fabricla.budget;

/**
 * Budget governs how fast the collector may call an external API.
 */
public interface Budget {
    /** Unlimited budget: every acquire returns immediately. */
    Budget UNLIMITED = () -> {};

    /** Block as needed to respect the external QPS budget (one op). */
    void acquireExternalOp() throws InterruptedException;
}
