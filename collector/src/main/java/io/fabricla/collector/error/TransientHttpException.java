package io.fabricla.collector.error;

import java.time.Duration;
import java.util.Optional;

/**
 * A failure worth retrying: HTTP 429, 5xx, or a connection-level error (status 0).
 * {@code retryAfter} carries the server's hint when one was sent.
 */
public class TransientHttpException extends CollectorException {
    private final int status;
    private final transient Duration retryAfter;

    public TransientHttpException(String message, int status, Duration retryAfter) {
        super(message);
        this.status = status;
        this.retryAfter = retryAfter;
    }

    public TransientHttpException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.retryAfter = null;
    }

    public int status() { return status; }
    public Optional<Duration> retryAfter() { return Optional.ofNullable(retryAfter); }
}
