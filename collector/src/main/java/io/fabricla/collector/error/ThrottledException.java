package io.fabricla.collector.error;

import java.net.URI;

/** A page request kept answering 429 past the throttle attempt bound. Entity-scoped. */
public class ThrottledException extends CollectorException {
    private final URI uri;
    private final int attempts;

    public ThrottledException(URI uri, int attempts) {
        super("Still throttled after " + attempts + " attempts: " + uri);
        this.uri = uri;
        this.attempts = attempts;
    }

    public URI uri() { return uri; }
    public int attempts() { return attempts; }
}
