package io.fabricla.collector.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** An access token and its expiry. {@code expiresAt} is null when the issuer did not say. */
public record BearerToken(String value, Instant expiresAt) {
    public BearerToken {
        Objects.requireNonNull(value, "value");
    }

    public boolean expiresWithin(Duration margin, Instant now) {
        return expiresAt != null && !now.plus(margin).isBefore(expiresAt);
    }

    public String header() { return "Bearer " + value; }

    @Override
    public String toString() {
        return "BearerToken{expiresAt=" + expiresAt + '}';
    }
}
