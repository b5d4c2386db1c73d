package io.fabricla.collector.error;

import io.fabricla.collector.model.EntityKind;

/** Listing entities of one kind failed; that kind is skipped for the run. */
public class DiscoveryException extends CollectorException {
    private final EntityKind kind;

    public DiscoveryException(EntityKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public DiscoveryException(EntityKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EntityKind kind() { return kind; }
}
