package io.fabricla.collector.error;

/** An entity needed more pages than the configured cap. Entity-scoped. */
public class PaginationExhaustedException extends CollectorException {
    public PaginationExhaustedException(String entity, int maxPages) {
        this(entity, maxPages, "pages");
    }

    public PaginationExhaustedException(String entity, int maxPages, String what) {
        super("Entity " + entity + " exceeded " + maxPages + " " + what);
    }
}
