package io.fabricla.collector.error;

/** Non-retryable ingestion failure other than a schema mismatch (403, 404, 413, ...). Batch-scoped. */
public class IngestionException extends CollectorException {
    private final int status;

    public IngestionException(String message, int status) {
        super(message);
        this.status = status;
    }

    public int status() { return status; }
}
