package io.fabricla.collector.error;

/** The ingestion endpoint (or local validation) rejected a batch's shape. Batch-scoped, never retried. */
public class SchemaMismatchException extends CollectorException {
    public SchemaMismatchException(String message) { super(message); }
}
