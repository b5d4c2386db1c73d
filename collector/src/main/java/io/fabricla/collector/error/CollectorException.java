package io.fabricla.collector.error;

/** Root of the collector's failure taxonomy. Subclasses say at which scope a failure is contained. */
public class CollectorException extends Exception {
    public CollectorException(String message) { super(message); }
    public CollectorException(String message, Throwable cause) { super(message, cause); }
}
