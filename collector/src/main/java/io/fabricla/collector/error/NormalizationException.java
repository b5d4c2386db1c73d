package io.fabricla.collector.error;

/** A raw record could not be mapped onto its stream schema. */
public class NormalizationException extends CollectorException {
    public NormalizationException(String message) { super(message); }
    public NormalizationException(String message, Throwable cause) { super(message, cause); }
}
