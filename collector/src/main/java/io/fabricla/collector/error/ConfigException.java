package io.fabricla.collector.error;

/** Invalid run configuration. Fatal; raised before any I/O. */
public class ConfigException extends CollectorException {
    public ConfigException(String message) { super(message); }
    public ConfigException(String message, Throwable cause) { super(message, cause); }
}
