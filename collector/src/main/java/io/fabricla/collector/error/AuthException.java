package io.fabricla.collector.error;

/** A token could not be obtained, or was rejected after a refresh. Fatal at run start. */
public class AuthException extends CollectorException {
    public AuthException(String message) { super(message); }
    public AuthException(String message, Throwable cause) { super(message, cause); }
}
