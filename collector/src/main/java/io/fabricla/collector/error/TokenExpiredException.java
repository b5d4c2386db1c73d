package io.fabricla.collector.error;

import io.fabricla.collector.auth.BearerToken;

/** The server answered 401 to a request made with {@code staleToken}; the caller may refresh once and retry. */
public class TokenExpiredException extends CollectorException {
    private final transient BearerToken staleToken;

    public TokenExpiredException(String message, BearerToken staleToken) {
        super(message);
        this.staleToken = staleToken;
    }

    public BearerToken staleToken() { return staleToken; }
}
