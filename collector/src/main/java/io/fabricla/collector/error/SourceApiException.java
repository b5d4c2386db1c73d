package io.fabricla.collector.error;

import java.net.URI;

/** A source API call failed with a status that retrying will not fix (4xx other than 401/429). */
public class SourceApiException extends CollectorException {
    private final int status;

    public SourceApiException(URI uri, int status, String body) {
        super("GET " + uri + " failed: HTTP " + status + (body == null || body.isBlank() ? "" : " - " + body));
        this.status = status;
    }

    public int status() { return status; }
}
