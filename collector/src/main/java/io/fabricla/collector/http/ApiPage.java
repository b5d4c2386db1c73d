package io.fabricla.collector.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One page of a paginated listing: the records plus where to go next, if anywhere.
 */
public record ApiPage(List<JsonNode> items, URI next) {
    public ApiPage {
        items = List.copyOf(items);
    }

    public Optional<URI> nextUri() { return Optional.ofNullable(next); }

    /**
     * Reads a page body. Records come from {@code recordsField} (or the root when it is an array). Pagination
     * ends on {@code lastResultSet: true}; otherwise {@code continuationUri} is followed, else
     * {@code continuationToken} is set as a query parameter on the request that produced this page.
     */
    public static ApiPage parse(JsonNode root, URI request, String recordsField) {
        List<JsonNode> items = new ArrayList<>();
        JsonNode array = root.isArray() ? root : root.path(recordsField);
        if (array.isArray()) array.forEach(items::add);
        if (root.isArray()) return new ApiPage(items, null);

        if (root.path("lastResultSet").asBoolean(false)) return new ApiPage(items, null);
        String uri = text(root, "continuationUri");
        if (uri != null) return new ApiPage(items, URI.create(uri));
        String token = text(root, "continuationToken");
        if (token != null) return new ApiPage(items, Uris.withQueryParam(request, "continuationToken", token));
        return new ApiPage(items, null);
    }

    private static String text(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) return null;
        String s = n.asText();
        return s.isBlank() ? null : s;
    }
}
