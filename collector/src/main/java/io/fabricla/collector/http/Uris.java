package io.fabricla.collector.http;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public final class Uris {
    private Uris() {}

    /** Joins a base such as {@code https://host/v1} with a path such as {@code /workspaces}. */
    public static URI resolve(String base, String path) {
        String b = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        String p = path.startsWith("/") ? path : "/" + path;
        return URI.create(b + p);
    }

    public static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /** Returns {@code uri} with query parameter {@code name} set to {@code value}, replacing earlier values. */
    public static URI withQueryParam(URI uri, String name, String value) {
        String raw = uri.getRawQuery();
        List<String> kept = new ArrayList<>();
        if (raw != null && !raw.isEmpty()) {
            for (String part : raw.split("&")) {
                String key = part.contains("=") ? part.substring(0, part.indexOf('=')) : part;
                if (!key.equals(name)) kept.add(part);
            }
        }
        kept.add(name + "=" + encode(value));
        String s = uri.toString();
        int q = s.indexOf('?');
        int hash = s.indexOf('#');
        String head = q >= 0 ? s.substring(0, q) : (hash >= 0 ? s.substring(0, hash) : s);
        return URI.create(head + "?" + String.join("&", kept));
    }
}
