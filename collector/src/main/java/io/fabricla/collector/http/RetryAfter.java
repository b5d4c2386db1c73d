package io.fabricla.collector.http;

import java.net.http.HttpHeaders;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/** Reads the server's wait hint: {@code retry-after-ms}, or {@code Retry-After} as seconds or an HTTP date. */
public final class RetryAfter {
    private RetryAfter() {}

    public static Optional<Duration> from(HttpHeaders headers, Clock clock) {
        Optional<Duration> ms = headers.firstValue("retry-after-ms")
                .or(() -> headers.firstValue("x-ms-retry-after-ms"))
                .flatMap(RetryAfter::millis);
        if (ms.isPresent()) return ms;
        return headers.firstValue("Retry-After").flatMap(v -> parse(v, clock));
    }

    private static Optional<Duration> millis(String value) {
        try {
            return Optional.of(Duration.ofMillis(Math.max(0, Long.parseLong(value.trim()))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static Optional<Duration> parse(String value, Clock clock) {
        String v = value.trim();
        if (v.isEmpty()) return Optional.empty();
        try {
            double seconds = Double.parseDouble(v);
            return Optional.of(Duration.ofMillis(Math.max(0, Math.round(seconds * 1000))));
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration d = Duration.between(clock.instant(), at.toInstant());
                return Optional.of(d.isNegative() ? Duration.ZERO : d);
            } catch (DateTimeParseException notDate) {
                return Optional.empty();
            }
        }
    }
}
