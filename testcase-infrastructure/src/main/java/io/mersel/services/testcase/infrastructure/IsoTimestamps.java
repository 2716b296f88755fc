package io.mersel.services.testcase.infrastructure;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Notlar, ekler ve raporlarda kullanılan ISO-8601 UTC zaman damgaları
 * ({@code 2024-05-01T10:15:30.000Z}).
 */
final class IsoTimestamps {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private IsoTimestamps() {
    }

    static String now(Clock clock) {
        return FORMAT.format(Instant.now(clock));
    }

    /**
     * Sıralama için zaman damgasını çözümler.
     *
     * @return çözümlenemezse {@code null}
     */
    static Instant parseOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.strip());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
