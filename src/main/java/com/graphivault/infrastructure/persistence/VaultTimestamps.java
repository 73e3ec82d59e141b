package com.graphivault.infrastructure.persistence;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Fixed-width UTC timestamps, so lexicographic order in SQL equals chronological order.
 */
public final class VaultTimestamps {

    private static final DateTimeFormatter STORED_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter FILE_NAME_FORMAT =
        DateTimeFormatter.ofPattern("uuuuMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

    private VaultTimestamps() {}

    public static String now(Clock clock) {
        return format(clock.instant());
    }

    public static String format(Instant instant) {
        return STORED_FORMAT.format(instant);
    }

    /**
     * @return the parsed instant, or null for a null column
     */
    public static Instant parse(String stored) {
        return stored == null ? null : Instant.parse(stored);
    }

    /**
     * Compact form safe for file names, e.g. {@code 20240102T030405678Z}.
     */
    public static String forFileName(Instant instant) {
        return FILE_NAME_FORMAT.format(instant);
    }
}
