package com.volovo.tracksync.util;

import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The portal speaks naive local wall-clock time with second resolution
 * ({@code yyyy-MM-dd HH:mm:ss}); it never sends a reliable zone marker,
 * so timestamps stay {@link LocalDateTime} end to end.
 */
public final class PortalTimes {

    public static final DateTimeFormatter PORTAL_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Pattern FRACTION_AND_ZONE = Pattern.compile("\\.\\d+.*$");
    private static final Pattern ZONE_SUFFIX = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$");

    // seconds are optional on input
    private static final DateTimeFormatter LENIENT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private PortalTimes() {
    }

    public static String format(LocalDateTime time) {
        return time.truncatedTo(ChronoUnit.SECONDS).format(PORTAL_FORMAT);
    }

    /**
     * Lenient parse: accepts a {@code T} separator and drops fractional seconds
     * and any zone suffix.
     *
     * @return empty when the text is blank or matches none of the accepted shapes
     */
    public static Optional<LocalDateTime> tryParse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String s = text.trim().replace('T', ' ');
        s = FRACTION_AND_ZONE.matcher(s).replaceFirst("");
        s = ZONE_SUFFIX.matcher(s).replaceFirst("").trim();
        try {
            return Optional.of(LocalDateTime.parse(s, LENIENT_FORMAT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Strict variant for operator input.
     *
     * @throws IllegalArgumentException when the text cannot be parsed
     */
    public static LocalDateTime parse(String text) {
        return tryParse(text).orElseThrow(() ->
                new IllegalArgumentException("Unparseable timestamp '" + text + "', expected yyyy-MM-dd HH:mm:ss"));
    }

    public static LocalDateTime startOfCurrentMonth() {
        return YearMonth.now().atDay(1).atStartOfDay();
    }

    public static LocalDateTime nowSeconds() {
        return LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
    }
}
