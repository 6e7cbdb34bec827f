package org.esa.echogram.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Conversion between calendar date-times (GMT) and the numeric ping time used by the processing
 * chain: days since 1970-01-01T00:00Z, with the time of day as fractional part.
 */
public final class PingTime {

    private static final double SECONDS_PER_DAY = 86400.0;
    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH);

    private PingTime() {
    }

    public static double toDays(LocalDateTime dateTime) {
        final long seconds = dateTime.toEpochSecond(ZoneOffset.UTC);
        return (seconds + dateTime.getNano() * 1.0E-9) / SECONDS_PER_DAY;
    }

    public static double toDays(LocalDate date) {
        return date.toEpochDay();
    }

    /**
     * @return the date-time, rounded to the microsecond
     */
    public static LocalDateTime toDateTime(double days) {
        final long micros = Math.round(days * SECONDS_PER_DAY * 1.0E6);
        final long seconds = Math.floorDiv(micros, 1000000L);
        final long nanos = Math.floorMod(micros, 1000000L) * 1000L;
        return LocalDateTime.ofEpochSecond(seconds, (int) nanos, ZoneOffset.UTC);
    }

    public static LocalDate toDate(double days) {
        return LocalDate.ofEpochDay((long) Math.floor(days));
    }

    /**
     * @return the GMT hour of day in [0, 24)
     */
    public static double hourOfDay(double days) {
        return (days - Math.floor(days)) * 24.0;
    }

    /**
     * Formats the date part like {@code 05-Mar-2015}.
     */
    public static String formatDate(double days) {
        return toDate(days).format(DATE_FORMAT);
    }
}
