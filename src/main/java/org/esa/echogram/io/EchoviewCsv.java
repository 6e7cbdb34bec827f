package org.esa.echogram.io;

import org.esa.echogram.EchogramException;
import org.esa.echogram.util.PingTime;

import java.text.MessageFormat;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Field parsing shared by the Echoview CSV readers.
 */
final class EchoviewCsv {

    static final String DELIMITER = ",";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private EchoviewCsv() {
    }

    static String[] split(String line) {
        return line.split(DELIMITER, -1);
    }

    /**
     * Parses {@code Ping_date} and {@code Ping_time} into days since the epoch. Fractions of a
     * second are dropped.
     */
    static double parseTimestamp(String date, String time, String source, int lineNumber) {
        try {
            final LocalDate day = LocalDate.parse(unquote(date), DATE_FORMAT);
            String timeText = unquote(time);
            final int dot = timeText.indexOf('.');
            if (dot >= 0) {
                timeText = timeText.substring(0, dot);
            }
            final LocalTime timeOfDay = LocalTime.parse(timeText, TIME_FORMAT);
            return PingTime.toDays(LocalDateTime.of(day, timeOfDay));
        } catch (DateTimeParseException e) {
            throw new EchogramException(MessageFormat.format("{0}, line {1}: invalid ping date/time ''{2} {3}''",
                                                             source, lineNumber, date, time), e);
        }
    }

    /**
     * Parses a number; an empty field is NaN.
     */
    static double parseDouble(String field, String column, String source, int lineNumber) {
        final String text = unquote(field);
        if (text.isEmpty()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new EchogramException(MessageFormat.format("{0}, line {1}: {2} is not a number: ''{3}''",
                                                             source, lineNumber, column, field), e);
        }
    }

    private static String unquote(String field) {
        String text = field.trim();
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            text = text.substring(1, text.length() - 1).trim();
        }
        return text;
    }
}
