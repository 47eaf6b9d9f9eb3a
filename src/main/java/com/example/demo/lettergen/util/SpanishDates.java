package com.example.demo.lettergen.util;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Parsing and rendering of letter dates in Spanish ("05 de marzo de 2024").
 */
public final class SpanishDates {
    private SpanishDates() {}

    public static final Locale SPANISH = new Locale("es", "ES");

    private static final DateTimeFormatter LONG_FORMAT =
            DateTimeFormatter.ofPattern("dd 'de' MMMM 'de' yyyy", SPANISH);

    // Day-first formats come before the American one so 03/04/2024 reads as 3 April.
    private static final List<DateTimeFormatter> INPUT_FORMATS = List.of(
            DateTimeFormatter.ofPattern("d/M/yyyy"),
            DateTimeFormatter.ofPattern("yyyy-M-d"),
            DateTimeFormatter.ofPattern("d-M-yyyy"),
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("d 'de' MMMM 'de' yyyy")
                    .toFormatter(SPANISH),
            DateTimeFormatter.ofPattern("yyyy/M/d"),
            DateTimeFormatter.ofPattern("d.M.yyyy"),
            DateTimeFormatter.ofPattern("yyyy.M.d"),
            DateTimeFormatter.ofPattern("M/d/yyyy"),
            DateTimeFormatter.ofPattern("yyyy/d/M"));

    /**
     * Parses {@code value} with the first matching input format; blank or unparseable
     * input yields today's date according to {@code clock}.
     */
    public static LocalDate parse(String value, Clock clock) {
        LocalDate parsed = tryParse(value);
        return parsed != null ? parsed : LocalDate.now(clock);
    }

    /**
     * Same as {@link #parse(String, Clock)} but returns null instead of today.
     */
    public static LocalDate tryParse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        for (DateTimeFormatter format : INPUT_FORMATS) {
            try {
                return LocalDate.parse(trimmed, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return null;
    }

    public static String format(LocalDate date) {
        return LONG_FORMAT.format(date);
    }
}
