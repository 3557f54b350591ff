package com.di.loannova.common;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * ISO-8601 checks and tolerant date parsing for source extracts.
 */
public final class IsoDates {

    private static final Pattern ISO_8601 = Pattern.compile(
            "^\\d{4}-\\d{2}-\\d{2}(T\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?(Z|[+-]\\d{2}:\\d{2})?)?$");

    private record Layout(Pattern shape, DateTimeFormatter format, boolean withTime) {
    }

    private static final List<Layout> LENIENT = List.of(
            new Layout(Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}$"),
                    DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"), true),
            new Layout(Pattern.compile("^\\d{4}/\\d{2}/\\d{2}$"), DateTimeFormatter.ofPattern("yyyy/MM/dd"), false),
            new Layout(Pattern.compile("^\\d{2}/\\d{2}/\\d{4}$"), DateTimeFormatter.ofPattern("MM/dd/yyyy"), false),
            new Layout(Pattern.compile("^\\d{8}$"), DateTimeFormatter.ofPattern("yyyyMMdd"), false));

    private IsoDates() {
    }

    public static boolean isIso8601(Object value) {
        return value != null && ISO_8601.matcher(value.toString().trim()).matches();
    }

    /** Calendar date of an ISO-8601 date or timestamp; empty when the value is not ISO-8601. */
    public static Optional<LocalDate> parseIso(Object value) {
        if (!isIso8601(value)) return Optional.empty();
        String s = value.toString().trim();
        try {
            if (s.length() == 10) return Optional.of(LocalDate.parse(s));
            if (s.endsWith("Z") || s.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return Optional.of(OffsetDateTime.parse(s).toLocalDate());
            }
            return Optional.of(LocalDateTime.parse(s).toLocalDate());
        } catch (DateTimeParseException e) {
            // shape matched but calendar value is impossible, e.g. 2024-02-31
            return Optional.empty();
        }
    }

    /** ISO-8601 first, then a few common export layouts. */
    public static Optional<LocalDate> parseLenient(Object value) {
        if (value == null) return Optional.empty();
        Optional<LocalDate> iso = parseIso(value);
        if (iso.isPresent()) return iso;
        String s = Dataset.render(value).trim();
        for (Layout layout : LENIENT) {
            if (!layout.shape().matcher(s).matches()) continue;
            try {
                return Optional.of(layout.withTime()
                        ? LocalDateTime.parse(s, layout.format()).toLocalDate()
                        : LocalDate.parse(s, layout.format()));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
