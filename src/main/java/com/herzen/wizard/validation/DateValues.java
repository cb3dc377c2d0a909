package com.herzen.wizard.validation;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.Function;

/** Impossible calendar dates such as {@code 2024-02-30} are rejected, never rolled over. */
public final class DateValues {

    public record ParsedDate(Instant instant, LocalDate utcDate) {}

    private DateValues() {}

    public static Optional<ParsedDate> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String text = value.trim();

        Optional<LocalDate> date = attempt(LocalDate::parse, text);
        if (date.isPresent()) {
            return Optional.of(new ParsedDate(date.get().atStartOfDay(ZoneOffset.UTC).toInstant(), date.get()));
        }

        Optional<OffsetDateTime> offset = attempt(OffsetDateTime::parse, text);
        if (offset.isPresent()) {
            OffsetDateTime timestamp = offset.get();
            LocalDate utcDate = timestamp.atZoneSameInstant(ZoneOffset.UTC).toLocalDate();
            // the written calendar date must survive conversion to UTC
            if (!utcDate.equals(timestamp.toLocalDate())) return Optional.empty();
            return Optional.of(new ParsedDate(timestamp.toInstant(), utcDate));
        }

        return attempt(LocalDateTime::parse, text)
                .map(t -> new ParsedDate(t.toInstant(ZoneOffset.UTC), t.toLocalDate()));
    }

    public static boolean isValid(String value) {
        return parse(value).isPresent();
    }

    private static <T> Optional<T> attempt(Function<String, T> parser, String text) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
