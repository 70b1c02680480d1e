package com.newsrelay.feeds.normalize;

import com.newsrelay.core.model.NewsItem;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

public final class DateNormalizer {
    // RFC 822 as found in the wild: optional weekday, optional seconds, numeric offset or zone name
    private static final DateTimeFormatter RFC_822_LENIENT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .optionalStart().appendPattern("EEE, ").optionalEnd()
            .appendPattern("d MMM yyyy HH:mm")
            .optionalStart().appendPattern(":ss").optionalEnd()
            .appendLiteral(' ')
            .optionalStart().appendPattern("XX").optionalEnd()
            .optionalStart().appendPattern("z").optionalEnd()
            .toFormatter(Locale.ENGLISH);

    private static final List<Function<String, Instant>> PARSERS = List.of(
            Instant::parse,
            value -> OffsetDateTime.parse(value).toInstant(),
            value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant(),
            value -> ZonedDateTime.parse(value, RFC_822_LENIENT).toInstant(),
            value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC)
    );

    private DateNormalizer() {
    }

    public static Instant parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NewsItem.UNKNOWN_PUBLISHED_AT;
        }
        String value = raw.trim().replaceAll("\\s+", " ");
        return PARSERS.stream()
                .map(parser -> safelyParse(parser, value))
                .flatMap(Optional::stream)
                .findFirst()
                .orElse(NewsItem.UNKNOWN_PUBLISHED_AT);
    }

    private static Optional<Instant> safelyParse(Function<String, Instant> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeException | ArithmeticException ex) {
            return Optional.empty();
        }
    }
}
