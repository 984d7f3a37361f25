package com.ledgerlens.backend.services.imports.normalization;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.config.ImportProperties;

/**
 * Parses the date formats seen in bank exports, day-first. Values without an offset are read
 * in the configured import zone. Results are truncated to whole seconds.
 */
@Component
public class StatementDateParser {

    private static final Pattern SLASH_DATE_TIME = Pattern.compile(
            "^\\s*(\\d{1,2})/(\\d{1,2})/(\\d{2,4})(?:\\s+(\\d{1,2}):(\\d{2})(?::(\\d{2}))?)?\\s*$");
    private static final Pattern DASH_DATE_TIME = Pattern.compile(
            "^\\s*(\\d{1,2})-(\\d{1,2})-(\\d{2,4})(?:\\s+(\\d{1,2}):(\\d{2})(?::(\\d{2}))?)?\\s*$");
    // "5 Sept 2024, 14:05" as exported by Google Pay
    private static final Pattern LONG_FORM = Pattern.compile(
            "^(\\d{1,2})\\s+([A-Za-z]+)\\s+(\\d{4}),\\s*(\\d{1,2}):(\\d{2})$");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("oct", 10), Map.entry("nov", 11),
            Map.entry("dec", 12));

    private static final List<DateTimeFormatter> LOCAL_DATE_FORMATS = List.of(
            strict("d MMM uuuu"),
            strict("MMM d, uuuu"),
            strict("MMM d uuuu"),
            strict("d-MMM-uuuu"),
            strict("d-MMM-uu"),
            strict("uuuu/MM/dd")
    );

    private final ZoneId zone;

    public StatementDateParser(ImportProperties importProperties) {
        this.zone = importProperties.zone();
    }

    public Optional<Instant> parse(String value) {
        if (value == null) return Optional.empty();
        String raw = value.trim();
        if (raw.isEmpty()) return Optional.empty();

        Optional<Instant> numeric = parseNumeric(SLASH_DATE_TIME.matcher(raw));
        if (numeric.isPresent()) return numeric;

        numeric = parseNumeric(DASH_DATE_TIME.matcher(raw));
        if (numeric.isPresent()) return numeric;

        Optional<Instant> longForm = parseLongForm(raw);
        if (longForm.isPresent()) return longForm;

        Optional<Instant> direct = parseGeneric(raw.replaceFirst("Sept", "Sep"));
        if (direct.isPresent()) return direct;

        return parseGeneric(raw.replaceFirst(" ", "T").replaceFirst("Sept", "Sep"));
    }

    private Optional<Instant> parseNumeric(Matcher m) {
        if (!m.matches()) return Optional.empty();
        int day = Integer.parseInt(m.group(1));
        int month = Integer.parseInt(m.group(2));
        int year = Integer.parseInt(m.group(3));
        if (year < 100) year += 2000;
        int hour = m.group(4) == null ? 0 : Integer.parseInt(m.group(4));
        int minute = m.group(5) == null ? 0 : Integer.parseInt(m.group(5));
        int second = m.group(6) == null ? 0 : Integer.parseInt(m.group(6));
        return toInstant(year, month, day, hour, minute, second);
    }

    private Optional<Instant> parseLongForm(String raw) {
        Matcher m = LONG_FORM.matcher(raw);
        if (!m.matches()) return Optional.empty();

        String name = m.group(2).toLowerCase(Locale.ROOT);
        Integer month = MONTHS.get(name.substring(0, Math.min(4, name.length())));
        if (month == null) {
            month = MONTHS.get(name.substring(0, Math.min(3, name.length())));
        }
        if (month == null) return Optional.empty();

        return toInstant(
                Integer.parseInt(m.group(3)), month, Integer.parseInt(m.group(1)),
                Integer.parseInt(m.group(4)), Integer.parseInt(m.group(5)), 0);
    }

    private Optional<Instant> parseGeneric(String candidate) {
        try {
            return Optional.of(OffsetDateTime.parse(candidate).toInstant().truncatedTo(ChronoUnit.SECONDS));
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return Optional.of(ZonedDateTime.parse(candidate).toInstant().truncatedTo(ChronoUnit.SECONDS));
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return Optional.of(LocalDateTime.parse(candidate).atZone(zone).toInstant().truncatedTo(ChronoUnit.SECONDS));
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return Optional.of(LocalDate.parse(candidate).atStartOfDay(zone).toInstant());
        } catch (DateTimeParseException ignored) {
            // next format
        }
        for (DateTimeFormatter formatter : LOCAL_DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(candidate, formatter).atStartOfDay(zone).toInstant());
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }

    private Optional<Instant> toInstant(int year, int month, int day, int hour, int minute, int second) {
        try {
            return Optional.of(LocalDateTime.of(year, month, day, hour, minute, second).atZone(zone).toInstant());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
