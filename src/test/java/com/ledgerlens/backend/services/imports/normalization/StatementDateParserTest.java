package com.ledgerlens.backend.services.imports.normalization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.ledgerlens.backend.config.ImportProperties;

class StatementDateParserTest {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final StatementDateParser parser = new StatementDateParser(ImportProperties.defaults());

    private static Instant day(int y, int m, int d) {
        return LocalDate.of(y, m, d).atStartOfDay(IST).toInstant();
    }

    @Test
    void dayFirstSlashAndDash() {
        assertEquals(Optional.of(day(2024, 2, 15)), parser.parse("15/02/2024"));
        assertEquals(Optional.of(day(2024, 3, 20)), parser.parse("20-03-2024"));
        assertEquals(Optional.of(day(2024, 3, 5)), parser.parse("5/3/2024"));
    }

    @Test
    void twoDigitYearIsTwentyFirstCentury() {
        assertEquals(Optional.of(day(2024, 2, 15)), parser.parse("15/02/24"));
    }

    @Test
    void numericFormsCarryOptionalTime() {
        assertEquals(Optional.of(LocalDateTime.of(2024, 2, 15, 14, 5).atZone(IST).toInstant()),
                parser.parse("15/02/2024 14:05"));
        assertEquals(Optional.of(LocalDateTime.of(2024, 2, 15, 9, 10, 11).atZone(IST).toInstant()),
                parser.parse("15-02-2024 09:10:11"));
    }

    @Test
    void longFormWithSept() {
        assertEquals(Optional.of(LocalDateTime.of(2024, 9, 5, 14, 5).atZone(IST).toInstant()),
                parser.parse("5 Sept 2024, 14:05"));
        assertEquals(Optional.of(LocalDateTime.of(2024, 1, 12, 8, 30).atZone(IST).toInstant()),
                parser.parse("12 Jan 2024, 8:30"));
    }

    @Test
    void isoForms() {
        assertEquals(Optional.of(Instant.parse("2024-02-15T10:00:00Z")), parser.parse("2024-02-15T10:00:00Z"));
        assertEquals(Optional.of(Instant.parse("2024-02-15T04:30:00Z")), parser.parse("2024-02-15T10:00:00.750+05:30"));
        assertEquals(Optional.of(day(2024, 2, 15)), parser.parse("2024-02-15"));
        assertEquals(Optional.of(LocalDateTime.of(2024, 2, 15, 10, 30).atZone(IST).toInstant()),
                parser.parse("2024-02-15 10:30:00"));
    }

    @Test
    void monthNameForms() {
        assertEquals(Optional.of(day(2024, 9, 15)), parser.parse("15 Sept 2024"));
        assertEquals(Optional.of(day(2024, 2, 15)), parser.parse("Feb 15, 2024"));
        assertEquals(Optional.of(day(2024, 2, 15)), parser.parse("15-Feb-2024"));
        assertEquals(Optional.of(day(2024, 2, 15)), parser.parse("2024/02/15"));
    }

    @Test
    void invalidCalendarDatesAndGarbageFail() {
        assertTrue(parser.parse("31/02/2024").isEmpty());
        assertTrue(parser.parse("not a date").isEmpty());
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }
}
