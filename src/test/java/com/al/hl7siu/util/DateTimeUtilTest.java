package com.al.hl7siu.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DateTimeUtil.
 */
public class DateTimeUtilTest {

    @Test
    public void testParseHl7DateTime_WithTimezone() {
        Optional<OffsetDateTime> result = DateTimeUtil.parseHl7DateTime("20250502130000+0600");

        assertTrue(result.isPresent());
        assertEquals(13, result.get().getHour());
        assertEquals("+06:00", result.get().getOffset().getId());
        assertEquals("2025-05-02T07:00:00Z", DateTimeUtil.toIsoUtc(result.get()));
    }

    @Test
    public void testParseHl7DateTime_NegativeTimezone() {
        assertEquals("2026-01-16T17:00:00Z", DateTimeUtil.hl7DateTimeToIsoUtc("20260116120000-0500"));
        assertEquals("2026-01-16T06:30:00Z", DateTimeUtil.hl7DateTimeToIsoUtc("20260116120000+0530"));
    }

    @Test
    public void testParseHl7DateTime_YearOnly() {
        OffsetDateTime result = DateTimeUtil.parseHl7DateTime("2025").orElseThrow();

        assertEquals(2025, result.getYear());
        assertEquals(1, result.getMonthValue());
        assertEquals(1, result.getDayOfMonth());
        assertEquals(0, result.getHour());
        assertEquals(ZoneOffset.UTC, result.getOffset());
        assertEquals("2025-01-01T00:00:00Z", DateTimeUtil.toIsoUtc(result));
    }

    @Test
    public void testParseHl7DateTime_PartialPrecision() {
        assertEquals("2025-05-01T00:00:00Z", DateTimeUtil.hl7DateTimeToIsoUtc("202505"));
        assertEquals("2025-05-02T00:00:00Z", DateTimeUtil.hl7DateTimeToIsoUtc("20250502"));
        assertEquals("2025-05-02T13:00:00Z", DateTimeUtil.hl7DateTimeToIsoUtc("2025050213"));
        assertEquals("2025-05-02T13:30:00Z", DateTimeUtil.hl7DateTimeToIsoUtc("202505021330"));
        assertEquals("2025-05-02T13:30:00Z", DateTimeUtil.hl7DateTimeToIsoUtc("20250502133000"));
    }

    @Test
    public void testParseHl7DateTime_WithoutTimezoneIsUtc() {
        OffsetDateTime result = DateTimeUtil.parseHl7DateTime("20250502130000").orElseThrow();

        assertEquals(ZoneOffset.UTC, result.getOffset());
        assertEquals("2025-05-02T13:00:00Z", DateTimeUtil.toIsoUtc(result));
    }

    @Test
    public void testParseHl7DateTime_FractionalSeconds() {
        assertEquals("2025-05-02T18:00:00.123400Z", DateTimeUtil.hl7DateTimeToIsoUtc("20250502130000.1234-0500"));
        assertEquals("2025-05-02T13:00:00.123456Z", DateTimeUtil.hl7DateTimeToIsoUtc("20250502130000.1234567"));
        assertEquals("2025-05-02T13:00:00Z", DateTimeUtil.hl7DateTimeToIsoUtc("20250502130000.0"));
    }

    @Test
    public void testParseHl7DateTime_Invalid() {
        assertFalse(DateTimeUtil.parseHl7DateTime(null).isPresent());
        assertFalse(DateTimeUtil.parseHl7DateTime("").isPresent());
        assertFalse(DateTimeUtil.parseHl7DateTime("tomorrow").isPresent());
        assertFalse(DateTimeUtil.parseHl7DateTime("2025050").isPresent());
        assertFalse(DateTimeUtil.parseHl7DateTime("20250502 1300").isPresent());
        assertFalse(DateTimeUtil.parseHl7DateTime("20250502130000+06").isPresent());
        assertEquals("", DateTimeUtil.hl7DateTimeToIsoUtc("garbage"));
    }

    @Test
    public void testParseHl7DateTime_OutOfRange() {
        assertFalse(DateTimeUtil.parseHl7DateTime("20251301").isPresent());
        assertFalse(DateTimeUtil.parseHl7DateTime("20250230").isPresent());
        assertFalse(DateTimeUtil.parseHl7DateTime("2025050225").isPresent());
        assertFalse(DateTimeUtil.parseHl7DateTime("20250502130000+2500").isPresent());
    }

    @Test
    public void testParseHl7Date() {
        LocalDate result = DateTimeUtil.parseHl7Date("19850210").orElseThrow();

        assertEquals(1985, result.getYear());
        assertEquals(2, result.getMonthValue());
        assertEquals(10, result.getDayOfMonth());
        assertEquals("1985-02-10", DateTimeUtil.toIsoDate(result));
    }

    @Test
    public void testParseHl7Date_IgnoresTimeAndOffset() {
        assertEquals("1985-02-10", DateTimeUtil.hl7DateToIso("19850210233000-1100"));
        assertEquals("1985-01-01", DateTimeUtil.hl7DateToIso("1985"));
    }

    @Test
    public void testParseHl7Date_Invalid() {
        assertFalse(DateTimeUtil.parseHl7Date(null).isPresent());
        assertFalse(DateTimeUtil.parseHl7Date("19850230").isPresent());
        assertEquals("", DateTimeUtil.hl7DateToIso("unknown"));
    }

    @Test
    public void testToIsoUtc_AlwaysUsesZ() {
        OffsetDateTime utc = OffsetDateTime.of(2025, 5, 2, 7, 0, 0, 0, ZoneOffset.UTC);
        OffsetDateTime shifted = OffsetDateTime.of(2025, 5, 1, 21, 0, 0, 0, ZoneOffset.ofHours(-10));

        assertEquals("2025-05-02T07:00:00Z", DateTimeUtil.toIsoUtc(utc));
        assertEquals("2025-05-02T07:00:00Z", DateTimeUtil.toIsoUtc(shifted));
    }
}
