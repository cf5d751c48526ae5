package com.cardiacreport.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReportFormatTest {

    @Test
    public void testRound_HalfEvenOnBinaryValue() {
        assertEquals(2.67, ReportFormat.round(2.675, 2));
        assertEquals(0.0, ReportFormat.round(0.5, 0));
        assertEquals(2.0, ReportFormat.round(1.5, 0));
        assertNull(ReportFormat.round(null, 1));
        assertNull(ReportFormat.round(Double.NaN, 1));
    }

    @Test
    public void testFixedAndWhole() {
        assertEquals("1.00", ReportFormat.fixed(1.0, 2));
        assertEquals("42", ReportFormat.whole(41.6));
        assertEquals("40", ReportFormat.fixed(40.5, 0));
    }

    @Test
    public void testPlain_KeepsDecimalOfDoubles() {
        assertEquals("10.0", ReportFormat.plain(10.0));
        assertEquals("12.5", ReportFormat.plain(12.5));
        assertEquals("7", ReportFormat.plain(7));
        assertEquals("", ReportFormat.plain(null));
    }

    @Test
    public void testJoinDutch() {
        assertEquals("", ReportFormat.joinDutch(List.of()));
        assertEquals("a", ReportFormat.joinDutch(List.of("a")));
        assertEquals("a en b", ReportFormat.joinDutch(List.of("a", "b")));
        assertEquals("a, b en c", ReportFormat.joinDutch(List.of("a", " ", "b", "c")));
    }

    @Test
    public void testFirstNonBlank() {
        assertEquals("fallback", ReportFormat.firstNonBlank("  ", "fallback"));
        assertEquals("chosen", ReportFormat.firstNonBlank("chosen", "fallback"));
        assertNull(ReportFormat.firstNonBlank(null, null));
    }

    @Test
    public void testWhole_BeyondLongRange() {
        assertEquals("100000000000000000000", ReportFormat.whole(1e20));
        assertEquals("-100000000000000000000", ReportFormat.whole(-1e20));
        assertEquals(Long.MAX_VALUE, ReportFormat.roundToLong(1e20));
        assertEquals(Long.MIN_VALUE, ReportFormat.roundToLong(-1e20));
        assertEquals(42L, ReportFormat.roundToLong(41.6));
    }
}
