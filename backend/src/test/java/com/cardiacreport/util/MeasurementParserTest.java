package com.cardiacreport.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MeasurementParserTest {

    @Test
    public void testParseDouble_AcceptsDecimalComma() {
        assertEquals(12.5, MeasurementParser.parseDouble("12,5"));
        assertEquals(12.5, MeasurementParser.parseDouble(" 12.5 "));
    }

    @Test
    public void testParseDouble_BlankOrGarbageIsNull() {
        assertNull(MeasurementParser.parseDouble(null));
        assertNull(MeasurementParser.parseDouble("   "));
        assertNull(MeasurementParser.parseDouble("abc"));
        assertNull(MeasurementParser.parseDouble("NaN"));
    }

    @Test
    public void testParseInteger_Truncates() {
        assertEquals(95, MeasurementParser.parseInteger("95.7"));
        assertNull(MeasurementParser.parseInteger("n/a"));
    }

    @Test
    public void testParseCvd() {
        assertEquals(3.0, MeasurementParser.parseCvd("3"));
        assertEquals(15.0, MeasurementParser.parseCvd("15+"));
        assertEquals(0.0, MeasurementParser.parseCvd(null));
        assertEquals(0.0, MeasurementParser.parseCvd("onbekend"));
    }
}
