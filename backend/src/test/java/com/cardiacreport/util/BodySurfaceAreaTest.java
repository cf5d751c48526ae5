package com.cardiacreport.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BodySurfaceAreaTest {

    @Test
    public void testMosteller() {
        assertEquals(1.909, BodySurfaceArea.mosteller(175.0, 75.0), 0.001);
    }

    @Test
    public void testMosteller_MissingOrNonPositive() {
        assertNull(BodySurfaceArea.mosteller(null, 75.0));
        assertNull(BodySurfaceArea.mosteller(175.0, 0.0));
    }

    @Test
    public void testIndex() {
        assertEquals(22.0, BodySurfaceArea.index(42.0, 1.91, 1));
        assertNull(BodySurfaceArea.index(42.0, 0.0, 1));
        assertNull(BodySurfaceArea.index(null, 1.91, 1));
    }
}
