package ou.capstone.sunseat.route;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for GeoPoint
 */
class GeoPointTest {

    private static final double TOLERANCE = 0.000001;

    @Test
    void testConstructor_BasicCoordinates() {
        GeoPoint p = new GeoPoint(35.3931, -97.6007);

        assertEquals(35.3931, p.getLatitude(), TOLERANCE, "Latitude should match constructor value");
        assertEquals(-97.6007, p.getLongitude(), TOLERANCE, "Longitude should match constructor value");
    }

    @Test
    void testConstructor_PolesAndDateLine() {
        assertEquals(90.0, new GeoPoint(90.0, 0.0).getLatitude(), TOLERANCE);
        assertEquals(-90.0, new GeoPoint(-90.0, 0.0).getLatitude(), TOLERANCE);
        assertEquals(180.0, new GeoPoint(0.0, 180.0).getLongitude(), TOLERANCE);
        assertEquals(-180.0, new GeoPoint(0.0, -180.0).getLongitude(), TOLERANCE);
    }

    @Test
    void testLatitudeOutOfRange_throwsException() {
        Exception e = assertThrows(IllegalArgumentException.class, () -> new GeoPoint(91.0, 0.0));
        assertTrue(e.getMessage().contains("Latitude"), "Expected Latitude range exception");
        assertThrows(IllegalArgumentException.class, () -> new GeoPoint(-91.0, 0.0));
    }

    @Test
    void testLongitudeOutOfRange_throwsException() {
        Exception e = assertThrows(IllegalArgumentException.class, () -> new GeoPoint(0.0, 181.0));
        assertTrue(e.getMessage().contains("Longitude"), "Expected Longitude range exception");
        assertThrows(IllegalArgumentException.class, () -> new GeoPoint(0.0, -181.0));
    }

    @Test
    void testNaN_throwsException() {
        assertThrows(IllegalArgumentException.class, () -> new GeoPoint(Double.NaN, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new GeoPoint(0.0, Double.NaN));
    }

    @Test
    void testValueEquality() {
        assertEquals(new GeoPoint(51.4706, -0.461941), new GeoPoint(51.4706, -0.461941));
        assertEquals(new GeoPoint(51.4706, -0.461941).hashCode(), new GeoPoint(51.4706, -0.461941).hashCode());
        assertNotEquals(new GeoPoint(51.4706, -0.461941), new GeoPoint(51.4706, -0.461940));
    }

    @Test
    void testNegativeZeroEqualsZero() {
        GeoPoint zero = new GeoPoint(0.0, 0.0);
        GeoPoint negativeZero = new GeoPoint(-0.0, -0.0);

        assertEquals(zero, negativeZero);
        assertEquals(zero.hashCode(), negativeZero.hashCode());
        assertEquals("(0.000000, 0.000000)", negativeZero.toString());
    }

    @Test
    void testToString_Format() {
        String result = new GeoPoint(12.3456789, -98.7654321).toString();

        assertTrue(result.contains("12.345679"), "Should round to 6 decimal places");
        assertTrue(result.contains("-98.765432"), "Should round to 6 decimal places");
        assertTrue(result.startsWith("(") && result.endsWith(")"));
    }
}
