package ou.capstone.sunseat.route;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for Geodesy
 */
class GeodesyTest {

    private static final double BEARING_TOLERANCE = 0.0001; // degrees
    private static final double KM_TOLERANCE = 0.01;

    // Test coordinates: KOKC (Oklahoma City) and KDFW (Dallas)
    private static final GeoPoint KOKC = new GeoPoint(35.3931, -97.6007);
    private static final GeoPoint KDFW = new GeoPoint(32.8998, -97.0403);
    private static final GeoPoint KJFK = new GeoPoint(40.63980103, -73.77890015);
    private static final GeoPoint EGLL = new GeoPoint(51.4706, -0.461941);

    @Test
    void testBearing_CardinalDirections() {
        GeoPoint origin = new GeoPoint(0.0, 0.0);

        assertEquals(0.0, Geodesy.bearing(origin, new GeoPoint(10.0, 0.0)), BEARING_TOLERANCE, "Due north");
        assertEquals(90.0, Geodesy.bearing(origin, new GeoPoint(0.0, 90.0)), BEARING_TOLERANCE, "Due east");
        assertEquals(180.0, Geodesy.bearing(origin, new GeoPoint(-10.0, 0.0)), BEARING_TOLERANCE, "Due south");
        assertEquals(270.0, Geodesy.bearing(origin, new GeoPoint(0.0, -10.0)), BEARING_TOLERANCE, "Due west");
    }

    @Test
    void testBearing_AlwaysInRange() {
        GeoPoint[] points = {KOKC, KDFW, KJFK, EGLL, new GeoPoint(-33.9, 151.2), new GeoPoint(0, 180)};
        for (GeoPoint a : points) {
            for (GeoPoint b : points) {
                double bearing = Geodesy.bearing(a, b);
                assertTrue(bearing >= 0.0 && bearing < 360.0, "Bearing out of range: " + bearing);
            }
        }
    }

    @Test
    void testBearing_ReciprocalIsRoughlyOpposite() {
        double forward = Geodesy.bearing(KOKC, KDFW);
        double back = Geodesy.bearing(KDFW, KOKC);
        double diff = Math.abs(((back - forward) + 360.0) % 360.0 - 180.0);
        assertTrue(diff < 1.0, "Reciprocal bearing should be ~180 degrees off, diff was " + diff);

        // On the equator the reciprocal is exact
        GeoPoint a = new GeoPoint(0.0, 10.0);
        GeoPoint b = new GeoPoint(0.0, 40.0);
        assertEquals(90.0, Geodesy.bearing(a, b), BEARING_TOLERANCE);
        assertEquals(270.0, Geodesy.bearing(b, a), BEARING_TOLERANCE);
    }

    @Test
    void testBearing_KnownRoute() {
        // OKC to DFW heads a little east of due south
        double bearing = Geodesy.bearing(KOKC, KDFW);
        assertTrue(bearing > 165 && bearing < 175, "Expected ~169 degrees, got: " + bearing);
    }

    @Test
    void testDistanceKm_IdenticalPoints() {
        assertEquals(0.0, Geodesy.greatCircleDistanceKm(KOKC, KOKC), KM_TOLERANCE);
        assertEquals(0.0, Geodesy.greatCircleDistanceKm(EGLL, EGLL), KM_TOLERANCE);
    }

    @Test
    void testDistanceKm_Symmetry() {
        assertEquals(Geodesy.greatCircleDistanceKm(KJFK, EGLL),
                Geodesy.greatCircleDistanceKm(EGLL, KJFK), KM_TOLERANCE, "Distance should be symmetric");
    }

    @Test
    void testDistanceKm_KnownRoutes() {
        double jfkLhr = Geodesy.greatCircleDistanceKm(KJFK, EGLL);
        assertTrue(jfkLhr > 5500 && jfkLhr < 5580, "Expected ~5540 km, got: " + jfkLhr);

        double okcDfw = Geodesy.greatCircleDistanceKm(KOKC, KDFW);
        assertTrue(okcDfw > 275 && okcDfw < 290, "Expected ~282 km, got: " + okcDfw);
    }

    @Test
    void testDistanceKm_QuarterOfEquator() {
        double d = Geodesy.greatCircleDistanceKm(new GeoPoint(0, 0), new GeoPoint(0, 90));
        assertEquals(Math.PI / 2 * Geodesy.EARTH_RADIUS_KM, d, KM_TOLERANCE);
    }

    @Test
    void testDistanceNm_KnownRoute() {
        double distance = Geodesy.greatCircleDistanceNm(KOKC, KDFW);
        assertTrue(distance > 150 && distance < 155, "Expected distance between 150-155 NM, got: " + distance);
    }

    @Test
    void testNormalizeDegrees() {
        assertEquals(0.0, Geodesy.normalizeDegrees(360.0), BEARING_TOLERANCE);
        assertEquals(270.0, Geodesy.normalizeDegrees(-90.0), BEARING_TOLERANCE);
        assertEquals(10.0, Geodesy.normalizeDegrees(730.0), BEARING_TOLERANCE);
    }
}
