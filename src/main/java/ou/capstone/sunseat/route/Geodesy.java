package ou.capstone.sunseat.route;

/**
 * Spherical-earth helpers: initial bearing and great-circle distance.
 * Inputs are degrees; all trigonometry is done in radians.
 */
public final class Geodesy {

    // Earth radius (kilometres)
    public static final double EARTH_RADIUS_KM = 6371.0;

    // Earth radius (nautical miles)
    public static final double EARTH_RADIUS_NM = 3440.065;

    private Geodesy() {
        // Prevent instantiation
    }

    /**
     * Initial bearing (forward azimuth) from one point to another.
     *
     * @return degrees clockwise from true north, in [0, 360)
     */
    public static double bearing(final GeoPoint from, final GeoPoint to) {
        final double lat1 = Math.toRadians(from.latDeg);
        final double lat2 = Math.toRadians(to.latDeg);
        final double dLon = Math.toRadians(to.lonDeg - from.lonDeg);

        final double y = Math.sin(dLon) * Math.cos(lat2);
        final double x = Math.cos(lat1) * Math.sin(lat2)
                - Math.sin(lat1) * Math.cos(lat2) * Math.cos(dLon);

        return normalizeDegrees(Math.toDegrees(Math.atan2(y, x)));
    }

    /** Great-circle distance in kilometres (haversine). */
    public static double greatCircleDistanceKm(final GeoPoint a, final GeoPoint b) {
        return EARTH_RADIUS_KM * centralAngleRad(a, b);
    }

    /** Great-circle distance in nautical miles. */
    public static double greatCircleDistanceNm(final GeoPoint a, final GeoPoint b) {
        return EARTH_RADIUS_NM * centralAngleRad(a, b);
    }

    /** Central angle (radians) between two points via Haversine formula. */
    private static double centralAngleRad(final GeoPoint a, final GeoPoint b) {
        final double lat1 = Math.toRadians(a.latDeg);
        final double lat2 = Math.toRadians(b.latDeg);
        final double dLat = lat2 - lat1;
        final double dLon = Math.toRadians(b.lonDeg - a.lonDeg);

        final double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        // Clamp to avoid NaN from rounding
        return 2 * Math.asin(Math.sqrt(Math.min(1.0, h)));
    }

    /** Maps any angle into [0, 360). */
    static double normalizeDegrees(final double deg) {
        final double d = deg % 360.0;
        final double n = d < 0 ? d + 360.0 : d;
        return n >= 360.0 ? 0.0 : n;
    }
}
