package ou.capstone.sunseat.sun;

import java.time.Instant;

import ou.capstone.sunseat.route.GeoPoint;

/**
 * Low-precision solar ephemeris (NOAA / Astronomical Almanac series).
 * <p>
 * Latitude of the sub-solar point is the apparent declination of the sun;
 * longitude is right ascension minus Greenwich mean sidereal time.
 * Accurate to roughly an arc-minute over the current century, which is more
 * than enough for choosing a window seat.
 */
public final class SubSolarPointCalculator implements SunPositionProvider {

    private static final double JD_UNIX_EPOCH = 2440587.5;
    private static final double JD_J2000 = 2451545.0;
    private static final double SECONDS_PER_DAY = 86400.0;
    private static final double DAYS_PER_CENTURY = 36525.0;

    @Override
    public GeoPoint subSolarPoint(final Instant instant) {
        final double jd = julianDay(instant);
        final double n = jd - JD_J2000;
        final double t = n / DAYS_PER_CENTURY;

        // Geometric mean longitude and mean anomaly (degrees)
        final double meanLong = mod360(280.46646 + t * (36000.76983 + t * 0.0003032));
        final double meanAnom = 357.52911 + t * (35999.05029 - 0.0001537 * t);
        final double mRad = Math.toRadians(meanAnom);

        // Equation of centre
        final double centre = Math.sin(mRad) * (1.914602 - t * (0.004817 + 0.000014 * t))
                + Math.sin(2 * mRad) * (0.019993 - 0.000101 * t)
                + Math.sin(3 * mRad) * 0.000289;

        final double omega = Math.toRadians(125.04 - 1934.136 * t);
        final double apparentLong = Math.toRadians(meanLong + centre - 0.00569 - 0.00478 * Math.sin(omega));

        final double meanObliquity = 23.0 + (26.0 + (21.448
                - t * (46.815 + t * (0.00059 - t * 0.001813))) / 60.0) / 60.0;
        final double obliquity = Math.toRadians(meanObliquity + 0.00256 * Math.cos(omega));

        final double declination = Math.toDegrees(Math.asin(Math.sin(obliquity) * Math.sin(apparentLong)));
        final double rightAscension = Math.toDegrees(Math.atan2(
                Math.cos(obliquity) * Math.sin(apparentLong), Math.cos(apparentLong)));

        final double gmst = greenwichMeanSiderealDegrees(n, t);

        return new GeoPoint(declination, wrapLongitude(rightAscension - gmst));
    }

    /** Julian day number (fractional) of a UTC instant. */
    static double julianDay(final Instant instant) {
        final double seconds = instant.getEpochSecond() + instant.getNano() / 1e9;
        return JD_UNIX_EPOCH + seconds / SECONDS_PER_DAY;
    }

    /** Greenwich mean sidereal time in degrees, [0, 360). */
    static double greenwichMeanSiderealDegrees(final double daysSinceJ2000, final double centuries) {
        return mod360(280.46061837
                + 360.98564736629 * daysSinceJ2000
                + 0.000387933 * centuries * centuries
                - centuries * centuries * centuries / 38710000.0);
    }

    /**
     * Wraps a longitude into (-180, 180] using {@code (lon + 540) mod 360 - 180};
     * the single value that formula yields at -180 is reported as +180.
     */
    static double wrapLongitude(final double lonDeg) {
        final double wrapped = mod360(lonDeg + 540.0) - 180.0;
        return wrapped <= -180.0 ? 180.0 : wrapped;
    }

    private static double mod360(final double deg) {
        final double d = deg % 360.0;
        final double n = d < 0 ? d + 360.0 : d;
        return n >= 360.0 ? 0.0 : n;
    }
}
