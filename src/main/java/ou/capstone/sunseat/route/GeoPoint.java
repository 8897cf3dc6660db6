package ou.capstone.sunseat.route;

import java.util.Locale;

/**
 * Immutable geographic point (latitude/longitude in degrees).
 * Provides basic validation and formatted output.
 */
public final class GeoPoint {

    public final double latDeg;
    public final double lonDeg;

    /**
     * Constructs a GeoPoint with validation.
     *
     * @param latDeg latitude in degrees (-90 to +90)
     * @param lonDeg longitude in degrees (-180 to +180)
     * @throws IllegalArgumentException if latitude or longitude are out of range
     */
    public GeoPoint(final double latDeg, final double lonDeg) {
        if (!(latDeg >= -90.0 && latDeg <= 90.0)) {
            throw new IllegalArgumentException("Latitude must be between -90 and +90 degrees, got: " + latDeg);
        }
        if (!(lonDeg >= -180.0 && lonDeg <= 180.0)) {
            throw new IllegalArgumentException("Longitude must be between -180 and +180 degrees, got: " + lonDeg);
        }
        // Folds -0.0 into 0.0 so equal places compare equal
        this.latDeg = latDeg + 0.0;
        this.lonDeg = lonDeg + 0.0;
    }

    /** @return latitude in degrees */
    public double getLatitude() {
        return latDeg;
    }

    /** @return longitude in degrees */
    public double getLongitude() {
        return lonDeg;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof GeoPoint other)) return false;
        return Double.compare(latDeg, other.latDeg) == 0
                && Double.compare(lonDeg, other.lonDeg) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(latDeg) + Double.hashCode(lonDeg);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.6f, %.6f)", latDeg, lonDeg);
    }
}
